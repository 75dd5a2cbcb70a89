package tagcount.cmdline;

/**
 * Embodies defaults for global values that affect how the tagcount command line operates. Defaults are encoded in
 * the class and are also overridable using system properties.
 */
public class CommandLineDefaults {

    /**
     * Decides if we want to write colors to the terminal.
     */
    public static final boolean COLOR_STATUS;

    static {
        COLOR_STATUS = getBooleanProperty("color_status", true);
    }

    /** Gets a string system property, prefixed with "tagcount.cmdline." using the default if the property does not exist. */
    private static String getStringProperty(final String name, final String def) {
        return System.getProperty("tagcount.cmdline." + name, def);
    }

    /** Gets a boolean system property, prefixed with "tagcount.cmdline." using the default if the property does not exist. */
    private static boolean getBooleanProperty(final String name, final boolean def) {
        final String value = getStringProperty(name, Boolean.toString(def));
        return Boolean.parseBoolean(value);
    }
}
