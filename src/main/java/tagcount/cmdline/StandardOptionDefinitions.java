package tagcount.cmdline;

/**
 * A set of String constants in which the name of the constant (minus the _SHORT_NAME suffix)
 * is the standard long Option name, and the value of the constant is the standard shortName.
 */
public class StandardOptionDefinitions {
    public static final String OUTPUT_SHORT_NAME = "O";
    public static final String METRICS_FILE_SHORT_NAME = "M";
}
