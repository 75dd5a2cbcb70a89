package tagcount.util.help;

public final class HelpConstants {

    private HelpConstants() {}

    /**
     * Definition of the group names / descriptions for documentation/help purposes.
     */
    public final static String DOC_CAT_TAG_COUNTING = "Barcode Tag Counting Tools";
    public final static String DOC_CAT_TAG_COUNTING_SUMMARY = "Tools for locating and counting designed barcode tags in fastq reads";

    public final static String DOC_CAT_METRICS = "Metrics";
    public final static String DOC_CAT_METRICS_SUMMARY = "Metrics definitions";
}
