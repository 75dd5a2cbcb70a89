package tagcount.barcode;

import htsjdk.samtools.metrics.MetricBase;
import org.broadinstitute.barclay.help.DocumentedFeature;
import tagcount.util.help.HelpConstants;

/**
 * Metrics produced by CountBarcodeTags, one per sample, describing how many reads could be assigned to a barcode.
 */
@DocumentedFeature(groupName = HelpConstants.DOC_CAT_METRICS, summary = HelpConstants.DOC_CAT_METRICS_SUMMARY)
public class TagCountMetric extends MetricBase {
    /** The sample the reads belong to. */
    public String SAMPLE;
    /** The total number of reads in the sample. */
    public long READS = 0;
    /** The number of reads in which exactly one known barcode was found. */
    public long MATCHED_READS = 0;
    /** The number of reads in which no anchored candidate was a known barcode. */
    public long NO_CANDIDATE_READS = 0;
    /** The number of reads in which more than one anchored candidate was a known barcode. */
    public long AMBIGUOUS_READS = 0;
    /** MATCHED_READS / READS */
    public double PCT_MATCHED = 0d;

    public TagCountMetric(final String sample) {
        this.SAMPLE = sample;
    }

    /**
     * This ctor is necessary for when reading metrics from file
     */
    public TagCountMetric() {
    }

    public void record(final TagMatch match) {
        ++READS;
        switch (match.getStatus()) {
            case MATCHED:
                ++MATCHED_READS;
                break;
            case AMBIGUOUS:
                ++AMBIGUOUS_READS;
                break;
            default:
                ++NO_CANDIDATE_READS;
        }
    }

    public void calculateDerivedFields() {
        if (READS > 0) {
            PCT_MATCHED = MATCHED_READS / (double) READS;
        }
    }
}
