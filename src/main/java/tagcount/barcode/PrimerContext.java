package tagcount.barcode;

import htsjdk.samtools.util.SequenceUtil;
import tagcount.TagCountException;

import java.util.Locale;

/**
 * The sequence context around a barcode tag in the amplicon, reduced to the {@value #ANCHOR_LENGTH} bases directly
 * adjacent to the tag on either side.  Only the anchors are searched for, so the amplicon may be longer or shorter
 * than the context sequences given.
 *
 * Both context sequences are in the orientation of the barcodes in the barcode table.
 */
public class PrimerContext {
    public static final int ANCHOR_LENGTH = 5;

    /** The tag amplification primer (BA primer). */
    public static final String DEFAULT_FIVE_PRIME_CONTEXT = "GTAATTCGTGCGCGTCAG";

    /** Sequence from cassette primer R2 to the primer binding site for arg97, the same for all constructs. */
    public static final String DEFAULT_THREE_PRIME_CONTEXT =
            "CCGCCTACTGCGACTATAGAGATATCAACCACTTTGTACAAGAAAGCTGGGTGGTACCCATCGAAATTGAAGG";

    private final String fivePrimeAnchor;
    private final String threePrimeAnchor;
    private final String fivePrimeAnchorRc;
    private final String threePrimeAnchorRc;

    public PrimerContext() {
        this(DEFAULT_FIVE_PRIME_CONTEXT, DEFAULT_THREE_PRIME_CONTEXT);
    }

    /**
     * @param fivePrimeContext  sequence 5' of the tag; its last bases form the 5' anchor
     * @param threePrimeContext sequence 3' of the tag; its first bases form the 3' anchor
     * @throws TagCountException if either sequence is shorter than {@value #ANCHOR_LENGTH} bases
     */
    public PrimerContext(final String fivePrimeContext, final String threePrimeContext) {
        checkContext(fivePrimeContext, "5' context sequence");
        checkContext(threePrimeContext, "3' context sequence");

        this.fivePrimeAnchor = fivePrimeContext.substring(fivePrimeContext.length() - ANCHOR_LENGTH).toUpperCase(Locale.ROOT);
        this.threePrimeAnchor = threePrimeContext.substring(0, ANCHOR_LENGTH).toUpperCase(Locale.ROOT);
        this.fivePrimeAnchorRc = SequenceUtil.reverseComplement(fivePrimeAnchor);
        this.threePrimeAnchorRc = SequenceUtil.reverseComplement(threePrimeAnchor);
    }

    /** @return null if the context sequence can be used, otherwise a message saying why not. */
    public static String validateContext(final String context, final String description) {
        if (context == null || context.length() < ANCHOR_LENGTH) {
            return String.format("%s must be at least %d bases long, got: %s", description, ANCHOR_LENGTH, context);
        }
        return null;
    }

    private static void checkContext(final String context, final String description) {
        final String problem = validateContext(context, description);
        if (problem != null) throw new TagCountException(problem);
    }

    /** Upper case 5' anchor, on the barcode strand. */
    public String getFivePrimeAnchor() {
        return fivePrimeAnchor;
    }

    /** Upper case 3' anchor, on the barcode strand. */
    public String getThreePrimeAnchor() {
        return threePrimeAnchor;
    }

    public String getFivePrimeAnchorRc() {
        return fivePrimeAnchorRc;
    }

    public String getThreePrimeAnchorRc() {
        return threePrimeAnchorRc;
    }

    @Override
    public String toString() {
        return fivePrimeAnchor + "[tag]" + threePrimeAnchor + " / " + threePrimeAnchorRc + "[tag]" + fivePrimeAnchorRc;
    }
}
