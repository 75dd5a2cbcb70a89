package tagcount.barcode;

import java.util.Collections;
import java.util.List;

/**
 * The result of looking for a barcode tag in one read.  A read is matched only when exactly one anchored candidate
 * is a known barcode; everything else is counted as {@link TagCountMatrix#NO_MATCH}.
 */
public class TagMatch {

    public enum Status {
        /** Exactly one candidate is a known barcode. */
        MATCHED,
        /** No candidate is a known barcode, including reads without any anchored candidate. */
        NO_MATCH,
        /** More than one candidate is a known barcode. */
        AMBIGUOUS
    }

    private final Status status;
    private final String barcode;
    private final List<String> candidates;
    private final int knownCandidates;

    TagMatch(final Status status, final String barcode, final List<String> candidates, final int knownCandidates) {
        this.status = status;
        this.barcode = barcode;
        this.candidates = Collections.unmodifiableList(candidates);
        this.knownCandidates = knownCandidates;
    }

    public boolean isMatched() {
        return status == Status.MATCHED;
    }

    public Status getStatus() {
        return status;
    }

    /** @return the lower case barcode if matched, otherwise null. */
    public String getBarcode() {
        return barcode;
    }

    /** @return the counting key: the barcode if matched, otherwise {@link TagCountMatrix#NO_MATCH}. */
    public String getKey() {
        return isMatched() ? barcode : TagCountMatrix.NO_MATCH;
    }

    /** @return every anchored candidate, lower case and on the barcode strand, forward hits first. */
    public List<String> getCandidates() {
        return candidates;
    }

    /** @return how many of the candidates are known barcodes, counting repeats. */
    public int getKnownCandidates() {
        return knownCandidates;
    }

    @Override
    public String toString() {
        return status + (isMatched() ? ":" + barcode : "") + " candidates=" + candidates;
    }
}
