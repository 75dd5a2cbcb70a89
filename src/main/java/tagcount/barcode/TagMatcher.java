package tagcount.barcode;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.SequenceUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * TagMatcher finds the barcode tag in a read.
 *
 * A candidate is any run of {@value BarcodeReference#MIN_BARCODE_LENGTH} to {@value BarcodeReference#MAX_BARCODE_LENGTH}
 * word characters between the 5' and 3' anchors of the {@link PrimerContext}.  The read is searched on the forward
 * strand for 5'anchor-tag-3'anchor and for the reverse complement of that pattern, whose hits are reverse complemented
 * back onto the barcode strand.  The anchors are short enough to match by chance, so a read is assigned only when
 * exactly one candidate is a known barcode.
 *
 * Each scan reports hits the way a global regular expression match of {@code anchor(\w{8,16})anchor} would: the
 * leftmost start wins, the longest tag wins at a given start, and the next search resumes after the closing anchor.
 */
public class TagMatcher {
    private final BarcodeReference reference;
    private final PrimerContext context;

    public TagMatcher(final BarcodeReference reference, final PrimerContext context) {
        this.reference = reference;
        this.context = context;
    }

    /**
     * Classifies one read.
     *
     * @param readBases the read sequence, in any case
     */
    public TagMatch classify(final String readBases) {
        final List<String> candidates = findCandidates(readBases);

        final List<String> known = new ArrayList<>();
        for (final String candidate : candidates) {
            if (reference.contains(candidate)) known.add(candidate);
        }

        if (known.size() == 1) {
            return new TagMatch(TagMatch.Status.MATCHED, known.get(0), candidates, 1);
        } else if (known.isEmpty()) {
            return new TagMatch(TagMatch.Status.NO_MATCH, null, candidates, 0);
        } else {
            return new TagMatch(TagMatch.Status.AMBIGUOUS, null, candidates, known.size());
        }
    }

    /**
     * @return all anchored candidates in the read, lower case and on the barcode strand, forward strand hits first.
     */
    public List<String> findCandidates(final String readBases) {
        final String read = readBases.toUpperCase(Locale.ROOT);
        final List<String> candidates = new ArrayList<>();

        for (final String tag : scan(read, context.getFivePrimeAnchor(), context.getThreePrimeAnchor())) {
            candidates.add(BarcodeReference.normalize(tag));
        }
        for (final String tag : scan(read, context.getThreePrimeAnchorRc(), context.getFivePrimeAnchorRc())) {
            candidates.add(BarcodeReference.normalize(SequenceUtil.reverseComplement(tag)));
        }
        return candidates;
    }

    /**
     * Finds every non-overlapping left-tag-right occurrence.  All arguments must be in the same case.
     */
    @VisibleForTesting
    static List<String> scan(final String read, final String left, final String right) {
        final List<String> tags = new ArrayList<>();
        final int minimumHit = left.length() + BarcodeReference.MIN_BARCODE_LENGTH + right.length();

        int pos = 0;
        while (pos + minimumHit <= read.length()) {
            final int tagLength = read.startsWith(left, pos) ? longestTagAt(read, pos + left.length(), right) : -1;
            if (tagLength < 0) {
                ++pos;
                continue;
            }
            final int tagStart = pos + left.length();
            tags.add(read.substring(tagStart, tagStart + tagLength));
            pos = tagStart + tagLength + right.length();
        }
        return tags;
    }

    /** @return the longest tag length at tagStart that is followed by the right anchor, or -1 if there is none. */
    private static int longestTagAt(final String read, final int tagStart, final String right) {
        int wordRun = 0;
        while (wordRun < BarcodeReference.MAX_BARCODE_LENGTH && tagStart + wordRun < read.length()
                && isWordCharacter(read.charAt(tagStart + wordRun))) {
            ++wordRun;
        }
        for (int length = wordRun; length >= BarcodeReference.MIN_BARCODE_LENGTH; --length) {
            if (read.startsWith(right, tagStart + length)) return length;
        }
        return -1;
    }

    private static boolean isWordCharacter(final char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
    }
}
