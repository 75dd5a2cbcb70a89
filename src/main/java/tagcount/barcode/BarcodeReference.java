package tagcount.barcode;

import htsjdk.samtools.util.Log;
import tagcount.TagCountException;
import tagcount.util.DelimitedTextFileWithHeaderIterator;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The set of designed barcode tags and the gene each one identifies.  Barcodes are held in lower case and every
 * lookup is case-insensitive.
 *
 * A barcode that appears on more than one row keeps the gene of the last row; a warning is logged when that
 * changes the gene.
 */
public class BarcodeReference {
    private static final Log log = Log.getInstance(BarcodeReference.class);

    public static final int MIN_BARCODE_LENGTH = 8;
    public static final int MAX_BARCODE_LENGTH = 16;

    /** Barcode value used in design tables for a gene without a tag. */
    public static final String NO_TAG = "none";

    /** Accepted headers for the gene id column, in order of preference. */
    public static final List<String> GENE_ID_COLUMNS = Collections.unmodifiableList(Arrays.asList("gene id", "gene_id"));
    /** Accepted headers for the barcode column, in order of preference. */
    public static final List<String> BARCODE_COLUMNS = Collections.unmodifiableList(Arrays.asList("tag", "Barcode", "barcode"));

    private final Map<String, String> barcodeToGene;

    private BarcodeReference(final Map<String, String> barcodeToGene) {
        this.barcodeToGene = Collections.unmodifiableMap(barcodeToGene);
    }

    /** One row of a barcode table. Either value may be null. */
    public static class Entry {
        private final String geneId;
        private final String barcode;
        private final String source;

        public Entry(final String geneId, final String barcode) {
            this(geneId, barcode, geneId + "," + barcode);
        }

        public Entry(final String geneId, final String barcode, final String source) {
            this.geneId = geneId;
            this.barcode = barcode;
            this.source = source;
        }

        public String getGeneId() { return geneId; }

        public String getBarcode() { return barcode; }

        /** Text of the row, used in error messages. */
        public String getSource() { return source; }
    }

    /**
     * Builds the reference from table rows.
     *
     * @param rows                 rows in file order
     * @param allowMissingBarcodes if true rows without a barcode are skipped, otherwise they are an error
     * @throws TagCountException on a row without gene id, a row without barcode when those are not allowed, a
     *                           barcode whose length is outside [{@value #MIN_BARCODE_LENGTH}, {@value #MAX_BARCODE_LENGTH}]
     *                           or the barcode {@value TagCountMatrix#NO_MATCH}
     */
    public static BarcodeReference load(final Iterable<Entry> rows, final boolean allowMissingBarcodes) {
        final Map<String, String> barcodeToGene = new HashMap<>();
        for (final Entry row : rows) {
            if (isBlank(row.getGeneId())) {
                throw new TagCountException("Could not read gene id in barcode table row: " + row.getSource());
            }
            final String barcode = row.getBarcode();
            if (isBlank(barcode)) {
                if (allowMissingBarcodes) continue;
                throw new TagCountException("Could not read barcode tag in barcode table row: " + row.getSource());
            }
            if (barcode.equalsIgnoreCase(NO_TAG)) continue;

            if (barcode.length() < MIN_BARCODE_LENGTH || barcode.length() > MAX_BARCODE_LENGTH) {
                throw new TagCountException(String.format("Found a barcode outside allowed length range (%d-%d): %s, length: %d",
                        MIN_BARCODE_LENGTH, MAX_BARCODE_LENGTH, barcode, barcode.length()));
            }

            final String key = normalize(barcode);
            if (key.equals(TagCountMatrix.NO_MATCH)) {
                throw new TagCountException("Barcode '" + barcode + "' is reserved for unmatched reads, in barcode table row: " + row.getSource());
            }
            final String previous = barcodeToGene.put(key, row.getGeneId());
            if (previous != null && !previous.equals(row.getGeneId())) {
                log.warn("Barcode ", key, " is listed for both ", previous, " and ", row.getGeneId(), "; counting it for ", row.getGeneId());
            }
        }
        return new BarcodeReference(barcodeToGene);
    }

    /**
     * Reads a comma-delimited barcode table with a header line.  The gene id is taken from the first non-empty of
     * the {@link #GENE_ID_COLUMNS} and the barcode from the first non-empty of the {@link #BARCODE_COLUMNS} present.
     */
    public static BarcodeReference fromFile(final File barcodeTable, final boolean allowMissingBarcodes) {
        final List<Entry> rows = new ArrayList<>();
        try (final DelimitedTextFileWithHeaderIterator parser =
                     new DelimitedTextFileWithHeaderIterator(barcodeTable, DelimitedTextFileWithHeaderIterator.COMMA)) {
            final List<String> geneColumns = presentColumns(parser, GENE_ID_COLUMNS);
            final List<String> barcodeColumns = presentColumns(parser, BARCODE_COLUMNS);
            if (geneColumns.isEmpty()) {
                throw new TagCountException("No gene id column (" + String.join(", ", GENE_ID_COLUMNS) + ") found in " + barcodeTable);
            }
            while (parser.hasNext()) {
                final DelimitedTextFileWithHeaderIterator.Row row = parser.next();
                rows.add(new Entry(firstNonBlank(row, geneColumns), firstNonBlank(row, barcodeColumns),
                        "line " + row.getLineNumber() + ": " + row.getCurrentLine()));
            }
        }
        final BarcodeReference reference = load(rows, allowMissingBarcodes);
        log.info("Loaded ", reference.size(), " barcodes from ", barcodeTable);
        return reference;
    }

    /** @return true if the barcode, in any case, is a known tag. */
    public boolean contains(final String barcode) {
        return barcode != null && barcodeToGene.containsKey(normalize(barcode));
    }

    /** @return the gene for the barcode, in any case, or null if the barcode is not known. */
    public String getGene(final String barcode) {
        return barcode == null ? null : barcodeToGene.get(normalize(barcode));
    }

    public int size() {
        return barcodeToGene.size();
    }

    /** @return unmodifiable map from lower case barcode to gene id. */
    public Map<String, String> asMap() {
        return barcodeToGene;
    }

    static String normalize(final String barcode) {
        return barcode.toLowerCase(Locale.ROOT);
    }

    private static List<String> presentColumns(final DelimitedTextFileWithHeaderIterator parser, final List<String> aliases) {
        final List<String> present = new ArrayList<>();
        for (final String alias : aliases) {
            if (parser.hasColumn(alias)) present.add(alias);
        }
        return present;
    }

    private static String firstNonBlank(final DelimitedTextFileWithHeaderIterator.Row row, final List<String> columns) {
        for (final String column : columns) {
            final String value = row.getField(column);
            if (!isBlank(value)) return value.trim();
        }
        return null;
    }

    private static boolean isBlank(final String value) {
        return value == null || value.trim().isEmpty();
    }
}
