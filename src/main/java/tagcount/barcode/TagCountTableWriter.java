package tagcount.barcode;

import htsjdk.samtools.util.RuntimeIOException;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Writes a {@link TagCountMatrix} as a comma separated table:
 *
 * <pre>
 * "barcode","gene",sample1,sample2
 * "no_match","",3,0
 * "aaaaaaaa","geneA",1,4
 * </pre>
 *
 * The no_match row comes first, the remaining rows are ordered by their barcode column and the sample columns are in
 * lexicographic order.  Unless rows are kept per tag, the counts of barcodes that share a gene are summed into one
 * row whose barcode column lists those barcodes separated by {@value #BARCODE_SEPARATOR}.
 */
public class TagCountTableWriter {
    public static final String BARCODE_SEPARATOR = ";";

    private final BarcodeReference reference;
    private final boolean byTag;

    /**
     * @param byTag if true every barcode gets its own row, otherwise rows are per gene
     */
    public TagCountTableWriter(final BarcodeReference reference, final boolean byTag) {
        this.reference = reference;
        this.byTag = byTag;
    }

    /** One output line. */
    public static class TableRow {
        private final String barcodes;
        private final String gene;
        private final long[] counts;

        TableRow(final String barcodes, final String gene, final long[] counts) {
            this.barcodes = barcodes;
            this.gene = gene;
            this.counts = counts;
        }

        public String getBarcodes() { return barcodes; }

        public String getGene() { return gene; }

        /** @return counts in the order of {@link TagCountMatrix#getSamples()} */
        public long[] getCounts() { return counts; }
    }

    /**
     * @return the table rows, in output order
     */
    public List<TableRow> buildRows(final TagCountMatrix matrix) {
        final List<String> samples = new ArrayList<>(matrix.getSamples());

        // Group keys; the matrix hands them out no_match first, then sorted, so each group's barcodes are sorted too.
        final Map<String, List<String>> groups = new LinkedHashMap<>();
        for (final String key : matrix.getKeys()) {
            final String gene = key.equals(TagCountMatrix.NO_MATCH) ? null : reference.getGene(key);
            final String groupKey = byTag || gene == null ? "key:" + key : "gene:" + gene;
            groups.computeIfAbsent(groupKey, k -> new ArrayList<>()).add(key);
        }

        final TreeSet<TableRow> rows = new TreeSet<>((a, b) -> TagCountMatrix.KEY_ORDER.compare(a.getBarcodes(), b.getBarcodes()));
        for (final List<String> keys : groups.values()) {
            final long[] counts = new long[samples.size()];
            for (final String key : keys) {
                for (int i = 0; i < samples.size(); ++i) {
                    counts[i] += matrix.getCount(key, samples.get(i));
                }
            }
            final String first = keys.get(0);
            final String gene = first.equals(TagCountMatrix.NO_MATCH) ? null : reference.getGene(first);
            rows.add(new TableRow(String.join(BARCODE_SEPARATOR, keys), gene == null ? "" : gene, counts));
        }
        return new ArrayList<>(rows);
    }

    public void write(final TagCountMatrix matrix, final Writer out) {
        try {
            out.write(quote("barcode") + "," + quote("gene"));
            for (final String sample : matrix.getSamples()) {
                out.write("," + sample);
            }
            out.write("\n");

            for (final TableRow row : buildRows(matrix)) {
                out.write(quote(row.getBarcodes()) + "," + quote(row.getGene()));
                for (final long count : row.getCounts()) {
                    out.write("," + count);
                }
                out.write("\n");
            }
            out.flush();
        } catch (final IOException e) {
            throw new RuntimeIOException("Error writing barcode count table", e);
        }
    }

    private static String quote(final String field) {
        return "\"" + field.replace("\"", "\"\"") + "\"";
    }
}
