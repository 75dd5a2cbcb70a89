package tagcount.barcode;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.fastq.FastqReader;
import htsjdk.samtools.fastq.FastqRecord;
import htsjdk.samtools.fastq.FastqWriter;
import htsjdk.samtools.fastq.FastqWriterFactory;
import htsjdk.samtools.metrics.MetricsFile;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.ProgressLogger;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;
import tagcount.TagCountException;
import tagcount.cmdline.CommandLineProgram;
import tagcount.cmdline.StandardOptionDefinitions;
import tagcount.cmdline.programgroups.TagCountingProgramGroup;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileFilter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counts barcode tags in a directory of fastq files, one file per sample.
 */
@CommandLineProgramProperties(
        summary = CountBarcodeTags.USAGE_SUMMARY + CountBarcodeTags.USAGE_DETAILS,
        oneLineSummary = CountBarcodeTags.USAGE_SUMMARY,
        programGroup = TagCountingProgramGroup.class)
@DocumentedFeature
public class CountBarcodeTags extends CommandLineProgram {
    static final String USAGE_SUMMARY = "Counts barcode tags per sample from a directory of fastq files";
    static final String USAGE_DETAILS = "<p>Sample names are extracted from the fastq file names (everything up to and including " +
            "the digits before the .fastq extension) and a table is generated with the counts of each barcode of the barcode " +
            "list that occurs at least once, for each of the samples (libraries).</p>" +
            "<p>A tag is found by the five bases of sequence context directly adjacent to it on either side, on the forward " +
            "or the reverse strand. Reads in which not exactly one known barcode is found are counted as 'no_match'.</p>" +
            "<h3>Barcode table</h3>" +
            "<p>A comma separated file with a header line, a gene id column (\"gene id\" or \"gene_id\") and a barcode " +
            "column (\"tag\", \"Barcode\" or \"barcode\"), e.g.</p>" +
            "<pre>" +
            "gene_id,barcode\n" +
            "PBANKA_000010,ttcgccgggcc\n" +
            "PBANKA_000030,caggcaatcgg\n" +
            "</pre>" +
            "<h3>Usage example</h3>" +
            "<pre>" +
            "java -jar tagcount.jar CountBarcodeTags \\\n" +
            "      --SEQ_DIR fastq_dir \\\n" +
            "      --BARCODES barcodes.csv \\\n" +
            "      --OUTPUT counts.csv" +
            "</pre>";

    private static final Log log = Log.getInstance(CountBarcodeTags.class);

    /** Read files are those ending in ".fastq", optionally gzipped. */
    static final FileFilter FASTQ_FILTER = f -> f.isFile() && (f.getName().endsWith(".fastq") || f.getName().endsWith(".fastq.gz"));

    @Argument(doc = "Directory of fastq files, one per sample.")
    public File SEQ_DIR;

    @Argument(doc = "Comma separated table mapping gene ids to barcodes, with a header line naming a gene id column " +
            "(\"gene id\" or \"gene_id\") and a barcode column (\"tag\", \"Barcode\" or \"barcode\").")
    public File BARCODES;

    @Argument(doc = "Usually each tag corresponds to one gene and counts are combined if there is more than one tag for " +
            "the same gene. If true, counts are separated by tag even if they map to the same gene.")
    public boolean BY_TAG = false;

    @Argument(doc = "Sequence context 5' of the tag, in the orientation of the barcodes table. Only the last " +
            PrimerContext.ANCHOR_LENGTH + " bases are used. The default is the BA primer.")
    public String FIVE_P_SEQ = PrimerContext.DEFAULT_FIVE_PRIME_CONTEXT;

    @Argument(doc = "Sequence context 3' of the tag, in the orientation of the barcodes table. Only the first " +
            PrimerContext.ANCHOR_LENGTH + " bases are used. The default is the R2 to amp97 cassette sequence.")
    public String THREE_P_SEQ = PrimerContext.DEFAULT_THREE_PRIME_CONTEXT;

    @Argument(doc = "Skip rows of the barcodes table that have no barcode instead of failing. Allows design tables with " +
            "empty barcodes to be used as barcode lists.")
    public boolean IGNORE_MISSING_TAG = false;

    @Argument(doc = "If given, reads that do not match any barcode, or match more than one, are written to this fastq file.",
            optional = true)
    public File NOMATCH_OUT_FILE;

    @Argument(shortName = StandardOptionDefinitions.OUTPUT_SHORT_NAME,
            doc = "The count table to write. Written to standard output if not given.", optional = true)
    public File OUTPUT;

    @Argument(shortName = StandardOptionDefinitions.METRICS_FILE_SHORT_NAME,
            doc = "Per-sample matching metrics written to this file.", optional = true)
    public File METRICS_FILE;

    private final FastqWriterFactory fastqWriterFactory = new FastqWriterFactory();

    @Override
    protected String[] customCommandLineValidation() {
        final List<String> messages = new ArrayList<>();
        final String fivePrimeProblem = PrimerContext.validateContext(FIVE_P_SEQ, "FIVE_P_SEQ (BA primer)");
        if (fivePrimeProblem != null) messages.add(fivePrimeProblem);
        final String threePrimeProblem = PrimerContext.validateContext(THREE_P_SEQ, "THREE_P_SEQ (R2-amp97)");
        if (threePrimeProblem != null) messages.add(threePrimeProblem);
        return messages.isEmpty() ? null : messages.toArray(new String[0]);
    }

    @Override
    protected int doWork() {
        IOUtil.assertDirectoryIsReadable(SEQ_DIR);
        IOUtil.assertFileIsReadable(BARCODES);
        if (OUTPUT != null) IOUtil.assertFileIsWritable(OUTPUT);
        if (NOMATCH_OUT_FILE != null) IOUtil.assertFileIsWritable(NOMATCH_OUT_FILE);
        if (METRICS_FILE != null) IOUtil.assertFileIsWritable(METRICS_FILE);

        final BarcodeReference reference = BarcodeReference.fromFile(BARCODES, IGNORE_MISSING_TAG);
        final PrimerContext context = new PrimerContext(FIVE_P_SEQ, THREE_P_SEQ);
        log.info("Searching for tags with anchors ", context);
        final TagMatcher matcher = new TagMatcher(reference, context);

        // Resolve every sample name up front so that a bad file name fails before anything is written
        final Map<File, String> fastqToSample = findSampleFastqs(SEQ_DIR);
        if (fastqToSample.isEmpty()) {
            log.warn("No fastq files found in ", SEQ_DIR);
        }

        final TagCountMatrix counts = new TagCountMatrix();
        final Map<String, TagCountMetric> metrics = new TreeMap<>();
        final FastqWriter noMatchWriter = NOMATCH_OUT_FILE == null ? null : fastqWriterFactory.newWriter(NOMATCH_OUT_FILE);
        try {
            for (final Map.Entry<File, String> entry : fastqToSample.entrySet()) {
                final String sample = entry.getValue();
                final TagCountMetric metric = metrics.computeIfAbsent(sample, TagCountMetric::new);
                counts.merge(countTags(entry.getKey(), sample, matcher, metric, noMatchWriter));
            }
        } finally {
            if (noMatchWriter != null) noMatchWriter.close();
        }

        writeTable(new TagCountTableWriter(reference, BY_TAG), counts);

        if (METRICS_FILE != null) {
            final MetricsFile<TagCountMetric, Integer> metricsFile = getMetricsFile();
            for (final TagCountMetric metric : metrics.values()) {
                metric.calculateDerivedFields();
                metricsFile.addMetric(metric);
            }
            metricsFile.write(METRICS_FILE);
        }
        return 0;
    }

    /**
     * @return the fastq files of the directory, in name order, each with its sample name
     * @throws TagCountException if any file name does not yield a sample name
     */
    static Map<File, String> findSampleFastqs(final File seqDir) {
        final File[] files = seqDir.listFiles(FASTQ_FILTER);
        if (files == null) {
            throw new TagCountException("Could not list the files of " + seqDir);
        }
        Arrays.sort(files, Comparator.comparing(File::getName));

        final Map<File, String> fastqToSample = new LinkedHashMap<>();
        for (final File fastq : files) {
            fastqToSample.put(fastq, SampleNameParser.parseSampleName(fastq));
        }
        return fastqToSample;
    }

    /**
     * Classifies every read of one fastq file.
     *
     * @param noMatchWriter receives the reads not assigned to a barcode, may be null
     * @return the counts of this file, all under the given sample
     */
    TagCountMatrix countTags(final File fastq, final String sample, final TagMatcher matcher,
                             final TagCountMetric metric, final FastqWriter noMatchWriter) {
        log.info("Reading file ", fastq.getName(), " for sample ", sample);
        final TagCountMatrix counts = new TagCountMatrix();
        counts.addSample(sample);

        final ProgressLogger progress = new ProgressLogger(log, 1000000, "Processed", "reads");
        try (final FastqReader reader = new FastqReader(fastq, true)) {
            for (final FastqRecord record : reader) {
                final String bases = record.getReadString();
                final TagMatch match = matcher.classify(bases);
                metric.record(match);
                counts.increment(match.getKey(), sample);

                if (!match.isMatched()) {
                    if (match.getStatus() == TagMatch.Status.AMBIGUOUS) {
                        log.warn("Found ", match.getKnownCandidates(), " matching tags in sequence ", bases,
                                " - counting as '", TagCountMatrix.NO_MATCH, "'");
                    }
                    log.debug("NOMATCH ", bases);
                    if (noMatchWriter != null) noMatchWriter.write(record);
                }
                progress.record(null, 0);
            }
        } catch (final SAMException e) {
            // FastqReader rejects empty reads and reads whose quality length differs from the sequence length
            throw new TagCountException("Could not process fastq file " + fastq + " (sample " + sample + "): " + e.getMessage(), e);
        }
        log.info(sample, ": ", metric.MATCHED_READS, " of ", metric.READS, " reads matched a barcode");
        return counts;
    }

    private void writeTable(final TagCountTableWriter tableWriter, final TagCountMatrix counts) {
        if (OUTPUT == null) {
            final Writer out = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
            tableWriter.write(counts, out);
        } else {
            try (final BufferedWriter out = IOUtil.openFileForBufferedWriting(OUTPUT)) {
                tableWriter.write(counts, out);
            } catch (final IOException e) {
                throw new TagCountException("Error writing " + OUTPUT, e);
            }
        }
    }
}
