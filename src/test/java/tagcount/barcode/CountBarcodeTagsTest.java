package tagcount.barcode;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.fastq.FastqReader;
import htsjdk.samtools.fastq.FastqRecord;
import htsjdk.samtools.metrics.MetricsFile;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;
import tagcount.TagCountException;
import tagcount.cmdline.CommandLineProgramTest;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPOutputStream;

public class CountBarcodeTagsTest extends CommandLineProgramTest {
    private static final File TEST_DIR = new File(TEST_DATA_DIR, "barcode");
    private static final File SEQ_DIR = new File(TEST_DIR, "seq_dir");
    private static final File BARCODES = new File(TEST_DIR, "barcodes.csv");

    @Override
    public String getCommandLineProgramName() {
        return CountBarcodeTags.class.getSimpleName();
    }

    private File writeFastq(final File dir, final String name, final String... bases) throws IOException {
        final List<String> lines = new ArrayList<>();
        for (int i = 0; i < bases.length; ++i) {
            lines.add("@read" + (i + 1));
            lines.add(bases[i]);
            lines.add("+");
            lines.add(new String(new char[bases[i].length()]).replace('\0', 'I'));
        }
        final File fastq = new File(dir, name);
        Files.write(fastq.toPath(), lines, StandardCharsets.UTF_8);
        return fastq;
    }

    private File newDir(final String name) {
        final File dir = new File(getTempOutputDir(), name);
        Assert.assertTrue(dir.mkdirs());
        return dir;
    }

    private static List<String> readLines(final File file) throws IOException {
        return Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
    }

    private List<String> run(final File seqDir, final File barcodes, final String... extraArgs) throws IOException {
        final File output = getTempOutputFile("CountBarcodeTags", ".csv");
        final List<String> args = new ArrayList<>(Arrays.asList(
                "--SEQ_DIR", seqDir.getAbsolutePath(),
                "--BARCODES", barcodes.getAbsolutePath(),
                "--OUTPUT", output.getAbsolutePath()));
        args.addAll(Arrays.asList(extraArgs));
        Assert.assertEquals(runCommandLine(args), 0);
        return readLines(output);
    }

    @Test
    public void testSingleSample() throws IOException {
        final File seqDir = newDir("single");
        writeFastq(seqDir, "s1.fastq", "GTCAGaaaaaaaaCCGCC", "ACGTACGTACGTACGT", "TTTTTTTTTTTTTTTT", "GGGGGGGGGGGGGGGG");
        final File barcodes = new File(getTempOutputDir(), "single.csv");
        Files.write(barcodes.toPath(), Arrays.asList("gene_id,barcode", "geneA,aaaaaaaa"), StandardCharsets.UTF_8);

        Assert.assertEquals(run(seqDir, barcodes), Arrays.asList(
                "\"barcode\",\"gene\",s1",
                "\"no_match\",\"\",3",
                "\"aaaaaaaa\",\"geneA\",1"));
    }

    @Test
    public void testCountsByGene() throws IOException {
        Assert.assertEquals(run(SEQ_DIR, BARCODES), Arrays.asList(
                "\"barcode\",\"gene\",s1,s2",
                "\"no_match\",\"\",2,1",
                "\"caggcaatcgg\",\"PBANKA_000030\",1,0",
                "\"gatcgatcgatc;tgcatgcatgca\",\"PBANKA_000050\",2,0",
                "\"ttcgccgggcc\",\"PBANKA_000010\",1,2"));
    }

    @Test
    public void testCountsByTag() throws IOException {
        Assert.assertEquals(run(SEQ_DIR, BARCODES, "--BY_TAG", "true"), Arrays.asList(
                "\"barcode\",\"gene\",s1,s2",
                "\"no_match\",\"\",2,1",
                "\"caggcaatcgg\",\"PBANKA_000030\",1,0",
                "\"gatcgatcgatc\",\"PBANKA_000050\",1,0",
                "\"tgcatgcatgca\",\"PBANKA_000050\",1,0",
                "\"ttcgccgggcc\",\"PBANKA_000010\",1,2"));
    }

    @Test
    public void testRepeatedRunsGiveIdenticalOutput() throws IOException {
        Assert.assertEquals(run(SEQ_DIR, BARCODES, "--BY_TAG", "true"), run(SEQ_DIR, BARCODES, "--BY_TAG", "true"));
    }

    @Test
    public void testNoMatchOutputAndMetrics() throws IOException {
        final File noMatch = getTempOutputFile("nomatch", ".fastq");
        final File metricsOutput = getTempOutputFile("CountBarcodeTags", ".tag_count_metrics");
        run(SEQ_DIR, BARCODES,
                "--NOMATCH_OUT_FILE", noMatch.getAbsolutePath(),
                "--METRICS_FILE", metricsOutput.getAbsolutePath());

        final List<String> noMatchNames = new ArrayList<>();
        try (final FastqReader reader = new FastqReader(noMatch)) {
            for (final FastqRecord record : reader) {
                noMatchNames.add(record.getReadName());
            }
        }
        Assert.assertEquals(noMatchNames, Arrays.asList("s1_read3", "s1_read6", "s2_read3"));

        final MetricsFile<TagCountMetric, Integer> metricsFile = new MetricsFile<>();
        metricsFile.read(new FileReader(metricsOutput));
        final List<TagCountMetric> metrics = metricsFile.getMetrics();
        Assert.assertEquals(metrics.size(), 2);

        final TagCountMetric s1 = metrics.get(0);
        Assert.assertEquals(s1.SAMPLE, "s1");
        Assert.assertEquals(s1.READS, 6);
        Assert.assertEquals(s1.MATCHED_READS, 4);
        Assert.assertEquals(s1.NO_CANDIDATE_READS, 1);
        Assert.assertEquals(s1.AMBIGUOUS_READS, 1);
        Assert.assertEquals(s1.PCT_MATCHED, 4 / 6d, 0.001);

        final TagCountMetric s2 = metrics.get(1);
        Assert.assertEquals(s2.SAMPLE, "s2");
        Assert.assertEquals(s2.READS, 3);
        Assert.assertEquals(s2.MATCHED_READS, 2);
        Assert.assertEquals(s2.NO_CANDIDATE_READS, 1);
        Assert.assertEquals(s2.AMBIGUOUS_READS, 0);
    }

    @Test
    public void testSampleColumnsSumToReadCount() throws IOException {
        final List<String> table = run(SEQ_DIR, BARCODES, "--BY_TAG", "true");
        final long[] sums = new long[2];
        for (final String line : table.subList(1, table.size())) {
            final String[] fields = line.split(",");
            sums[0] += Long.parseLong(fields[2]);
            sums[1] += Long.parseLong(fields[3]);
        }
        Assert.assertEquals(sums[0], 6);
        Assert.assertEquals(sums[1], 3);
    }

    @Test
    public void testGzippedFastqAndSampleWithoutReads() throws IOException {
        final File seqDir = newDir("gzipped");
        final File plain = writeFastq(seqDir, "tmp.txt", "GTCAGaaaaaaaaCCGCC");
        final File gzipped = new File(seqDir, "lib7.fastq.gz");
        try (final GZIPOutputStream out = new GZIPOutputStream(Files.newOutputStream(gzipped.toPath()))) {
            out.write(Files.readAllBytes(plain.toPath()));
        }
        Assert.assertTrue(plain.delete());
        Files.write(new File(seqDir, "lib2.fastq").toPath(), new byte[0]);
        Files.write(new File(seqDir, "notes.txt").toPath(), Arrays.asList("not a fastq"), StandardCharsets.UTF_8);

        final File barcodes = new File(getTempOutputDir(), "gzipped.csv");
        Files.write(barcodes.toPath(), Arrays.asList("gene id,tag", "geneA,AAAAAAAA"), StandardCharsets.UTF_8);

        Assert.assertEquals(run(seqDir, barcodes), Arrays.asList(
                "\"barcode\",\"gene\",lib2,lib7",
                "\"aaaaaaaa\",\"geneA\",0,1"));
    }

    @Test
    public void testFindSampleFastqs() {
        final Map<File, String> samples = CountBarcodeTags.findSampleFastqs(SEQ_DIR);
        Assert.assertEquals(new ArrayList<>(samples.values()), Arrays.asList("s1", "s2"));
    }

    @Test(expectedExceptions = TagCountException.class)
    public void testUnparseableFastqName() throws IOException {
        final File seqDir = newDir("badname");
        writeFastq(seqDir, "s1.fastq", "GTCAGaaaaaaaaCCGCC");
        writeFastq(seqDir, "control.fastq", "GTCAGaaaaaaaaCCGCC");
        run(seqDir, BARCODES);
    }

    @Test(expectedExceptions = TagCountException.class)
    public void testBarcodeOfInvalidLength() throws IOException {
        final File barcodes = new File(getTempOutputDir(), "short.csv");
        Files.write(barcodes.toPath(), Arrays.asList("gene_id,barcode", "geneA,aaaaaaa"), StandardCharsets.UTF_8);
        run(SEQ_DIR, barcodes);
    }

    @Test(expectedExceptions = TagCountException.class)
    public void testMissingBarcodeFails() throws IOException {
        final File barcodes = new File(getTempOutputDir(), "missing.csv");
        Files.write(barcodes.toPath(), Arrays.asList("gene_id,barcode", "geneA,", "geneB,ttcgccgggcc"), StandardCharsets.UTF_8);
        run(SEQ_DIR, barcodes);
    }

    @Test
    public void testIgnoreMissingTag() throws IOException {
        final File barcodes = new File(getTempOutputDir(), "ignore_missing.csv");
        Files.write(barcodes.toPath(), Arrays.asList("gene_id,barcode", "geneA,", "geneB,ttcgccgggcc"), StandardCharsets.UTF_8);
        Assert.assertEquals(run(SEQ_DIR, barcodes, "--IGNORE_MISSING_TAG", "true"), Arrays.asList(
                "\"barcode\",\"gene\",s1,s2",
                "\"no_match\",\"\",4,1",
                "\"ttcgccgggcc\",\"geneB\",2,2"));
    }

    @DataProvider(name = "badContexts")
    public Object[][] badContexts() {
        return new Object[][]{
                {"--FIVE_P_SEQ", "GTCA"},
                {"--THREE_P_SEQ", "CCG"},
        };
    }

    @Test(dataProvider = "badContexts")
    public void testShortContextIsRejected(final String option, final String value) throws IOException {
        final List<String> args = Arrays.asList(
                "--SEQ_DIR", SEQ_DIR.getAbsolutePath(),
                "--BARCODES", BARCODES.getAbsolutePath(),
                "--OUTPUT", getTempOutputFile("CountBarcodeTags", ".csv").getAbsolutePath(),
                option, value);
        Assert.assertEquals(runCommandLine(args), 1);
    }

    private File writeRecords(final String dirName, final String... lines) throws IOException {
        final File seqDir = newDir(dirName);
        Files.write(new File(seqDir, "s1.fastq").toPath(), Arrays.asList(lines), StandardCharsets.UTF_8);
        return seqDir;
    }

    @Test
    public void testEmptyReadFailsWithFileName() throws IOException {
        final File seqDir = writeRecords("emptyread",
                "@r1", "", "+", "",
                "@r2", "GTCAGAAAAAAAACCGCC", "+", "IIIIIIIIIIIIIIIIII");
        try {
            run(seqDir, BARCODES);
            Assert.fail("An empty read should not be accepted");
        } catch (final TagCountException e) {
            Assert.assertTrue(e.getMessage().contains("s1.fastq"), e.getMessage());
        }
    }

    @Test
    public void testQualityLengthMismatchFailsWithFileName() throws IOException {
        final File seqDir = writeRecords("badquality",
                "@r1", "GTCAGAAAAAAAACCGCC", "+", "IIIIIIIIIIIIIIIIII",
                "@r2", "GTCAGAAAAAAAACCGCC", "+", "II");
        try {
            run(seqDir, BARCODES);
            Assert.fail("A quality line shorter than the read should not be accepted");
        } catch (final TagCountException e) {
            Assert.assertTrue(e.getMessage().contains("s1.fastq"), e.getMessage());
            Assert.assertTrue(e.getCause() instanceof SAMException);
        }
    }
}
