package tagcount.barcode;

import tagcount.TagCountException;

import java.io.File;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the sample name from a fastq file name: everything up to and including the digits directly before the
 * ".fastq" extension, so "plate1_well12.fastq" and "plate1_well12.fastq.gz" both belong to sample "plate1_well12".
 */
public final class SampleNameParser {
    private static final Pattern SAMPLE_PATTERN = Pattern.compile("^(.*?\\d+)\\.fastq");

    private SampleNameParser() {}

    /**
     * @throws TagCountException if the name does not end in digits followed by the fastq extension
     */
    public static String parseSampleName(final String fileName) {
        final Matcher matcher = SAMPLE_PATTERN.matcher(fileName);
        if (!matcher.find()) {
            throw new TagCountException("Could not parse a sample name from fastq file name '" + fileName + "'");
        }
        return matcher.group(1);
    }

    public static String parseSampleName(final File fastq) {
        return parseSampleName(fastq.getName());
    }
}
