package tagcount.util;

import htsjdk.samtools.util.CloseableIterator;
import htsjdk.samtools.util.CloserUtil;
import htsjdk.samtools.util.IOUtil;
import tagcount.TagCountException;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Iterate through a delimited text file in which columns are found by looking at a header line rather than by position.
 * Fields may be wrapped in double quotes, in which case the delimiter may appear inside them and a doubled quote stands
 * for a literal one. Blank lines are skipped.
 */
public class DelimitedTextFileWithHeaderIterator implements CloseableIterator<DelimitedTextFileWithHeaderIterator.Row> {
    public static final char COMMA = ',';
    public static final char TAB = '\t';

    public class Row {
        private final String[] fields;
        private final String currentLine;
        private final int lineNumber;

        Row(final String[] fields, final String source, final int lineNumber) {
            this.fields = fields;
            this.currentLine = source;
            this.lineNumber = lineNumber;
        }

        /**
         * @return Array of fields in the order they appear in the file.
         */
        public String[] getFields() {
            return fields;
        }

        /**
         * @return the value of the given column, or null if this row is too short to have it.
         */
        public String getField(final String columnLabel) {
            final Integer key = columnLabelIndices.get(columnLabel);
            if (key == null) throw new NoSuchElementException(String.format("column %s in %s", columnLabel, fileName));
            return key < fields.length ? fields[key] : null;
        }

        public String getCurrentLine() {
            return this.currentLine;
        }

        public int getLineNumber() {
            return lineNumber;
        }
    }

    /**
     * Map from column label to positional index.
     */
    private final Map<String, Integer> columnLabelIndices = new LinkedHashMap<>();
    private final BufferedReader reader;
    private final String fileName;
    private final char delimiter;
    private String nextLine;
    private int currentLineNumber = 0;

    public DelimitedTextFileWithHeaderIterator(final File file, final char delimiter) {
        IOUtil.assertFileIsReadable(file);
        this.reader = IOUtil.openFileForBufferedReading(file);
        this.fileName = file.getAbsolutePath();
        this.delimiter = delimiter;
        advance();
        if (nextLine == null) {
            close();
            throw new TagCountException("No header line found in file " + fileName);
        }
        final String[] columnLabels = splitLine(nextLine);
        for (int i = 0; i < columnLabels.length; ++i) {
            columnLabelIndices.put(columnLabels[i], i);
        }
        advance();
    }

    /**
     * @param columnLabel
     * @return True if the given column label appears in the header.
     */
    public boolean hasColumn(final String columnLabel) {
        return columnLabelIndices.containsKey(columnLabel);
    }

    /**
     * @return The set of column labels for this file, in header order.
     */
    public Set<String> columnLabels() {
        return Collections.unmodifiableSet(columnLabelIndices.keySet());
    }

    public int getCurrentLineNumber() {
        return currentLineNumber;
    }

    public String getFileName() {
        return fileName;
    }

    @Override
    public boolean hasNext() {
        return nextLine != null;
    }

    @Override
    public Row next() {
        if (!hasNext()) throw new NoSuchElementException("No more rows in " + fileName);
        final Row row = new Row(splitLine(nextLine), nextLine, currentLineNumber);
        advance();
        return row;
    }

    @Override
    public void remove() {
        throw new UnsupportedOperationException();
    }

    @Override
    public void close() {
        CloserUtil.close(reader);
    }

    /** Reads ahead to the next non-blank line, or sets nextLine to null at end of file. */
    private void advance() {
        try {
            String line;
            do {
                line = reader.readLine();
                if (line != null) ++currentLineNumber;
            } while (line != null && line.trim().isEmpty());
            nextLine = line;
        } catch (final IOException e) {
            throw new TagCountException("Error reading from file " + fileName, e);
        }
    }

    String[] splitLine(final String line) {
        final List<String> fields = new ArrayList<>();
        final StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); ++i) {
            final char c = line.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        field.append('"');
                        ++i;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    field.append(c);
                }
            } else if (c == '"') {
                inQuotes = true;
            } else if (c == delimiter) {
                fields.add(field.toString());
                field.setLength(0);
            } else if (c != '\r') {
                field.append(c);
            }
        }
        if (inQuotes) {
            throw new TagCountException(String.format("Unterminated quoted field at line %d of %s", currentLineNumber, fileName));
        }
        fields.add(field.toString());
        return fields.toArray(new String[0]);
    }
}
