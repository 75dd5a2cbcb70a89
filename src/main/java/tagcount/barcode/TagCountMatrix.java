package tagcount.barcode;

import java.util.Collections;
import java.util.Comparator;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read counts per barcode key and sample.  A key is a lower case barcode or {@link #NO_MATCH}.
 *
 * Keys iterate in {@link #KEY_ORDER}, samples in natural order.  Only keys that have been counted at least once are
 * present; samples are present once registered, even with no reads.
 */
public class TagCountMatrix {
    /** Key for reads that could not be assigned to exactly one barcode. */
    public static final String NO_MATCH = "no_match";

    /** {@link #NO_MATCH} first, then all other keys in lexicographic order. */
    public static final Comparator<String> KEY_ORDER = (a, b) -> {
        if (a.equals(b)) return 0;
        if (a.equals(NO_MATCH)) return -1;
        if (b.equals(NO_MATCH)) return 1;
        return a.compareTo(b);
    };

    private final TreeMap<String, SortedMap<String, Long>> counts = new TreeMap<>(KEY_ORDER);
    private final SortedSet<String> samples = new TreeSet<>();

    /** Registers a sample so that it gets a column even if none of its reads are counted. */
    public void addSample(final String sample) {
        samples.add(sample);
    }

    public void increment(final String key, final String sample) {
        add(key, sample, 1);
    }

    public void add(final String key, final String sample, final long count) {
        if (count < 0) throw new IllegalArgumentException("Counts cannot be negative: " + count);
        samples.add(sample);
        counts.computeIfAbsent(key, k -> new TreeMap<>()).merge(sample, count, Long::sum);
    }

    /** Adds all counts of another matrix into this one. */
    public void merge(final TagCountMatrix other) {
        samples.addAll(other.samples);
        for (final Map.Entry<String, SortedMap<String, Long>> row : other.counts.entrySet()) {
            for (final Map.Entry<String, Long> cell : row.getValue().entrySet()) {
                add(row.getKey(), cell.getKey(), cell.getValue());
            }
        }
    }

    public long getCount(final String key, final String sample) {
        final Map<String, Long> row = counts.get(key);
        if (row == null) return 0;
        return row.getOrDefault(sample, 0L);
    }

    /** @return the sum over all keys, {@link #NO_MATCH} included, for one sample. */
    public long getTotal(final String sample) {
        long total = 0;
        for (final Map<String, Long> row : counts.values()) {
            total += row.getOrDefault(sample, 0L);
        }
        return total;
    }

    public SortedSet<String> getKeys() {
        return Collections.unmodifiableSortedSet(counts.navigableKeySet());
    }

    public SortedSet<String> getSamples() {
        return Collections.unmodifiableSortedSet(samples);
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }
}
