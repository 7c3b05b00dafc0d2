package search;

import hashing.RollingChecksum;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import utilities.MarkArray;
import utilities.TokenSequence;

/**
 * Checksum of every fully unmarked text window of one search length, mapped to the
 * window start offsets in ascending order. Buckets may hold unrelated windows whose
 * checksums collide, so a hit is only a candidate until verified.
 * Built fresh for each scan pass since the marks change between passes.
 */
public final class TextHashIndex {

    private final Int2ObjectOpenHashMap<IntArrayList> buckets;
    private final int searchLength;
    private int windows;

    private TextHashIndex(int searchLength) {
        this.searchLength = searchLength;
        this.buckets = new Int2ObjectOpenHashMap<>();
        this.buckets.defaultReturnValue(null);
    }

    public static TextHashIndex build(TokenSequence text, MarkArray textMarks, int searchLength, RollingChecksum checksum) {
        if (textMarks.size() != text.length()) {
            throw new IllegalArgumentException("text marks sized " + textMarks.size()
                    + " for a text of length " + text.length());
        }
        TextHashIndex index = new TextHashIndex(searchLength);
        UnmarkedWindowWalker.walk(text.rawTokens(), textMarks, searchLength, checksum, (start, hash) -> {
            IntArrayList offsets = index.buckets.get(hash);
            if (offsets == null) {
                offsets = new IntArrayList(2);
                index.buckets.put(hash, offsets);
            }
            offsets.add(start);
            index.windows++;
            return true;
        });
        return index;
    }

    /** Text offsets whose window checksum equals {@code hash}, or null when there are none. */
    public IntList offsets(int hash) {
        return buckets.get(hash);
    }

    public int searchLength() {
        return searchLength;
    }

    public int windowCount() {
        return windows;
    }

    public int bucketCount() {
        return buckets.size();
    }
}
