package utilities;

import java.util.BitSet;

// Per-position "already tiled" flags for one sequence. Marking is monotonic: nothing is ever unmarked.
public final class MarkArray {

    private final BitSet marks;
    private final int size;

    public MarkArray(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0");
        }
        this.size = size;
        this.marks = new BitSet(size);
    }

    public int size() {
        return size;
    }

    public boolean isMarked(int pos) {
        checkIndex(pos);
        return marks.get(pos);
    }

    // First marked position >= from, or -1 when the rest of the sequence is unmarked.
    public int nextMarked(int from) {
        if (from >= size) {
            return -1;
        }
        return marks.nextSetBit(Math.max(0, from));
    }

    // True when every position of [from, from+length) is unmarked.
    public boolean isRangeUnmarked(int from, int length) {
        checkRange(from, length);
        int next = marks.nextSetBit(from);
        return next < 0 || next >= from + length;
    }

    public void mark(int from, int length) {
        checkRange(from, length);
        marks.set(from, from + length);
    }

    public int markedCount() {
        return marks.cardinality();
    }

    private void checkIndex(int pos) {
        if (pos < 0 || pos >= size) {
            throw new IndexOutOfBoundsException("position " + pos + " outside [0, " + size + ")");
        }
    }

    private void checkRange(int from, int length) {
        if (from < 0 || length < 0 || from + length > size) {
            throw new IndexOutOfBoundsException("range [" + from + ", " + (from + length)
                    + ") outside [0, " + size + ")");
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(size);
        for (int i = 0; i < size; i++) {
            sb.append(marks.get(i) ? '#' : '.');
        }
        return sb.toString();
    }
}
