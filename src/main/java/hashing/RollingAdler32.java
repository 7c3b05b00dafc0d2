package hashing;

// Adler-32 with an O(1) slide. Tokens are reduced modulo 65521 so any int alphabet is accepted.
public final class RollingAdler32 implements RollingChecksum {

    static final int MOD_ADLER = 65521;

    private int a = 1;
    private int b = 0;
    private int windowLength;

    public RollingAdler32() {
    }

    @Override
    public void init(int[] tokens, int from, int windowLength) {
        if (windowLength <= 0) {
            throw new IllegalArgumentException("windowLength must be positive");
        }
        if (from < 0 || from + windowLength > tokens.length) {
            throw new IndexOutOfBoundsException("window [" + from + ", " + (from + windowLength)
                    + ") outside [0, " + tokens.length + ")");
        }
        this.windowLength = windowLength;
        this.a = 1;
        this.b = 0;
        for (int i = from; i < from + windowLength; i++) {
            update(tokens[i]);
        }
    }

    @Override
    public void roll(int leaving, int entering) {
        remove(leaving);
        update(entering);
    }

    private void update(int token) {
        a = (a + reduce(token)) % MOD_ADLER;
        b = (b + a) % MOD_ADLER;
    }

    private void remove(int token) {
        long x = reduce(token);
        a = (int) Math.floorMod(a - x, (long) MOD_ADLER);
        b = (int) Math.floorMod(b - 1L - (long) windowLength * x, (long) MOD_ADLER);
    }

    private static int reduce(int token) {
        return Math.floorMod(token, MOD_ADLER);
    }

    @Override
    public int value() {
        return (b << 16) | a;
    }

    @Override
    public int windowLength() {
        return windowLength;
    }
}
