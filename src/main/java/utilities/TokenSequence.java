package utilities;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable sequence of integer token ids, the unit both tiling algorithms work on.
 * Bytes are widened as unsigned values, so byte input and token input share one representation.
 */
public final class TokenSequence {

    private static final TokenSequence EMPTY = new TokenSequence(new int[0]);

    private final int[] tokens;

    private TokenSequence(int[] tokens) {
        this.tokens = tokens;
    }

    public static TokenSequence empty() {
        return EMPTY;
    }

    public static TokenSequence of(int... tokens) {
        Objects.requireNonNull(tokens, "tokens");
        return new TokenSequence(tokens.clone());
    }

    public static TokenSequence ofBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        int[] out = new int[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            out[i] = bytes[i] & 0xFF;
        }
        return new TokenSequence(out);
    }

    // UTF-8 bytes of the string, one token per byte.
    public static TokenSequence ofString(String s) {
        Objects.requireNonNull(s, "s");
        return ofBytes(s.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Maps caller-supplied tokens (words, lexer token kinds, ...) to ids. Use the same mapper
     * for the pattern and the text so equal tokens get equal ids.
     */
    public static <T> TokenSequence ofTokens(List<T> items, AlphabetMapper<T> mapper) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(mapper, "mapper");
        int[] out = new int[items.size()];
        int i = 0;
        for (T item : items) {
            out[i++] = mapper.getId(Objects.requireNonNull(item, "token"));
        }
        return new TokenSequence(out);
    }

    public int length() {
        return tokens.length;
    }

    public boolean isEmpty() {
        return tokens.length == 0;
    }

    public int tokenAt(int index) {
        return tokens[index];
    }

    // Backing array for the scan loops; no copy. Callers must not write to it.
    public int[] rawTokens() {
        return tokens;
    }

    public int[] toArray() {
        return tokens.clone();
    }

    public boolean regionMatches(int from, TokenSequence other, int otherFrom, int length) {
        if (from < 0 || otherFrom < 0 || length < 0
                || from + length > tokens.length || otherFrom + length > other.tokens.length) {
            return false;
        }
        return Arrays.equals(tokens, from, from + length, other.tokens, otherFrom, otherFrom + length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TokenSequence)) return false;
        return Arrays.equals(tokens, ((TokenSequence) o).tokens);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(tokens);
    }

    @Override
    public String toString() {
        return "TokenSequence" + Arrays.toString(tokens);
    }
}
