package hashing;

/**
 * Checksum over a fixed-width window of tokens that can slide by one position in O(1).
 */
public interface RollingChecksum {

    /** Reset and compute the checksum of {@code tokens[from .. from+windowLength)}. */
    void init(int[] tokens, int from, int windowLength);

    /** Slide the window one position: {@code leaving} drops out on the left, {@code entering} joins on the right. */
    void roll(int leaving, int entering);

    int value();

    int windowLength();
}
