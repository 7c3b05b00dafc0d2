package GSTiling;

import hashing.RollingAdler32;
import hashing.RollingChecksum;

import java.util.Objects;
import java.util.function.Supplier;

// Immutable configuration for constructing RkrGst instances.
public final class GstConfiguration {

    private final int initialSearchLength;
    private final int minimumMatchLength;
    private final Supplier<RollingChecksum> checksumSupplier;
    private final boolean collectStats;

    private GstConfiguration(Builder builder) {
        this.initialSearchLength = builder.initialSearchLength;
        this.minimumMatchLength = builder.minimumMatchLength;
        this.checksumSupplier = Objects.requireNonNull(builder.checksumSupplier, "checksumSupplier");
        this.collectStats = builder.collectStats;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    public static GstConfiguration of(int initialSearchLength, int minimumMatchLength) {
        return builder()
                .initialSearchLength(initialSearchLength)
                .minimumMatchLength(minimumMatchLength)
                .build();
    }

    private void validate() {
        if (initialSearchLength <= 0) {
            throw new IllegalArgumentException("initialSearchLength must be positive");
        }
        if (minimumMatchLength <= 0) {
            throw new IllegalArgumentException("minimumMatchLength must be positive");
        }
        // the halving loop only reaches the minimum from above
        if (minimumMatchLength > initialSearchLength) {
            throw new IllegalArgumentException("minimumMatchLength (" + minimumMatchLength
                    + ") must not exceed initialSearchLength (" + initialSearchLength + ")");
        }
    }

    public int initialSearchLength() { return initialSearchLength; }
    public int minimumMatchLength() { return minimumMatchLength; }
    public Supplier<RollingChecksum> checksumSupplier() { return checksumSupplier; }
    public boolean collectStats() { return collectStats; }

    @Override
    public String toString() {
        return "GstConfiguration{initialSearchLength=" + initialSearchLength
                + ", minimumMatchLength=" + minimumMatchLength
                + ", collectStats=" + collectStats + '}';
    }

    public static final class Builder {
        private int initialSearchLength;
        private int minimumMatchLength;
        private Supplier<RollingChecksum> checksumSupplier = RollingAdler32::new;
        private boolean collectStats;

        private Builder() {
        }

        public Builder initialSearchLength(int initialSearchLength) {
            this.initialSearchLength = initialSearchLength;
            return this;
        }

        public Builder minimumMatchLength(int minimumMatchLength) {
            this.minimumMatchLength = minimumMatchLength;
            return this;
        }

        public Builder checksumSupplier(Supplier<RollingChecksum> checksumSupplier) {
            this.checksumSupplier = checksumSupplier;
            return this;
        }

        public Builder collectStats(boolean collectStats) {
            this.collectStats = collectStats;
            return this;
        }

        public GstConfiguration build() {
            return new GstConfiguration(this);
        }
    }
}
