package utilities;

// Parsed options for TilingBenchmark. Accepts --key=value and --key value.
public record BenchmarkOptions(
        int patternLength,
        int textLength,
        int alphabetSize,
        double zipfExponent,         // <= 0 selects uniform tokens
        long seed,
        int initialSearchLength,
        int minimumMatchLength,
        int warmupRuns,
        int runs,
        boolean runBaseline,
        boolean collectStats) {

    private static final int DEFAULT_PATTERN_LEN = 1 << 14;
    private static final int DEFAULT_TEXT_LEN = 1 << 15;
    private static final int DEFAULT_ALPHABET = 64;
    private static final double DEFAULT_ZIPF = 0.0;
    private static final long DEFAULT_SEED = 42L;
    private static final int DEFAULT_INITIAL = 20;
    private static final int DEFAULT_MIN = 5;
    private static final int DEFAULT_WARMUP = 1;
    private static final int DEFAULT_RUNS = 3;

    public static BenchmarkOptions defaults() {
        return parse(new String[0]);
    }

    public static BenchmarkOptions parse(String[] args) {
        int patternLength = DEFAULT_PATTERN_LEN;
        int textLength = DEFAULT_TEXT_LEN;
        int alphabet = DEFAULT_ALPHABET;
        double zipf = DEFAULT_ZIPF;
        long seed = DEFAULT_SEED;
        int initial = DEFAULT_INITIAL;
        int min = DEFAULT_MIN;
        int warmup = DEFAULT_WARMUP;
        int runs = DEFAULT_RUNS;
        boolean baseline = false;
        boolean stats = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected argument " + arg);
            }
            String key;
            String value;
            int eq = arg.indexOf('=');
            if (eq >= 0) {
                key = arg.substring(2, eq);
                value = arg.substring(eq + 1);
            } else {
                key = arg.substring(2);
                if (key.equals("baseline") || key.equals("stats")) {
                    value = "true";
                } else {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing value for option --" + key);
                    }
                    value = args[++i];
                }
            }
            switch (key) {
                case "pattern-length" -> patternLength = Integer.parseInt(value);
                case "text-length" -> textLength = Integer.parseInt(value);
                case "alphabet" -> alphabet = Integer.parseInt(value);
                case "zipf" -> zipf = Double.parseDouble(value);
                case "seed" -> seed = Long.parseLong(value);
                case "initial" -> initial = Integer.parseInt(value);
                case "min" -> min = Integer.parseInt(value);
                case "warmup" -> warmup = Integer.parseInt(value);
                case "runs" -> runs = Integer.parseInt(value);
                case "baseline" -> baseline = Boolean.parseBoolean(value);
                case "stats" -> stats = Boolean.parseBoolean(value);
                default -> throw new IllegalArgumentException("Unknown option --" + key);
            }
        }

        if (patternLength < 0 || textLength < 0) {
            throw new IllegalArgumentException("sequence lengths must be >= 0");
        }
        if (runs <= 0) {
            throw new IllegalArgumentException("runs must be positive");
        }
        if (warmup < 0) {
            throw new IllegalArgumentException("warmup must be >= 0");
        }
        return new BenchmarkOptions(patternLength, textLength, alphabet, zipf, seed,
                initial, min, warmup, runs, baseline, stats);
    }
}
