import GSTiling.GstConfiguration;
import GSTiling.IStringTiling;
import GSTiling.NaiveGst;
import GSTiling.RkrGst;
import GSTiling.TilingResult;
import datagenerators.SequenceGenerator;
import search.Match;
import utilities.BenchmarkOptions;
import utilities.GSTLogger;
import utilities.TokenSequence;

import java.util.List;
import java.util.Locale;

/**
 * Times RKR-GST (and optionally the plain GST baseline) on generated data. The text is derived
 * from the pattern by block copies with noise, so both sequences share long substrings.
 */
public final class TilingBenchmark {

    private TilingBenchmark() {
    }

    public static void main(String[] args) {
        BenchmarkOptions options = BenchmarkOptions.parse(args);

        TokenSequence pattern = options.zipfExponent() > 0
                ? SequenceGenerator.generateZipf(options.patternLength(), options.alphabetSize(), options.zipfExponent(), options.seed())
                : SequenceGenerator.generateUniform(options.patternLength(), options.alphabetSize(), options.seed());
        TokenSequence text = SequenceGenerator.mutate(pattern, options.textLength(), 4 * options.initialSearchLength(),
                options.alphabetSize(), options.seed() + 1);

        System.out.printf(Locale.ROOT,
                "|P|: %d  |T|: %d  Alphabet: %d  Zipf: %.2f  s0: %d  min: %d%n",
                pattern.length(), text.length(), options.alphabetSize(), options.zipfExponent(),
                options.initialSearchLength(), options.minimumMatchLength());

        GstConfiguration configuration = GstConfiguration.builder()
                .initialSearchLength(options.initialSearchLength())
                .minimumMatchLength(options.minimumMatchLength())
                .collectStats(options.collectStats())
                .build();
        RkrGst rkr = new RkrGst(configuration);

        double rkrMs = time(rkr, pattern, text, options);
        TilingResult last = rkr.tileWithStats(pattern, text);
        System.out.printf(Locale.ROOT, "RKR-GST   avg: %.3f ms  tiles: %d  tiled: %d%n",
                rkrMs, last.matches().size(), last.tiledLength());
        if (options.collectStats()) {
            last.stats().passes().forEach(p -> System.out.println("  " + p));
            System.out.printf(Locale.ROOT, "  last run: %.3f ms%n", last.stats().runTimeMs());
            GSTLogger.info(last.stats().toString());
        }

        if (options.runBaseline()) {
            NaiveGst naive = new NaiveGst(options.minimumMatchLength());
            double naiveMs = time(naive, pattern, text, options);
            List<Match> naiveTiles = naive.tile(pattern, text);
            System.out.printf(Locale.ROOT, "Naive GST avg: %.3f ms  tiles: %d  tiled: %d%n",
                    naiveMs, naiveTiles.size(), naiveTiles.stream().mapToInt(Match::length).sum());
        }
    }

    private static double time(IStringTiling algorithm, TokenSequence pattern, TokenSequence text, BenchmarkOptions options) {
        for (int i = 0; i < options.warmupRuns(); i++) {
            algorithm.tile(pattern, text);
        }
        long total = 0L;
        for (int i = 0; i < options.runs(); i++) {
            long start = System.nanoTime();
            algorithm.tile(pattern, text);
            total += System.nanoTime() - start;
        }
        double avgMs = total / (double) options.runs() / 1_000_000.0;
        GSTLogger.info(algorithm.getClass().getSimpleName() + " avg " + String.format(Locale.ROOT, "%.3f", avgMs) + " ms");
        return avgMs;
    }
}
