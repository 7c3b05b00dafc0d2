package GSTiling;

import hashing.RollingChecksum;
import search.CandidateScanner;
import search.Match;
import search.ScanOutcome;
import utilities.GSTLogger;
import utilities.MarkArray;
import utilities.TokenSequence;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Running Karp-Rabin Greedy-String-Tiling.
 *
 * <p>Each run alternates scan passes and tiling passes over a shrinking search length {@code s}:
 * <ul>
 *   <li>scan at {@code s}; if some match is longer than {@code 2*s}, discard the pass and rescan
 *       with {@code s} set to that length;</li>
 *   <li>otherwise tile the candidates, then halve {@code s} while it stays above twice the minimum,
 *       drop to the minimum once, and stop after the pass at the minimum.</li>
 * </ul>
 * Instances are immutable; all marks and buffers belong to a single call, so one instance can be
 * shared freely.
 */
public final class RkrGst implements IStringTiling {

    private final GstConfiguration config;
    private final int initialSearchLength;
    private final int minimumMatchLength;
    private final Supplier<RollingChecksum> checksums;

    public RkrGst(GstConfiguration config) {
        this.config = Objects.requireNonNull(config, "config");
        this.initialSearchLength = config.initialSearchLength();
        this.minimumMatchLength = config.minimumMatchLength();
        this.checksums = config.checksumSupplier();
    }

    public RkrGst(int initialSearchLength, int minimumMatchLength) {
        this(GstConfiguration.of(initialSearchLength, minimumMatchLength));
    }

    /** Tiles two byte strings; bytes are compared as unsigned tokens. */
    public static List<Match> run(byte[] pattern, byte[] text, int initialSearchLength, int minimumMatchLength) {
        return new RkrGst(initialSearchLength, minimumMatchLength)
                .tile(TokenSequence.ofBytes(pattern), TokenSequence.ofBytes(text));
    }

    @Override
    public int minimumMatchLength() {
        return minimumMatchLength;
    }

    @Override
    public List<Match> tile(TokenSequence pattern, TokenSequence text) {
        return tileWithStats(pattern, text).matches();
    }

    public TilingResult tileWithStats(TokenSequence pattern, TokenSequence text) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(text, "text");
        GstStats stats = new GstStats(config.collectStats());
        long start = System.nanoTime();

        MarkArray patternMarks = new MarkArray(pattern.length());
        MarkArray textMarks = new MarkArray(text.length());
        CandidateScanner scanner = new CandidateScanner(pattern, patternMarks, text, textMarks, checksums);
        List<Match> candidates = new ArrayList<>();
        List<Match> result = new ArrayList<>();

        int s = initialSearchLength;
        int pass = 0;
        while (true) {
            pass++;
            ScanOutcome outcome = scanner.scan(s, candidates);
            int lmax = outcome.maxMatch();
            if (lmax > 2L * s) {
                stats.recordPass(new PassStats(pass, s, outcome.indexedWindows(), candidates.size(), 0, lmax, true));
                if (GSTLogger.isDebugEnabled()) {
                    GSTLogger.debug("pass " + pass + ": match of length " + lmax + " at s=" + s + ", rescanning");
                }
                s = lmax;
                continue;
            }

            int found = candidates.size();
            int accepted = GreedyTiler.tile(candidates, patternMarks, textMarks, result);
            stats.recordPass(new PassStats(pass, s, outcome.indexedWindows(), found, accepted, lmax, false));
            if (GSTLogger.isDebugEnabled()) {
                GSTLogger.debug("pass " + pass + ": s=" + s + " windows=" + outcome.indexedWindows()
                        + " candidates=" + found + " accepted=" + accepted);
            }

            if (s > 2L * minimumMatchLength) {
                s /= 2;
            } else if (s > minimumMatchLength) {
                s = minimumMatchLength;
            } else {
                break;
            }
        }

        stats.recordRunTime(System.nanoTime() - start);
        GSTLogger.trace("tiled |P|=" + pattern.length() + " |T|=" + text.length()
                + " in " + pass + " passes: " + result.size() + " tiles");
        return new TilingResult(result, stats);
    }
}
