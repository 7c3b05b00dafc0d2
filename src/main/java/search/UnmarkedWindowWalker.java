package search;

import hashing.RollingChecksum;
import utilities.MarkArray;

/**
 * Visits every window of width {@code s} that lies entirely inside an unmarked run,
 * maintaining the window checksum incrementally inside each run.
 */
public final class UnmarkedWindowWalker {

    @FunctionalInterface
    public interface WindowVisitor {
        /** @return false to stop the walk */
        boolean visit(int start, int hash);
    }

    private UnmarkedWindowWalker() {
    }

    /** @return true if every window was visited, false if the visitor stopped the walk */
    public static boolean walk(int[] tokens, MarkArray marks, int s, RollingChecksum checksum, WindowVisitor visitor) {
        if (s <= 0) {
            throw new IllegalArgumentException("window length must be positive");
        }
        int n = tokens.length;
        int i = 0;
        while (i + s <= n) {
            int marked = marks.nextMarked(i);
            if (marked >= 0 && marked < i + s) {
                // window would straddle a marked position; restart right after it
                i = marked + 1;
                continue;
            }
            int runEnd = (marked < 0) ? n : marked;

            checksum.init(tokens, i, s);
            while (true) {
                if (!visitor.visit(i, checksum.value())) {
                    return false;
                }
                i++;
                if (i + s > runEnd) {
                    break;
                }
                checksum.roll(tokens[i - 1], tokens[i + s - 1]);
            }
            i = runEnd + 1;
        }
        return true;
    }
}
