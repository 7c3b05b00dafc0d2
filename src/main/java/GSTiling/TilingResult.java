package GSTiling;

import search.Match;

import java.util.List;

public record TilingResult(List<Match> matches, GstStats stats) {

    public TilingResult {
        matches = List.copyOf(matches);
    }

    // Number of pattern positions covered by tiles; tiles never overlap so this is a plain sum.
    public int tiledLength() {
        int total = 0;
        for (Match m : matches) {
            total += m.length();
        }
        return total;
    }
}
