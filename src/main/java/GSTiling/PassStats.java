package GSTiling;

public record PassStats(int pass,
                        int searchLength,
                        int indexedWindows,     // unmarked text windows hashed this pass
                        int candidates,         // candidates of length >= searchLength (partial if aborted)
                        int accepted,           // tiles accepted; always 0 for an aborted pass
                        int maxMatch,
                        boolean aborted) {
}
