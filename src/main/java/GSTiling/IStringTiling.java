package GSTiling;

import search.Match;
import utilities.TokenSequence;

import java.util.List;

public interface IStringTiling {

    /** Non-overlapping common substrings of {@code pattern} and {@code text}, in acceptance order. */
    List<Match> tile(TokenSequence pattern, TokenSequence text);

    int minimumMatchLength();
}
