package sokoban.trace;

import sokoban.domain.MoveSequence;

import java.util.Optional;

/**
 * Recovers a move sequence from a model checker's textual report.
 *
 * Implementations never throw on unrecognized text: an empty result means
 * "no solution found", which covers both a proven-unsolvable puzzle and
 * output the decoder did not understand.
 */
public interface TraceDecoder {

    /**
     * @param checkerOutput raw combined stdout/stderr of the checker
     * @return the decoded moves, or empty if none were found
     */
    Optional<MoveSequence> decode(String checkerOutput);
}
