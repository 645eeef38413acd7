package sokoban.encoding;

import sokoban.domain.Board;

import java.util.ArrayList;
import java.util.List;

/**
 * Box/target count mismatches that still produce a model, but one whose
 * goal does not mean what a puzzle author would expect. Reported to the
 * caller, never corrected.
 */
public enum EncodingWarning {

    /** No boxes: the goal is TRUE and the initial state already wins */
    VACUOUS_GOAL("board has no boxes, the goal holds in the initial state"),

    /** Fewer targets than boxes: the surplus boxes are not part of the goal */
    UNPAIRED_BOXES("board has fewer targets than boxes, surplus boxes are unconstrained"),

    /** More targets than boxes: the surplus targets are not part of the goal */
    UNPAIRED_TARGETS("board has more targets than boxes, surplus targets are ignored");

    public final String description;

    EncodingWarning(String description) {
        this.description = description;
    }

    /**
     * Lists the warnings that apply to a board, in declaration order.
     */
    public static List<EncodingWarning> check(Board board) {
        List<EncodingWarning> warnings = new ArrayList<>();
        if (board.getNumBoxes() == 0) {
            warnings.add(VACUOUS_GOAL);
        }
        if (board.getNumTargets() < board.getNumBoxes()) {
            warnings.add(UNPAIRED_BOXES);
        }
        if (board.getNumTargets() > board.getNumBoxes()) {
            warnings.add(UNPAIRED_TARGETS);
        }
        return warnings;
    }
}
