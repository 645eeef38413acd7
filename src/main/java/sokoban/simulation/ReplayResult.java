package sokoban.simulation;

import java.util.Map;

/**
 * Outcome of replaying a move sequence on a model.
 */
public final class ReplayResult {

    /** State after the last move */
    public final Map<String, Object> finalState;

    /** Whether the goal holds in the final state */
    public final boolean goalReached;

    /** Index of the first move that left the state unchanged, or -1 */
    public final int firstBlockedMove;

    public ReplayResult(Map<String, Object> finalState, boolean goalReached, int firstBlockedMove) {
        this.finalState = finalState;
        this.goalReached = goalReached;
        this.firstBlockedMove = firstBlockedMove;
    }

    /**
     * @return true if every move had an effect
     */
    public boolean allMovesApplied() {
        return firstBlockedMove < 0;
    }

    @Override
    public String toString() {
        return "ReplayResult[goalReached=" + goalReached + ", firstBlockedMove=" + firstBlockedMove + "]";
    }
}
