package sokoban.simulation;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;
import sokoban.client.BoardParser;
import sokoban.domain.Direction;
import sokoban.domain.Move;
import sokoban.domain.MoveSequence;
import sokoban.encoding.ModelSynthesizer;

class ModelSimulatorTest {

    private final BoardParser parser = new BoardParser();

    private ModelSimulator simulator(String board) {
        return new ModelSimulator(new ModelSynthesizer(parser.parseString(board)).synthesize());
    }

    @Test
    void testInitialState() {
        Map<String, Object> state = simulator("#####\n#@$.#\n#####").initialState();

        assertThat(state).containsEntry("player_x", 1).containsEntry("player_y", 1)
                .containsEntry("box_x[1]", 2).containsEntry("box_y[1]", 1)
                .containsEntry("WIDTH", 5).containsEntry("HEIGHT", 3);
    }

    /** Agent next to the box in a corridor: pushing right is the only thing it can do. */
    @Test
    void testOnlyPushRightIsEnabled() {
        ModelSimulator sim = simulator("#####\n#@$.#\n#####");
        Map<String, Object> start = sim.initialState();

        assertThat(sim.enabledMoves(start)).containsExactly(Move.push(Direction.RIGHT));
        assertThat(sim.isGoal(start)).isFalse();

        Map<String, Object> next = sim.step(start, Move.push(Direction.RIGHT));
        assertThat(next).containsEntry("player_x", 2).containsEntry("box_x[1]", 3).containsEntry("box_y[1]", 1);
        assertThat(sim.isGoal(next)).isTrue();
    }

    @Test
    void testStepsDoNotMoveBoxes() {
        ModelSimulator sim = simulator("#####\n#@  #\n# $.#\n#   #\n#####");
        Map<String, Object> state = sim.initialState();

        assertThat(sim.enabledMoves(state)).containsExactly(Move.step(Direction.RIGHT), Move.step(Direction.DOWN));

        state = sim.step(state, Move.step(Direction.RIGHT));
        assertThat(state).containsEntry("player_x", 2).containsEntry("player_y", 1).containsEntry("box_x[1]", 2);
        // the box is below now: a step down is blocked, a push down is not
        assertThat(sim.step(state, Move.step(Direction.DOWN))).isEqualTo(state);
        assertThat(sim.step(state, Move.push(Direction.DOWN))).containsEntry("box_y[1]", 3).containsEntry("player_y", 2);
    }

    /** A box cannot be pushed into a wall or into another box. */
    @Test
    void testBlockedPushes() {
        ModelSimulator sim = simulator("######\n#@$$.#\n#  . #\n######");
        Map<String, Object> start = sim.initialState();

        assertThat(sim.step(start, Move.push(Direction.RIGHT))).isEqualTo(start);
        assertThat(sim.enabledMoves(start)).containsExactly(Move.step(Direction.DOWN));

        ModelSimulator walled = simulator("####\n#@$#\n####");
        assertThat(walled.enabledMoves(walled.initialState())).isEmpty();
    }

    /** Only the box adjacent to the agent moves on a push. */
    @Test
    void testOnlyAdjacentBoxMoves() {
        ModelSimulator sim = simulator("#######\n#@$ $ #\n#. . .#\n#######");
        Map<String, Object> next = sim.step(sim.initialState(), Move.push(Direction.RIGHT));

        assertThat(next).containsEntry("box_x[1]", 3).containsEntry("box_x[2]", 4);
    }

    @Test
    void testReplay() {
        ModelSimulator sim = simulator("#####\n#@$.#\n#####");

        ReplayResult solved = sim.replay(MoveSequence.parse("R"));
        assertThat(solved.goalReached).isTrue();
        assertThat(solved.allMovesApplied()).isTrue();

        ReplayResult blocked = sim.replay(MoveSequence.parse("rR"));
        assertThat(blocked.goalReached).isTrue();
        assertThat(blocked.firstBlockedMove).isEqualTo(0);

        ReplayResult wrong = sim.replay(MoveSequence.parse(""));
        assertThat(wrong.goalReached).isFalse();
    }
}
