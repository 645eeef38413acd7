package sokoban.simulation;

import sokoban.domain.Move;
import sokoban.domain.MoveSequence;
import sokoban.encoding.Vocabulary;
import sokoban.smv.Evaluator;
import sokoban.smv.Formula;
import sokoban.smv.SmvModule;
import sokoban.smv.Term;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes a synthesized module on concrete values, one move at a time.
 *
 * Only the generated case expressions are interpreted; the game rules are
 * not known here. States map variable names (array elements by their
 * printed key, e.g. "box_x[1]") to Integer values; module constants are
 * part of every state.
 */
public class ModelSimulator {

    private final SmvModule module;

    public ModelSimulator(SmvModule module) {
        this.module = module;
    }

    /**
     * @return constants plus the init() values of every variable
     */
    public Map<String, Object> initialState() {
        Map<String, Object> state = new LinkedHashMap<>(module.getConstants());
        Evaluator evaluator = new Evaluator(state, module);
        for (SmvModule.Assignment init : module.getInits()) {
            state.put(key(init.target), evaluator.value(init.value));
        }
        return Collections.unmodifiableMap(state);
    }

    /**
     * Computes the successor of a state under a move. All case expressions
     * are evaluated against the old state, then applied together.
     *
     * @param state current state (not modified)
     * @param move the selected move
     * @return the successor state
     */
    public Map<String, Object> step(Map<String, Object> state, Move move) {
        Map<String, Object> current = new LinkedHashMap<>(state);
        current.put(Vocabulary.MOVE, move.toString());
        Evaluator evaluator = new Evaluator(current, module);

        Map<String, Object> next = new LinkedHashMap<>(state);
        for (SmvModule.CaseAssignment assignment : module.getNexts()) {
            next.put(key(assignment.target), evaluator.value(select(evaluator, assignment)));
        }
        return Collections.unmodifiableMap(next);
    }

    /**
     * @return moves whose successor differs from the state, in alphabet order
     */
    public List<Move> enabledMoves(Map<String, Object> state) {
        List<Move> enabled = new ArrayList<>();
        for (Move move : Move.all()) {
            if (!step(state, move).equals(state)) {
                enabled.add(move);
            }
        }
        return enabled;
    }

    /**
     * @return true if the goal DEFINE holds in the state
     */
    public boolean isGoal(Map<String, Object> state) {
        return new Evaluator(state, module).test(Formula.ref(Vocabulary.WIN));
    }

    /**
     * Plays a move sequence from the initial state.
     *
     * @param moves the moves, in order
     * @return final state, goal flag and the first move that changed nothing
     */
    public ReplayResult replay(MoveSequence moves) {
        Map<String, Object> state = initialState();
        int firstBlocked = -1;
        for (int i = 0; i < moves.size(); i++) {
            Map<String, Object> next = step(state, moves.get(i));
            if (firstBlocked < 0 && next.equals(state)) {
                firstBlocked = i;
            }
            state = next;
        }
        return new ReplayResult(state, isGoal(state), firstBlocked);
    }

    private static Term select(Evaluator evaluator, SmvModule.CaseAssignment assignment) {
        for (SmvModule.Branch branch : assignment.branches) {
            if (evaluator.test(branch.guard)) {
                return branch.value;
            }
        }
        return assignment.fallback;
    }

    private static String key(Term target) {
        if (target instanceof Term.Identifier) {
            return ((Term.Identifier) target).name;
        }
        if (target instanceof Term.ArrayElement) {
            return ((Term.ArrayElement) target).key();
        }
        throw new IllegalArgumentException("Not an assignable term: " + target);
    }
}
