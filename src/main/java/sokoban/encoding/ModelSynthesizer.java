package sokoban.encoding;

import sokoban.checker.CheckerConfig;
import sokoban.domain.Board;
import sokoban.domain.Direction;
import sokoban.domain.Move;
import sokoban.domain.Position;
import sokoban.smv.Formula;
import sokoban.smv.SmvModule;
import sokoban.smv.SmvPrinter;
import sokoban.smv.Term;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles a board into an SMV transition system.
 *
 * The model has one state variable per agent coordinate, one array element
 * per box coordinate, and a free input variable {@code move} that selects
 * the next move. Each coordinate gets a case expression:
 * <ul>
 *   <li>agent x changes only under l, r, L, R; agent y only under u, d, U, D</li>
 *   <li>a step needs the destination cell free</li>
 *   <li>a push needs a box next to the agent and the cell beyond it free;
 *       the agent and that box both move one cell</li>
 *   <li>box i moves only under the push whose adjacent cell is box i's cell</li>
 * </ul>
 * A move whose guard fails leaves every coordinate unchanged.
 *
 * The goal pairs box i with target i (targets sorted row-major) for
 * i up to min(#boxes, #targets), and the specification is {@code F win}.
 * Output is a pure function of the board.
 */
public class ModelSynthesizer {

    private static final Direction[] HORIZONTAL = { Direction.LEFT, Direction.RIGHT };
    private static final Direction[] VERTICAL = { Direction.UP, Direction.DOWN };

    private final Board board;
    private final Predicates predicates;
    private final List<EncodingWarning> warnings;

    public ModelSynthesizer(Board board) {
        this.board = board;
        this.predicates = new Predicates(board);
        this.warnings = EncodingWarning.check(board);
    }

    /**
     * @return count mismatches of this board; the model is generated regardless
     */
    public List<EncodingWarning> getWarnings() {
        return warnings;
    }

    /**
     * Builds the model.
     *
     * @return a fresh module, structurally equal on every call
     */
    public SmvModule synthesize() {
        if (CheckerConfig.isNormal()) {
            for (EncodingWarning warning : warnings) {
                System.err.println("[ModelSynthesizer] WARNING: " + warning.description);
            }
        }

        int numBoxes = board.getNumBoxes();

        Map<String, Integer> constants = new LinkedHashMap<>();
        constants.put(Vocabulary.WIDTH, board.getWidth());
        constants.put(Vocabulary.HEIGHT, board.getHeight());
        constants.put(Vocabulary.NUM_BOXES, numBoxes);

        SmvModule module = new SmvModule(
                Vocabulary.MODULE_NAME,
                "Automatically generated SMV model for Sokoban",
                constants,
                declarations(),
                initialValues(),
                nextStates(),
                List.of(new SmvModule.Define(Vocabulary.WIN, goal())),
                List.of(Formula.eventually(Formula.ref(Vocabulary.WIN))));

        if (CheckerConfig.isVerbose()) {
            System.err.println("[ModelSynthesizer] " + module.getVariables().size() + " variables, "
                    + module.getNexts().size() + " next-state assignments, "
                    + board.getNumPairs() + " box/target pairs");
        }
        return module;
    }

    /**
     * Builds the model and renders it.
     */
    public String synthesizeText() {
        return SmvPrinter.print(synthesize());
    }

    private List<SmvModule.VarDecl> declarations() {
        Term zero = Term.literal(0);
        SmvModule.Range xRange = new SmvModule.Range(zero, Term.identifier(Vocabulary.WIDTH).plus(-1));
        SmvModule.Range yRange = new SmvModule.Range(zero, Term.identifier(Vocabulary.HEIGHT).plus(-1));

        List<SmvModule.VarDecl> vars = new ArrayList<>();
        vars.add(new SmvModule.VarDecl(Vocabulary.PLAYER_X, xRange));
        vars.add(new SmvModule.VarDecl(Vocabulary.PLAYER_Y, yRange));
        // array 1..0 is not a valid type, so a box-free board declares no box arrays
        if (board.getNumBoxes() > 0) {
            Term numBoxes = Term.identifier(Vocabulary.NUM_BOXES);
            vars.add(new SmvModule.VarDecl(Vocabulary.BOX_X, new SmvModule.ArrayOf(1, numBoxes, xRange)));
            vars.add(new SmvModule.VarDecl(Vocabulary.BOX_Y, new SmvModule.ArrayOf(1, numBoxes, yRange)));
        }
        vars.add(new SmvModule.VarDecl(Vocabulary.MOVE, new SmvModule.Enumeration(Vocabulary.MOVE_SYMBOLS)));
        return vars;
    }

    private List<SmvModule.Assignment> initialValues() {
        List<SmvModule.Assignment> inits = new ArrayList<>();
        Position agent = board.getAgent();
        inits.add(new SmvModule.Assignment(Vocabulary.playerX(), Term.literal(agent.x)));
        inits.add(new SmvModule.Assignment(Vocabulary.playerY(), Term.literal(agent.y)));
        for (int i = 1; i <= board.getNumBoxes(); i++) {
            Position box = board.getBox(i);
            inits.add(new SmvModule.Assignment(Vocabulary.boxX(i), Term.literal(box.x)));
            inits.add(new SmvModule.Assignment(Vocabulary.boxY(i), Term.literal(box.y)));
        }
        return inits;
    }

    private List<SmvModule.CaseAssignment> nextStates() {
        List<SmvModule.CaseAssignment> nexts = new ArrayList<>();
        nexts.add(agentNext(Vocabulary.playerX(), HORIZONTAL));
        nexts.add(agentNext(Vocabulary.playerY(), VERTICAL));
        for (int i = 1; i <= board.getNumBoxes(); i++) {
            nexts.add(boxNext(i, Vocabulary.boxX(i), HORIZONTAL));
            nexts.add(boxNext(i, Vocabulary.boxY(i), VERTICAL));
        }
        return nexts;
    }

    /**
     * Case list of one agent coordinate: the steps along that axis, then the pushes.
     */
    private SmvModule.CaseAssignment agentNext(Term coordinate, Direction[] axis) {
        List<SmvModule.Branch> branches = new ArrayList<>();
        for (Direction dir : axis) {
            branches.add(new SmvModule.Branch(stepGuard(dir), coordinate.plus(delta(dir))));
        }
        for (Direction dir : axis) {
            branches.add(new SmvModule.Branch(pushGuard(dir), coordinate.plus(delta(dir))));
        }
        return new SmvModule.CaseAssignment(coordinate, branches, coordinate);
    }

    /**
     * Case list of one box coordinate: moved only by a push along that axis
     * while this box is the one adjacent to the agent.
     */
    private SmvModule.CaseAssignment boxNext(int index, Term coordinate, Direction[] axis) {
        List<SmvModule.Branch> branches = new ArrayList<>();
        for (Direction dir : axis) {
            Formula guard = Formula.and(
                    Vocabulary.moveIs(Move.push(dir)),
                    predicates.isBox(index, adjacentX(dir, 1), adjacentY(dir, 1)),
                    predicates.freeCell(adjacentX(dir, 2), adjacentY(dir, 2)));
            branches.add(new SmvModule.Branch(guard, coordinate.plus(delta(dir))));
        }
        return new SmvModule.CaseAssignment(coordinate, branches, coordinate);
    }

    private Formula stepGuard(Direction dir) {
        return Formula.and(
                Vocabulary.moveIs(Move.step(dir)),
                predicates.freeCell(adjacentX(dir, 1), adjacentY(dir, 1)));
    }

    private Formula pushGuard(Direction dir) {
        return Formula.and(
                Vocabulary.moveIs(Move.push(dir)),
                Formula.and(
                        predicates.boxAt(adjacentX(dir, 1), adjacentY(dir, 1)),
                        predicates.freeCell(adjacentX(dir, 2), adjacentY(dir, 2))));
    }

    /**
     * Goal: box i on target i for every pair; TRUE when there are no pairs.
     */
    Formula goal() {
        List<Formula> pairs = new ArrayList<>();
        for (int i = 1; i <= board.getNumPairs(); i++) {
            Position target = board.getTargets().get(i - 1);
            pairs.add(Formula.and(
                    Formula.eq(Vocabulary.boxX(i), Term.literal(target.x)),
                    Formula.eq(Vocabulary.boxY(i), Term.literal(target.y))));
        }
        return Formula.and(pairs);
    }

    private static Term adjacentX(Direction dir, int distance) {
        return Vocabulary.playerX().plus(dir.dx * distance);
    }

    private static Term adjacentY(Direction dir, int distance) {
        return Vocabulary.playerY().plus(dir.dy * distance);
    }

    private static int delta(Direction dir) {
        return dir.isHorizontal() ? dir.dx : dir.dy;
    }
}
