package sokoban.encoding;

import sokoban.domain.Board;
import sokoban.domain.Position;
import sokoban.smv.Formula;
import sokoban.smv.Term;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the cell predicates the transition relation is made of.
 *
 * Every method takes symbolic coordinates (terms such as player_x - 1, not
 * numbers) and returns a formula over the model's variables. Walls come
 * from the static board; boxes are referred to through the box_x / box_y
 * arrays, so the predicates hold for any state of the model.
 */
public class Predicates {

    private final Board board;

    public Predicates(Board board) {
        this.board = board;
    }

    /**
     * 0 <= ex < WIDTH and 0 <= ey < HEIGHT.
     */
    public Formula inBounds(Term ex, Term ey) {
        Term zero = Term.literal(0);
        return Formula.and(
                Formula.ge(ex, zero),
                Formula.lt(ex, Term.identifier(Vocabulary.WIDTH)),
                Formula.ge(ey, zero),
                Formula.lt(ey, Term.identifier(Vocabulary.HEIGHT)));
    }

    /**
     * One conjunct !(ex = wx & ey = wy) per wall, in row-major order.
     * TRUE when the board has no walls.
     */
    public Formula notWall(Term ex, Term ey) {
        List<Formula> conjuncts = new ArrayList<>(board.getWalls().size());
        for (Position wall : board.getWalls()) {
            conjuncts.add(Formula.not(Formula.and(
                    Formula.eq(ex, Term.literal(wall.x)),
                    Formula.eq(ey, Term.literal(wall.y)))));
        }
        if (conjuncts.isEmpty()) {
            return Formula.TRUE;
        }
        return Formula.and(conjuncts);
    }

    /**
     * Negation of {@link #boxAt}. TRUE when the board has no boxes.
     */
    public Formula notBox(Term ex, Term ey) {
        if (board.getNumBoxes() == 0) {
            return Formula.TRUE;
        }
        return Formula.not(boxAt(ex, ey));
    }

    /**
     * A cell the agent may enter or a pushed box may land on.
     */
    public Formula freeCell(Term ex, Term ey) {
        return Formula.and(inBounds(ex, ey), notWall(ex, ey), notBox(ex, ey));
    }

    /**
     * Some box i has box_x[i] = ex and box_y[i] = ey. FALSE when the board has no boxes.
     */
    public Formula boxAt(Term ex, Term ey) {
        List<Formula> disjuncts = new ArrayList<>(board.getNumBoxes());
        for (int i = 1; i <= board.getNumBoxes(); i++) {
            disjuncts.add(isBox(i, ex, ey));
        }
        return Formula.or(disjuncts);
    }

    /**
     * Box {@code index} sits at (ex, ey).
     */
    public Formula isBox(int index, Term ex, Term ey) {
        return Formula.and(
                Formula.eq(ex, Vocabulary.boxX(index)),
                Formula.eq(ey, Vocabulary.boxY(index)));
    }
}
