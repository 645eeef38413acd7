package sokoban.encoding;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;
import sokoban.client.BoardParser;
import sokoban.domain.Board;
import sokoban.domain.Position;
import sokoban.smv.Formula;
import sokoban.smv.SmvPrinter;
import sokoban.smv.Term;

class PredicatesTest {

    private final BoardParser parser = new BoardParser();
    private final Term cx = Term.identifier("cx");
    private final Term cy = Term.identifier("cy");

    /** Without walls and boxes the exclusion predicates are the constant TRUE for any coordinates. */
    @Test
    void testVacuousOnEmptyBoard() {
        Predicates predicates = new Predicates(parser.parseString("@  .."));

        assertThat(predicates.notWall(cx, cy)).isSameAs(Formula.TRUE);
        assertThat(predicates.notBox(cx, cy)).isSameAs(Formula.TRUE);
        assertThat(predicates.notWall(Vocabulary.playerX().plus(-2), Term.literal(7))).isSameAs(Formula.TRUE);
        assertThat(predicates.boxAt(cx, cy)).isSameAs(Formula.FALSE);
    }

    @Test
    void testInBounds() {
        Predicates predicates = new Predicates(parser.parseString("@"));

        assertThat(SmvPrinter.print(predicates.inBounds(Vocabulary.playerX().plus(-1), Vocabulary.playerY())))
                .isEqualTo("(player_x - 1 >= 0 & player_x - 1 < WIDTH & player_y >= 0 & player_y < HEIGHT)");
    }

    @Test
    void testNotWallRendering() {
        Predicates predicates = new Predicates(parser.parseString("#@#"));

        assertThat(SmvPrinter.print(predicates.notWall(cx, cy)))
                .isEqualTo("(!(cx = 0 & cy = 0) & !(cx = 2 & cy = 0))");
    }

    /** Each wall is excluded by exactly one conjunct, and nothing else is. */
    @Test
    void testNotWallHasOneConjunctPerWall() {
        Board board = parser.parseString("#####\n#@$.#\n# # #\n#####");
        Formula notWall = new Predicates(board).notWall(cx, cy);

        assertThat(notWall).isInstanceOf(Formula.Junction.class);
        Formula.Junction conjunction = (Formula.Junction) notWall;
        assertThat(conjunction.kind).isEqualTo(Formula.Junction.Kind.AND);
        assertThat(conjunction.operands).hasSize(board.getWalls().size());

        Set<Position> excluded = new HashSet<>();
        for (Formula conjunct : conjunction.operands) {
            Formula.Junction cell = (Formula.Junction) ((Formula.Not) conjunct).operand;
            int x = ((Term.IntLiteral) ((Formula.Comparison) cell.operands.get(0)).right).value;
            int y = ((Term.IntLiteral) ((Formula.Comparison) cell.operands.get(1)).right).value;
            assertThat(excluded.add(Position.of(x, y))).isTrue();
        }
        assertThat(excluded).isEqualTo(board.getWalls());
    }

    @Test
    void testBoxPredicates() {
        Predicates predicates = new Predicates(parser.parseString("@$ $"));

        assertThat(SmvPrinter.print(predicates.boxAt(cx, cy)))
                .isEqualTo("((cx = box_x[1] & cy = box_y[1]) | (cx = box_x[2] & cy = box_y[2]))");
        assertThat(SmvPrinter.print(predicates.notBox(cx, cy)))
                .isEqualTo("!((cx = box_x[1] & cy = box_y[1]) | (cx = box_x[2] & cy = box_y[2]))");
    }

    @Test
    void testFreeCellIsConjunctionOfThree() {
        Predicates predicates = new Predicates(parser.parseString("#@$"));

        assertThat(SmvPrinter.print(predicates.freeCell(cx, cy))).isEqualTo(
                "((cx >= 0 & cx < WIDTH & cy >= 0 & cy < HEIGHT)"
                        + " & !(cx = 0 & cy = 0)"
                        + " & !(cx = box_x[1] & cy = box_y[1]))");
    }
}
