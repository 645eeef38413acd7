package sokoban.encoding;

import sokoban.domain.Move;
import sokoban.smv.Formula;
import sokoban.smv.Term;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Names shared by the generated model and everything that reads the
 * checker's answer back. Changing a name here changes both sides.
 */
public final class Vocabulary {

    public static final String MODULE_NAME = "main";

    public static final String WIDTH = "WIDTH";
    public static final String HEIGHT = "HEIGHT";
    public static final String NUM_BOXES = "NUM_BOXES";

    public static final String PLAYER_X = "player_x";
    public static final String PLAYER_Y = "player_y";
    public static final String BOX_X = "box_x";
    public static final String BOX_Y = "box_y";

    /** Move selector; ranges over {@link Move#ALPHABET} */
    public static final String MOVE = "move";

    /** DEFINE'd goal predicate */
    public static final String WIN = "win";

    /** Move symbols in declaration order */
    public static final List<String> MOVE_SYMBOLS;

    static {
        List<String> symbols = new ArrayList<>();
        for (char c : Move.ALPHABET.toCharArray()) {
            symbols.add(String.valueOf(c));
        }
        MOVE_SYMBOLS = Collections.unmodifiableList(symbols);
    }

    private Vocabulary() {}

    public static Term playerX() {
        return Term.identifier(PLAYER_X);
    }

    public static Term playerY() {
        return Term.identifier(PLAYER_Y);
    }

    public static Term boxX(int index) {
        return Term.element(BOX_X, index);
    }

    public static Term boxY(int index) {
        return Term.element(BOX_Y, index);
    }

    /**
     * @return the guard "move = symbol" for the given move
     */
    public static Formula moveIs(Move move) {
        return Formula.eq(Term.identifier(MOVE), Term.symbol(move.toString()));
    }
}
