package sokoban.encoding;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;
import sokoban.client.BoardParser;
import sokoban.domain.Board;

class ModelSynthesizerTest {

    private final BoardParser parser = new BoardParser();

    private Board resource(String name) throws IOException, URISyntaxException {
        Path path = Paths.get(getClass().getResource("/boards/" + name).toURI());
        return parser.parseFile(path);
    }

    /** Returns the text from "next(target) := case" up to its "esac;". */
    private static String caseBlock(String model, String target) {
        int start = model.indexOf("next(" + target + ") := case");
        assertThat(start).isNotNegative();
        int end = model.indexOf("esac;", start);
        return model.substring(start, end);
    }

    @Test
    void testDeclarationsAndInitialValues() throws Exception {
        String model = new ModelSynthesizer(resource("simple.xsb")).synthesizeText();

        assertThat(model).startsWith("-- Automatically generated SMV model for Sokoban\nMODULE main\n");
        assertThat(model).contains(
                "CONSTANTS\n    WIDTH := 5;\n    HEIGHT := 3;\n    NUM_BOXES := 1;\n",
                "    player_x : 0..WIDTH - 1;\n",
                "    player_y : 0..HEIGHT - 1;\n",
                "    box_x : array 1..NUM_BOXES of 0..WIDTH - 1;\n",
                "    box_y : array 1..NUM_BOXES of 0..HEIGHT - 1;\n",
                "    move : {l, r, u, d, L, R, U, D};\n",
                "    init(player_x) := 1;\n    init(player_y) := 1;\n",
                "    init(box_x[1]) := 2;\n    init(box_y[1]) := 1;\n");
        assertThat(model).doesNotContain("box_x[2]");
    }

    /** One box, one target: a single pairing in the goal, checked with F win. */
    @Test
    void testGoalAndProperty() throws Exception {
        String model = new ModelSynthesizer(resource("simple.xsb")).synthesizeText();

        assertThat(model).contains("DEFINE\n    win := box_x[1] = 3 & box_y[1] = 1;\n");
        assertThat(model).endsWith("LTLSPEC\n    F win\n");
    }

    /** Box i pairs with target i of the sorted targets; the third target is left out. */
    @Test
    void testGoalUsesFirstTargetsOnly() throws Exception {
        Board board = resource("two_boxes_three_targets.xsb");
        ModelSynthesizer synthesizer = new ModelSynthesizer(board);
        String model = synthesizer.synthesizeText();

        assertThat(model).contains(
                "    win := (box_x[1] = 1 & box_y[1] = 2) & (box_x[2] = 3 & box_y[2] = 2);\n");
        assertThat(model).doesNotContain("box_x[1] = 5", "box_x[2] = 5");
        assertThat(synthesizer.getWarnings()).containsExactly(EncodingWarning.UNPAIRED_TARGETS);
    }

    /** Each axis only lists the guards that can move along it. */
    @Test
    void testAgentCaseListsPerAxis() throws Exception {
        String model = new ModelSynthesizer(resource("simple.xsb")).synthesizeText();

        String xCase = caseBlock(model, "player_x");
        assertThat(xCase).contains("move = l & ", "move = r & ", "move = L & ", "move = R & ",
                " : player_x - 1;", " : player_x + 1;", "TRUE : player_x;");
        assertThat(xCase).doesNotContain("move = u", "move = d", "move = U", "move = D");

        String yCase = caseBlock(model, "player_y");
        assertThat(yCase).contains("move = u & ", "move = d & ", "move = U & ", "move = D & ",
                " : player_y - 1;", " : player_y + 1;", "TRUE : player_y;");
        assertThat(yCase).doesNotContain("move = l", "move = r", "move = L", "move = R");
    }

    @Test
    void testPushGuardOfBox() throws Exception {
        String model = new ModelSynthesizer(resource("simple.xsb")).synthesizeText();

        String boxCase = caseBlock(model, "box_x[1]");
        assertThat(boxCase).contains(
                "move = R & (player_x + 1 = box_x[1] & player_y = box_y[1]) & ((player_x + 2 >= 0",
                " : box_x[1] + 1;",
                " : box_x[1] - 1;",
                "TRUE : box_x[1];");
        assertThat(boxCase).doesNotContain("move = r", "move = U");
    }

    /** Same board, same bytes. */
    @Test
    void testDeterministic() throws Exception {
        Board board = resource("two_boxes_three_targets.xsb");

        String first = new ModelSynthesizer(board).synthesizeText();
        String second = new ModelSynthesizer(board).synthesizeText();
        ModelSynthesizer synthesizer = new ModelSynthesizer(board);

        assertThat(second).isEqualTo(first);
        assertThat(synthesizer.synthesizeText()).isEqualTo(synthesizer.synthesizeText()).isEqualTo(first);
    }

    /** A box-free board compiles to a model whose goal is already true. */
    @Test
    void testBoardWithoutBoxes() {
        Board board = parser.parseString("####\n#@.#\n####");
        ModelSynthesizer synthesizer = new ModelSynthesizer(board);
        String model = synthesizer.synthesizeText();

        assertThat(synthesizer.getWarnings())
                .containsExactly(EncodingWarning.VACUOUS_GOAL, EncodingWarning.UNPAIRED_TARGETS);
        assertThat(model).contains("    NUM_BOXES := 0;\n", "    win := TRUE;\n");
        assertThat(model).doesNotContain("box_x", "box_y");
        assertThat(caseBlock(model, "player_x")).contains("move = L & (FALSE & (");
    }

    @Test
    void testMoreBoxesThanTargets() {
        Board board = parser.parseString("#####\n#@$$.#\n#####");
        ModelSynthesizer synthesizer = new ModelSynthesizer(board);

        assertThat(synthesizer.getWarnings()).containsExactly(EncodingWarning.UNPAIRED_BOXES);
        assertThat(synthesizer.synthesizeText()).contains("    win := box_x[1] = 4 & box_y[1] = 1;\n");
    }
}
