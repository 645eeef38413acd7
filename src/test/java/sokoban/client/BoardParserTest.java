package sokoban.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import sokoban.domain.Board;
import sokoban.domain.Position;

class BoardParserTest {

    private final BoardParser parser = new BoardParser();

    /** Parse the smallest pushable board. */
    @Test
    void testSimpleBoard() {
        Board board = parser.parseString("#####\n#@$.#\n#####");

        assertThat(board.getWidth()).isEqualTo(5);
        assertThat(board.getHeight()).isEqualTo(3);
        assertThat(board.getAgent()).isEqualTo(Position.of(1, 1));
        assertThat(board.getBoxes()).containsExactly(Position.of(2, 1));
        assertThat(board.getTargets()).containsExactly(Position.of(3, 1));
        assertThat(board.getWalls()).hasSize(12)
                .contains(Position.of(0, 0), Position.of(4, 1), Position.of(4, 2))
                .doesNotContain(Position.of(1, 1), Position.of(2, 1), Position.of(3, 1));
    }

    /** Blank lines are dropped and short rows are padded to the widest row. */
    @Test
    void testPaddingAndBlankLines() throws IOException {
        Board board;
        try (InputStream in = getClass().getResourceAsStream("/boards/padded.xsb");
             BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            board = parser.parse(reader);
        }

        assertThat(board.getHeight()).isEqualTo(5);
        assertThat(board.getWidth()).isEqualTo(6);
        assertThat(board.getAgent()).isEqualTo(Position.of(3, 2));
        assertThat(board.getBoxes()).containsExactly(Position.of(2, 2));
        assertThat(board.getTargets()).containsExactly(Position.of(1, 2));
        // the row after the blank line is row 3, not row 4
        assertThat(board.isWall(Position.of(0, 3))).isTrue();
        assertThat(board.isWall(Position.of(0, 0))).isFalse();
    }

    /** '*' registers both a box and a target, '+' both the agent and a target. */
    @Test
    void testSuperpositionMarkers() {
        Board board = parser.parseLines(List.of("#####", "#+*$#", "# . #", "#####"));

        assertThat(board.getAgent()).isEqualTo(Position.of(1, 1));
        assertThat(board.getBoxes()).containsExactly(Position.of(2, 1), Position.of(3, 1));
        assertThat(board.getTargets()).containsExactly(Position.of(1, 1), Position.of(2, 1), Position.of(2, 2));
    }

    /** The first box found row-major is box 1. */
    @Test
    void testBoxIndicesAreRowMajor() {
        Board board = parser.parseLines(List.of("  $", "$@.", " $ ..."));

        assertThat(board.getBox(1)).isEqualTo(Position.of(2, 0));
        assertThat(board.getBox(2)).isEqualTo(Position.of(0, 1));
        assertThat(board.getBox(3)).isEqualTo(Position.of(1, 2));
    }

    /** Targets are sorted by row, then column. */
    @Test
    void testTargetsSortedRowMajor() {
        Board board = parser.parseLines(List.of("@  .", " ."));

        assertThat(board.getTargets()).containsExactly(Position.of(3, 0), Position.of(1, 1));
    }

    @Test
    void testEmptyInputIsMalformed() {
        assertThatThrownBy(() -> parser.parseLines(List.of())).isInstanceOf(MalformedBoardException.class);
        assertThatThrownBy(() -> parser.parseString("\n   \n\t\n"))
                .isInstanceOf(MalformedBoardException.class)
                .hasMessageContaining("no rows");
    }

    @Test
    void testMissingAgentIsMalformed() {
        assertThatThrownBy(() -> parser.parseString("#####\n# $.#\n#####"))
                .isInstanceOf(MalformedBoardException.class)
                .hasMessageContaining("no agent");
    }

    @Test
    void testSeveralAgentsAreMalformed() {
        assertThatThrownBy(() -> parser.parseString("#####\n#@$+#\n#####"))
                .isInstanceOf(MalformedBoardException.class)
                .hasMessageContaining("2 agents");
    }
}
