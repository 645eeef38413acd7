package sokoban.client;

import sokoban.checker.CheckerConfig;
import sokoban.domain.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Parses boards from the XSB text format.
 *
 * Board format:
 * <pre>
 * #####
 * #@$.#
 * #####
 * </pre>
 *
 * Grid symbols:
 * - '#' : Wall
 * - '.' : Target
 * - '$' : Box
 * - '*' : Box on a target
 * - '@' : Agent
 * - '+' : Agent on a target
 * - anything else : Floor
 *
 * Blank lines are dropped before row numbering, so row y is the y-th
 * non-blank line. Short lines are padded with spaces to the widest line.
 */
public class BoardParser {

    private static final String TARGET_SYMBOLS = ".+*";
    private static final String BOX_SYMBOLS = "$*";
    private static final String AGENT_SYMBOLS = "@+";

    /**
     * Parses a board from a BufferedReader, reading to the end of the stream.
     *
     * @param reader the reader to read from
     * @return the parsed Board
     * @throws IOException if reading fails
     * @throws MalformedBoardException if the board has no rows or not exactly one agent
     */
    public Board parse(BufferedReader reader) throws IOException {
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            lines.add(line);
        }
        return parseLines(lines);
    }

    /**
     * Parses a board file (UTF-8).
     *
     * @param file the XSB file
     * @return the parsed Board
     * @throws IOException if the file cannot be read
     */
    public Board parseFile(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    /**
     * Parses a board from a single string with embedded newlines (for testing).
     */
    public Board parseString(String text) {
        try {
            return parse(new BufferedReader(new StringReader(text)));
        } catch (IOException e) {
            throw new IllegalStateException("StringReader failed", e);
        }
    }

    /**
     * Parses a board from already split lines.
     *
     * @param rawLines the board content, one entry per line
     * @return the parsed Board
     * @throws MalformedBoardException if the board has no rows or not exactly one agent
     */
    public Board parseLines(List<String> rawLines) {
        List<String> rows = new ArrayList<>();
        for (String raw : rawLines) {
            if (!raw.isBlank()) {
                rows.add(raw);
            }
        }

        if (rows.isEmpty()) {
            throw new MalformedBoardException("Board has no rows");
        }

        // Determine grid dimensions
        int height = rows.size();
        int width = 0;
        for (String row : rows) {
            width = Math.max(width, row.length());
        }

        Set<Position> walls = new TreeSet<>();
        List<Position> targets = new ArrayList<>();
        List<Position> boxes = new ArrayList<>();
        List<Position> agents = new ArrayList<>();

        for (int y = 0; y < height; y++) {
            String row = rows.get(y);
            for (int x = 0; x < width; x++) {
                char ch = x < row.length() ? row.charAt(x) : ' ';
                Position pos = new Position(x, y);

                // Independent membership tests: '*' is a box and a target, '+' an agent and a target
                if (ch == '#') {
                    walls.add(pos);
                }
                if (TARGET_SYMBOLS.indexOf(ch) >= 0) {
                    targets.add(pos);
                }
                if (BOX_SYMBOLS.indexOf(ch) >= 0) {
                    boxes.add(pos);
                }
                if (AGENT_SYMBOLS.indexOf(ch) >= 0) {
                    agents.add(pos);
                }
            }
        }

        if (agents.isEmpty()) {
            throw new MalformedBoardException("Board has no agent ('@' or '+')");
        }
        if (agents.size() > 1) {
            throw new MalformedBoardException("Board has " + agents.size() + " agents, expected exactly one: " + agents);
        }

        Board board = new Board(width, height, walls, targets, boxes, agents.get(0));

        if (CheckerConfig.isVerbose()) {
            System.err.println("[BoardParser] Parsed " + board);
        }
        return board;
    }
}
