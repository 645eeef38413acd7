package sokoban.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Represents a parsed puzzle: the static layout (walls, targets, dimensions)
 * together with the starting positions of the boxes and the agent.
 *
 * The board uses a coordinate system where:
 * - (0,0) is the top-left cell
 * - x is the column, y is the row
 *
 * Boards are immutable. Walls iterate row-major, targets are sorted row-major,
 * and boxes keep the order they were found in, which fixes each box's 1-based
 * index for the lifetime of the generated model.
 */
public class Board {

    /** Number of columns (length of the longest input line) */
    private final int width;

    /** Number of rows (number of non-blank input lines) */
    private final int height;

    /** Wall cells in row-major order. Immutable. */
    private final SortedSet<Position> walls;

    /** Target cells sorted by (y, x). Immutable. */
    private final List<Position> targets;

    /** Box starting cells in scan order; box i is boxes.get(i - 1). Immutable. */
    private final List<Position> boxes;

    /** Agent starting cell */
    private final Position agent;

    /**
     * Creates a new Board.
     *
     * @param width number of columns
     * @param height number of rows
     * @param walls wall cells (will be copied)
     * @param targets target cells (will be copied and sorted row-major)
     * @param boxes box starting cells in index order (will be copied)
     * @param agent agent starting cell
     */
    public Board(int width, int height, Collection<Position> walls,
                 Collection<Position> targets, List<Position> boxes, Position agent) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Board dimensions must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.walls = Collections.unmodifiableSortedSet(new TreeSet<>(walls));

        List<Position> sortedTargets = new ArrayList<>(targets);
        Collections.sort(sortedTargets);
        this.targets = Collections.unmodifiableList(sortedTargets);

        this.boxes = Collections.unmodifiableList(new ArrayList<>(boxes));
        this.agent = Objects.requireNonNull(agent, "Board requires an agent position");
    }

    /**
     * @return number of columns
     */
    public int getWidth() {
        return width;
    }

    /**
     * @return number of rows
     */
    public int getHeight() {
        return height;
    }

    /**
     * @return wall cells in row-major order
     */
    public SortedSet<Position> getWalls() {
        return walls;
    }

    /**
     * @return target cells sorted by row, then column
     */
    public List<Position> getTargets() {
        return targets;
    }

    /**
     * @return box starting cells, index 0 is box 1
     */
    public List<Position> getBoxes() {
        return boxes;
    }

    /**
     * Returns the starting cell of a box by its 1-based index.
     *
     * @param index box index, 1..getNumBoxes()
     * @return the box's starting position
     */
    public Position getBox(int index) {
        return boxes.get(index - 1);
    }

    /**
     * @return the agent's starting cell
     */
    public Position getAgent() {
        return agent;
    }

    public int getNumBoxes() {
        return boxes.size();
    }

    public int getNumTargets() {
        return targets.size();
    }

    /**
     * Number of box/target pairs the goal predicate is built from.
     */
    public int getNumPairs() {
        return Math.min(boxes.size(), targets.size());
    }

    public boolean isWall(Position pos) {
        return walls.contains(pos);
    }

    public boolean isTarget(Position pos) {
        return targets.contains(pos);
    }

    /**
     * Renders the board back to XSB notation (for debug output).
     * Trailing filler on each row is stripped.
     */
    public String toGridString() {
        StringBuilder sb = new StringBuilder();
        for (int y = 0; y < height; y++) {
            StringBuilder row = new StringBuilder();
            for (int x = 0; x < width; x++) {
                Position pos = new Position(x, y);
                boolean target = isTarget(pos);
                if (isWall(pos)) {
                    row.append('#');
                } else if (boxes.contains(pos)) {
                    row.append(target ? '*' : '$');
                } else if (agent.equals(pos)) {
                    row.append(target ? '+' : '@');
                } else {
                    row.append(target ? '.' : ' ');
                }
            }
            int end = row.length();
            while (end > 0 && row.charAt(end - 1) == ' ') end--;
            row.setLength(end);
            if (y > 0) sb.append('\n');
            sb.append(row);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Board[" + width + "x" + height + ", walls=" + walls.size()
                + ", targets=" + targets.size() + ", boxes=" + boxes.size()
                + ", agent=" + agent + "]";
    }
}
