package sokoban.domain;

/**
 * Immutable class representing a cell (coordinate) on the board.
 * Uses x (column) and y (row) indices where (0,0) is the top-left corner.
 * y increases downward, x increases rightward.
 *
 * Positions order row-major: first by y, then by x. That ordering is what
 * makes wall and target iteration reproducible across compilations.
 */
public final class Position implements Comparable<Position> {

    /** The column index (horizontal position, 0-indexed from left) */
    public final int x;

    /** The row index (vertical position, 0-indexed from top) */
    public final int y;

    /**
     * Creates a new Position with the specified column and row.
     *
     * @param x the column index (0-indexed)
     * @param y the row index (0-indexed)
     */
    public Position(int x, int y) {
        this.x = x;
        this.y = y;
    }

    /**
     * Factory alias for the constructor, reads better in tests and tables.
     */
    public static Position of(int x, int y) {
        return new Position(x, y);
    }

    /**
     * Returns the Position adjacent to this position in the given direction.
     *
     * @param direction the direction to move
     * @return the Position in the specified direction
     */
    public Position move(Direction direction) {
        return new Position(x + direction.dx, y + direction.dy);
    }

    @Override
    public int compareTo(Position other) {
        if (y != other.y) {
            return Integer.compare(y, other.y);
        }
        return Integer.compare(x, other.x);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Position position = (Position) obj;
        return x == position.x && y == position.y;
    }

    @Override
    public int hashCode() {
        return 31 * y + x;
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
