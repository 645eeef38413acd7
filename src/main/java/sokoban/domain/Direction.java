package sokoban.domain;

/**
 * Enum representing the four cardinal directions for movement.
 * Each direction has associated x and y deltas and the lowercase
 * LURD symbol used for a simple step in that direction.
 */
public enum Direction {
    /** Left - decrease x */
    LEFT(-1, 0, 'l'),

    /** Right - increase x */
    RIGHT(1, 0, 'r'),

    /** Up - decrease y */
    UP(0, -1, 'u'),

    /** Down - increase y */
    DOWN(0, 1, 'd');

    /** Column delta when moving in this direction */
    public final int dx;

    /** Row delta when moving in this direction */
    public final int dy;

    /** LURD symbol of a step; the push symbol is its uppercase form */
    public final char symbol;

    Direction(int dx, int dy, char symbol) {
        this.dx = dx;
        this.dy = dy;
        this.symbol = symbol;
    }

    /**
     * @return true for LEFT and RIGHT, the directions that only change x
     */
    public boolean isHorizontal() {
        return dy == 0;
    }

    /**
     * Returns the opposite direction.
     * LEFT <-> RIGHT, UP <-> DOWN
     *
     * @return the opposite direction
     */
    public Direction opposite() {
        return switch (this) {
            case LEFT -> RIGHT;
            case RIGHT -> LEFT;
            case UP -> DOWN;
            case DOWN -> UP;
        };
    }

    /**
     * Parses a direction from a LURD symbol, ignoring case.
     *
     * @param c one of l, r, u, d (either case)
     * @return the corresponding Direction
     * @throws IllegalArgumentException if the character is not a LURD symbol
     */
    public static Direction fromSymbol(char c) {
        return switch (Character.toLowerCase(c)) {
            case 'l' -> LEFT;
            case 'r' -> RIGHT;
            case 'u' -> UP;
            case 'd' -> DOWN;
            default -> throw new IllegalArgumentException("Invalid direction: " + c);
        };
    }
}
