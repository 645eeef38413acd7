package sokoban.domain;

import java.util.Objects;

/**
 * Represents a single move of the agent, one symbol of the LURD alphabet.
 *
 * Move types:
 * - Step: Agent moves one cell in a direction (the cell must be free).
 *         Written as the lowercase symbol: l, r, u, d.
 * - Push: Agent moves one cell in a direction into a box, which moves one
 *         cell further in the same direction. Written uppercase: L, R, U, D.
 */
public final class Move {

    /**
     * Enum representing the type of move.
     */
    public enum MoveType {
        STEP,
        PUSH
    }

    /** Every move symbol, in the order the selector enumeration declares them */
    public static final String ALPHABET = "lrudLRUD";

    /** The type of this move */
    public final MoveType type;

    /** Direction the agent moves */
    public final Direction direction;

    // --- Static move cache: all 8 possible moves are pre-created ---
    private static final Move[] STEP_MOVES = new Move[Direction.values().length];
    private static final Move[] PUSH_MOVES = new Move[Direction.values().length];

    static {
        for (Direction dir : Direction.values()) {
            STEP_MOVES[dir.ordinal()] = new Move(MoveType.STEP, dir);
            PUSH_MOVES[dir.ordinal()] = new Move(MoveType.PUSH, dir);
        }
    }

    /**
     * Private constructor - use factory methods to create moves.
     */
    private Move(MoveType type, Direction direction) {
        this.type = type;
        this.direction = direction;
    }

    /**
     * Creates a Step move in the specified direction.
     *
     * @param direction the direction to move
     * @return a Step move
     */
    public static Move step(Direction direction) {
        Objects.requireNonNull(direction, "Direction cannot be null for Step move");
        return STEP_MOVES[direction.ordinal()];
    }

    /**
     * Creates a Push move in the specified direction.
     *
     * @param direction the direction the agent and the pushed box move
     * @return a Push move
     */
    public static Move push(Direction direction) {
        Objects.requireNonNull(direction, "Direction cannot be null for Push move");
        return PUSH_MOVES[direction.ordinal()];
    }

    /**
     * @return true if this is a push
     */
    public boolean isPush() {
        return type == MoveType.PUSH;
    }

    /**
     * Returns the LURD symbol of this move.
     *
     * @return lowercase for a step, uppercase for a push
     */
    public char symbol() {
        return isPush() ? Character.toUpperCase(direction.symbol) : direction.symbol;
    }

    /**
     * Checks whether a character belongs to the LURD alphabet.
     */
    public static boolean isSymbol(char c) {
        return ALPHABET.indexOf(c) >= 0;
    }

    /**
     * Parses a move from its LURD symbol.
     *
     * @param c the symbol
     * @return the parsed Move
     * @throws IllegalArgumentException if the character is not in the alphabet
     */
    public static Move fromSymbol(char c) {
        if (!isSymbol(c)) {
            throw new IllegalArgumentException("Unknown move symbol: " + c);
        }
        Direction dir = Direction.fromSymbol(c);
        return Character.isUpperCase(c) ? push(dir) : step(dir);
    }

    /**
     * Returns all 8 moves in alphabet order (l, r, u, d, L, R, U, D).
     */
    public static Move[] all() {
        Move[] moves = new Move[ALPHABET.length()];
        for (int i = 0; i < moves.length; i++) {
            moves[i] = fromSymbol(ALPHABET.charAt(i));
        }
        return moves;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Move move = (Move) obj;
        return type == move.type && direction == move.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, direction);
    }

    @Override
    public String toString() {
        return String.valueOf(symbol());
    }
}
