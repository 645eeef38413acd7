package sokoban.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An ordered, immutable sequence of moves, printed in LURD notation
 * (for example "rrDD").
 */
public final class MoveSequence implements Iterable<Move> {

    private final List<Move> moves;

    public MoveSequence(List<Move> moves) {
        this.moves = Collections.unmodifiableList(new ArrayList<>(moves));
    }

    /**
     * Parses a LURD string.
     *
     * @param lurd the move symbols, may be empty
     * @return the sequence
     * @throws IllegalArgumentException if any character is outside the alphabet
     */
    public static MoveSequence parse(String lurd) {
        List<Move> moves = new ArrayList<>(lurd.length());
        for (int i = 0; i < lurd.length(); i++) {
            moves.add(Move.fromSymbol(lurd.charAt(i)));
        }
        return new MoveSequence(moves);
    }

    public int size() {
        return moves.size();
    }

    public boolean isEmpty() {
        return moves.isEmpty();
    }

    public Move get(int index) {
        return moves.get(index);
    }

    /**
     * @return number of pushes in the sequence
     */
    public int pushCount() {
        int count = 0;
        for (Move move : moves) {
            if (move.isPush()) count++;
        }
        return count;
    }

    @Override
    public Iterator<Move> iterator() {
        return moves.iterator();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MoveSequence)) return false;
        return moves.equals(((MoveSequence) obj).moves);
    }

    @Override
    public int hashCode() {
        return moves.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(moves.size());
        for (Move move : moves) {
            sb.append(move.symbol());
        }
        return sb.toString();
    }
}
