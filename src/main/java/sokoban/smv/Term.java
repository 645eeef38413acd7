package sokoban.smv;

import java.util.Objects;

/**
 * Arithmetic or symbolic term of an SMV expression: an integer literal,
 * a named identifier (variable or constant), an enumeration symbol,
 * an array element, or a term shifted by a constant offset.
 *
 * Terms are immutable and compare structurally. Rendering lives in
 * {@link SmvPrinter}, evaluation in {@link Evaluator}.
 */
public abstract class Term {

    Term() {}

    public static IntLiteral literal(int value) {
        return new IntLiteral(value);
    }

    public static Identifier identifier(String name) {
        return new Identifier(name);
    }

    public static Symbol symbol(String name) {
        return new Symbol(name);
    }

    public static ArrayElement element(String array, int index) {
        return new ArrayElement(array, index);
    }

    /**
     * Shifts this term by a constant. A zero delta returns the term itself,
     * and shifting an offset folds the two deltas.
     */
    public Term plus(int delta) {
        if (delta == 0) {
            return this;
        }
        return new Offset(this, delta);
    }

    /** Integer constant */
    public static final class IntLiteral extends Term {
        public final int value;

        IntLiteral(int value) {
            this.value = value;
        }

        @Override
        public Term plus(int delta) {
            return new IntLiteral(value + delta);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof IntLiteral && ((IntLiteral) obj).value == value;
        }

        @Override
        public int hashCode() {
            return value;
        }
    }

    /** Reference to a scalar variable or a named constant */
    public static final class Identifier extends Term {
        public final String name;

        Identifier(String name) {
            this.name = Objects.requireNonNull(name);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Identifier && ((Identifier) obj).name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }
    }

    /** Value of an enumeration type, e.g. a move symbol */
    public static final class Symbol extends Term {
        public final String name;

        Symbol(String name) {
            this.name = Objects.requireNonNull(name);
        }

        @Override
        public Term plus(int delta) {
            throw new UnsupportedOperationException("Cannot offset enumeration symbol " + name);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Symbol && ((Symbol) obj).name.equals(name);
        }

        @Override
        public int hashCode() {
            return 7 * name.hashCode();
        }
    }

    /** Element of a 1-based array variable, e.g. box_x[2] */
    public static final class ArrayElement extends Term {
        public final String array;
        public final int index;

        ArrayElement(String array, int index) {
            this.array = Objects.requireNonNull(array);
            this.index = index;
        }

        /**
         * @return the key this element is stored under in a valuation, e.g. "box_x[2]"
         */
        public String key() {
            return array + "[" + index + "]";
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof ArrayElement)) return false;
            ArrayElement other = (ArrayElement) obj;
            return array.equals(other.array) && index == other.index;
        }

        @Override
        public int hashCode() {
            return 31 * array.hashCode() + index;
        }
    }

    /** base + delta, with delta never zero */
    public static final class Offset extends Term {
        public final Term base;
        public final int delta;

        Offset(Term base, int delta) {
            this.base = Objects.requireNonNull(base);
            this.delta = delta;
        }

        @Override
        public Term plus(int more) {
            return base.plus(delta + more);
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Offset)) return false;
            Offset other = (Offset) obj;
            return base.equals(other.base) && delta == other.delta;
        }

        @Override
        public int hashCode() {
            return 31 * base.hashCode() + delta;
        }
    }

    @Override
    public String toString() {
        return SmvPrinter.print(this);
    }
}
