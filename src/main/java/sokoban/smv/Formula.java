package sokoban.smv;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Boolean (and temporal) expression tree of the SMV language.
 *
 * Node kinds: literal TRUE/FALSE, comparison of two terms, n-ary conjunction
 * and disjunction, negation, a reference to a DEFINE'd name, and the LTL
 * "eventually" operator. Formulas are immutable and compare structurally.
 */
public abstract class Formula {

    public static final BoolLiteral TRUE = new BoolLiteral(true);
    public static final BoolLiteral FALSE = new BoolLiteral(false);

    Formula() {}

    // ========== Factories ==========

    public static Comparison eq(Term left, Term right) {
        return new Comparison(Comparison.Op.EQ, left, right);
    }

    public static Comparison lt(Term left, Term right) {
        return new Comparison(Comparison.Op.LT, left, right);
    }

    public static Comparison ge(Term left, Term right) {
        return new Comparison(Comparison.Op.GE, left, right);
    }

    /**
     * Conjunction of the operands. No operands yields TRUE, one operand
     * yields the operand itself. Nested conjunctions are kept as they are.
     */
    public static Formula and(List<? extends Formula> operands) {
        return junction(Junction.Kind.AND, operands, TRUE);
    }

    public static Formula and(Formula... operands) {
        return and(Arrays.asList(operands));
    }

    /**
     * Disjunction of the operands. No operands yields FALSE, one operand
     * yields the operand itself.
     */
    public static Formula or(List<? extends Formula> operands) {
        return junction(Junction.Kind.OR, operands, FALSE);
    }

    public static Formula or(Formula... operands) {
        return or(Arrays.asList(operands));
    }

    public static Formula not(Formula operand) {
        return new Not(operand);
    }

    public static DefineRef ref(String name) {
        return new DefineRef(name);
    }

    public static Eventually eventually(Formula operand) {
        return new Eventually(operand);
    }

    private static Formula junction(Junction.Kind kind, List<? extends Formula> operands, Formula empty) {
        if (operands.isEmpty()) {
            return empty;
        }
        if (operands.size() == 1) {
            return operands.get(0);
        }
        return new Junction(kind, operands);
    }

    // ========== Node kinds ==========

    /** TRUE or FALSE */
    public static final class BoolLiteral extends Formula {
        public final boolean value;

        private BoolLiteral(boolean value) {
            this.value = value;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof BoolLiteral && ((BoolLiteral) obj).value == value;
        }

        @Override
        public int hashCode() {
            return value ? 1 : 0;
        }
    }

    /** left op right */
    public static final class Comparison extends Formula {

        public enum Op {
            EQ("="),
            LT("<"),
            GE(">=");

            public final String token;

            Op(String token) {
                this.token = token;
            }
        }

        public final Op op;
        public final Term left;
        public final Term right;

        Comparison(Op op, Term left, Term right) {
            this.op = Objects.requireNonNull(op);
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Comparison)) return false;
            Comparison other = (Comparison) obj;
            return op == other.op && left.equals(other.left) && right.equals(other.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, left, right);
        }
    }

    /** n-ary AND / OR, always at least two operands */
    public static final class Junction extends Formula {

        public enum Kind {
            AND("&"),
            OR("|");

            public final String token;

            Kind(String token) {
                this.token = token;
            }
        }

        public final Kind kind;
        public final List<Formula> operands;

        Junction(Kind kind, List<? extends Formula> operands) {
            this.kind = Objects.requireNonNull(kind);
            this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Junction)) return false;
            Junction other = (Junction) obj;
            return kind == other.kind && operands.equals(other.operands);
        }

        @Override
        public int hashCode() {
            return 31 * kind.hashCode() + operands.hashCode();
        }
    }

    /** !operand */
    public static final class Not extends Formula {
        public final Formula operand;

        Not(Formula operand) {
            this.operand = Objects.requireNonNull(operand);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Not && ((Not) obj).operand.equals(operand);
        }

        @Override
        public int hashCode() {
            return ~operand.hashCode();
        }
    }

    /** Use of a name introduced in the DEFINE section */
    public static final class DefineRef extends Formula {
        public final String name;

        DefineRef(String name) {
            this.name = Objects.requireNonNull(name);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof DefineRef && ((DefineRef) obj).name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }
    }

    /** LTL: F operand */
    public static final class Eventually extends Formula {
        public final Formula operand;

        Eventually(Formula operand) {
            this.operand = Objects.requireNonNull(operand);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Eventually && ((Eventually) obj).operand.equals(operand);
        }

        @Override
        public int hashCode() {
            return 17 * operand.hashCode();
        }
    }

    @Override
    public String toString() {
        return SmvPrinter.print(this);
    }
}
