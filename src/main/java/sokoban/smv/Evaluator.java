package sokoban.smv;

import java.util.Map;
import java.util.Objects;

/**
 * Evaluates terms and non-temporal formulas against concrete values.
 *
 * Values are Integers for numeric variables and constants, Strings for
 * enumeration-typed variables. Array elements are looked up by their
 * printed key ("box_x[1]"). DEFINE references are expanded through the
 * module's defines.
 */
public class Evaluator {

    private final Map<String, Object> values;
    private final SmvModule module;

    /**
     * @param values current variable and constant values (not copied)
     * @param module module whose DEFINEs resolve references, may be null
     */
    public Evaluator(Map<String, Object> values, SmvModule module) {
        this.values = Objects.requireNonNull(values);
        this.module = module;
    }

    /**
     * @return Integer or String value of the term
     * @throws IllegalStateException if a referenced name has no value
     */
    public Object value(Term term) {
        if (term instanceof Term.IntLiteral) {
            return ((Term.IntLiteral) term).value;
        }
        if (term instanceof Term.Symbol) {
            return ((Term.Symbol) term).name;
        }
        if (term instanceof Term.Identifier) {
            return lookup(((Term.Identifier) term).name);
        }
        if (term instanceof Term.ArrayElement) {
            return lookup(((Term.ArrayElement) term).key());
        }
        if (term instanceof Term.Offset) {
            Term.Offset offset = (Term.Offset) term;
            return intValue(offset.base) + offset.delta;
        }
        throw new IllegalArgumentException("Unknown term: " + term.getClass().getName());
    }

    public int intValue(Term term) {
        Object value = value(term);
        if (!(value instanceof Integer)) {
            throw new IllegalStateException("Term " + term + " is not numeric: " + value);
        }
        return (Integer) value;
    }

    /**
     * Evaluates a formula.
     *
     * @throws UnsupportedOperationException for temporal operators
     */
    public boolean test(Formula formula) {
        if (formula instanceof Formula.BoolLiteral) {
            return ((Formula.BoolLiteral) formula).value;
        }
        if (formula instanceof Formula.Comparison) {
            return compare((Formula.Comparison) formula);
        }
        if (formula instanceof Formula.Junction) {
            Formula.Junction junction = (Formula.Junction) formula;
            boolean isAnd = junction.kind == Formula.Junction.Kind.AND;
            for (Formula operand : junction.operands) {
                if (test(operand) != isAnd) {
                    return !isAnd;
                }
            }
            return isAnd;
        }
        if (formula instanceof Formula.Not) {
            return !test(((Formula.Not) formula).operand);
        }
        if (formula instanceof Formula.DefineRef) {
            String name = ((Formula.DefineRef) formula).name;
            SmvModule.Define define = module != null ? module.getDefine(name) : null;
            if (define == null) {
                throw new IllegalStateException("Undefined name: " + name);
            }
            return test(define.body);
        }
        if (formula instanceof Formula.Eventually) {
            throw new UnsupportedOperationException("Temporal operators cannot be evaluated on a single state");
        }
        throw new IllegalArgumentException("Unknown formula: " + formula.getClass().getName());
    }

    private boolean compare(Formula.Comparison cmp) {
        if (cmp.op == Formula.Comparison.Op.EQ) {
            return value(cmp.left).equals(value(cmp.right));
        }
        int left = intValue(cmp.left);
        int right = intValue(cmp.right);
        return switch (cmp.op) {
            case LT -> left < right;
            case GE -> left >= right;
            default -> throw new IllegalStateException("Unhandled operator " + cmp.op);
        };
    }

    private Object lookup(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalStateException("No value for " + name);
        }
        return value;
    }
}
