package sokoban.smv;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders terms, formulas and whole modules in nuXmv's SMV syntax.
 *
 * Parenthesization follows SMV precedence: arithmetic binds tighter than
 * comparison, comparison tighter than {@code &} and {@code |}. Every nested
 * junction is parenthesized; a junction used directly as a case guard or a
 * DEFINE body is printed without its outer parentheses.
 */
public final class SmvPrinter {

    private static final String INDENT = "    ";

    private SmvPrinter() {}

    public static String print(Term term) {
        if (term instanceof Term.IntLiteral) {
            return Integer.toString(((Term.IntLiteral) term).value);
        }
        if (term instanceof Term.Identifier) {
            return ((Term.Identifier) term).name;
        }
        if (term instanceof Term.Symbol) {
            return ((Term.Symbol) term).name;
        }
        if (term instanceof Term.ArrayElement) {
            return ((Term.ArrayElement) term).key();
        }
        if (term instanceof Term.Offset) {
            Term.Offset offset = (Term.Offset) term;
            String sign = offset.delta < 0 ? " - " : " + ";
            return print(offset.base) + sign + Math.abs(offset.delta);
        }
        throw new IllegalArgumentException("Unknown term: " + term.getClass().getName());
    }

    public static String print(Formula formula) {
        if (formula instanceof Formula.BoolLiteral) {
            return ((Formula.BoolLiteral) formula).value ? "TRUE" : "FALSE";
        }
        if (formula instanceof Formula.Comparison) {
            Formula.Comparison cmp = (Formula.Comparison) formula;
            return print(cmp.left) + " " + cmp.op.token + " " + print(cmp.right);
        }
        if (formula instanceof Formula.Junction) {
            return "(" + printOperands((Formula.Junction) formula) + ")";
        }
        if (formula instanceof Formula.Not) {
            Formula operand = ((Formula.Not) formula).operand;
            return "!" + (isAtomic(operand) ? print(operand) : "(" + print(operand) + ")");
        }
        if (formula instanceof Formula.DefineRef) {
            return ((Formula.DefineRef) formula).name;
        }
        if (formula instanceof Formula.Eventually) {
            Formula operand = ((Formula.Eventually) formula).operand;
            return "F " + (isAtomic(operand) ? print(operand) : "(" + print(operand) + ")");
        }
        throw new IllegalArgumentException("Unknown formula: " + formula.getClass().getName());
    }

    /**
     * Prints a formula that stands alone (case guard, DEFINE body), dropping
     * the parentheses around a top-level junction.
     */
    public static String printTopLevel(Formula formula) {
        if (formula instanceof Formula.Junction) {
            return printOperands((Formula.Junction) formula);
        }
        return print(formula);
    }

    public static String print(SmvModule.VarType type) {
        if (type instanceof SmvModule.Range) {
            SmvModule.Range range = (SmvModule.Range) type;
            return print(range.low) + ".." + print(range.high);
        }
        if (type instanceof SmvModule.ArrayOf) {
            SmvModule.ArrayOf array = (SmvModule.ArrayOf) type;
            return "array " + array.low + ".." + print(array.high) + " of " + print(array.element);
        }
        if (type instanceof SmvModule.Enumeration) {
            return "{" + String.join(", ", ((SmvModule.Enumeration) type).symbols) + "}";
        }
        throw new IllegalArgumentException("Unknown type: " + type.getClass().getName());
    }

    /**
     * Renders a complete module. Sections that are empty are left out.
     *
     * @param module the module
     * @return the model text, newline-terminated
     */
    public static String print(SmvModule module) {
        List<String> lines = new ArrayList<>();

        if (module.getHeaderComment() != null) {
            lines.add("-- " + module.getHeaderComment());
        }
        lines.add("MODULE " + module.getName());

        if (!module.getConstants().isEmpty()) {
            lines.add("CONSTANTS");
            for (Map.Entry<String, Integer> constant : module.getConstants().entrySet()) {
                lines.add(INDENT + constant.getKey() + " := " + constant.getValue() + ";");
            }
            lines.add("");
        }

        if (!module.getVariables().isEmpty()) {
            lines.add("VAR");
            for (SmvModule.VarDecl decl : module.getVariables()) {
                lines.add(INDENT + decl.name + " : " + print(decl.type) + ";");
            }
            lines.add("");
        }

        if (!module.getInits().isEmpty() || !module.getNexts().isEmpty()) {
            lines.add("ASSIGN");
            for (SmvModule.Assignment init : module.getInits()) {
                lines.add(INDENT + "init(" + print(init.target) + ") := " + print(init.value) + ";");
            }
            lines.add("");
            for (SmvModule.CaseAssignment next : module.getNexts()) {
                lines.add(INDENT + "next(" + print(next.target) + ") := case");
                for (SmvModule.Branch branch : next.branches) {
                    lines.add(INDENT + INDENT + printTopLevel(branch.guard) + " : " + print(branch.value) + ";");
                }
                lines.add(INDENT + INDENT + "TRUE : " + print(next.fallback) + ";");
                lines.add(INDENT + "esac;");
                lines.add("");
            }
        }

        if (!module.getDefines().isEmpty()) {
            lines.add("DEFINE");
            for (SmvModule.Define define : module.getDefines()) {
                lines.add(INDENT + define.name + " := " + printTopLevel(define.body) + ";");
            }
            lines.add("");
        }

        for (Formula spec : module.getLtlSpecs()) {
            lines.add("LTLSPEC");
            lines.add(INDENT + print(spec));
            lines.add("");
        }

        return String.join("\n", lines);
    }

    private static String printOperands(Formula.Junction junction) {
        StringJoiner joiner = new StringJoiner(" " + junction.kind.token + " ");
        for (Formula operand : junction.operands) {
            joiner.add(print(operand));
        }
        return joiner.toString();
    }

    private static boolean isAtomic(Formula formula) {
        return formula instanceof Formula.BoolLiteral
                || formula instanceof Formula.DefineRef
                || formula instanceof Formula.Junction;
    }
}
