package sokoban.smv;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An SMV module as a value: constants, variable declarations, initial and
 * next-state assignments, DEFINEs and LTL specifications. Every section
 * keeps insertion order, so printing the same module always gives the
 * same text.
 *
 * Modules are immutable once constructed; {@link SmvPrinter} turns them
 * into text and {@link sokoban.simulation.ModelSimulator} executes them.
 */
public final class SmvModule {

    private final String name;
    private final String headerComment;
    private final Map<String, Integer> constants;
    private final List<VarDecl> variables;
    private final List<Assignment> inits;
    private final List<CaseAssignment> nexts;
    private final List<Define> defines;
    private final List<Formula> ltlSpecs;

    public SmvModule(String name, String headerComment, Map<String, Integer> constants,
                     List<VarDecl> variables, List<Assignment> inits, List<CaseAssignment> nexts,
                     List<Define> defines, List<Formula> ltlSpecs) {
        this.name = Objects.requireNonNull(name);
        this.headerComment = headerComment;
        this.constants = Collections.unmodifiableMap(new LinkedHashMap<>(constants));
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.inits = Collections.unmodifiableList(new ArrayList<>(inits));
        this.nexts = Collections.unmodifiableList(new ArrayList<>(nexts));
        this.defines = Collections.unmodifiableList(new ArrayList<>(defines));
        this.ltlSpecs = Collections.unmodifiableList(new ArrayList<>(ltlSpecs));
    }

    public String getName() { return name; }

    /** @return single-line comment printed above the module, or null */
    public String getHeaderComment() { return headerComment; }

    public Map<String, Integer> getConstants() { return constants; }
    public List<VarDecl> getVariables() { return variables; }
    public List<Assignment> getInits() { return inits; }
    public List<CaseAssignment> getNexts() { return nexts; }
    public List<Define> getDefines() { return defines; }
    public List<Formula> getLtlSpecs() { return ltlSpecs; }

    /**
     * Looks up a DEFINE by name.
     *
     * @return the define, or null if the module has none of that name
     */
    public Define getDefine(String defineName) {
        for (Define define : defines) {
            if (define.name.equals(defineName)) {
                return define;
            }
        }
        return null;
    }

    // ========== Sections ==========

    /** Type of a declared variable */
    public abstract static class VarType {
        VarType() {}
    }

    /** low..high */
    public static final class Range extends VarType {
        public final Term low;
        public final Term high;

        public Range(Term low, Term high) {
            this.low = Objects.requireNonNull(low);
            this.high = Objects.requireNonNull(high);
        }
    }

    /** array low..high of element */
    public static final class ArrayOf extends VarType {
        public final int low;
        public final Term high;
        public final Range element;

        public ArrayOf(int low, Term high, Range element) {
            this.low = low;
            this.high = Objects.requireNonNull(high);
            this.element = Objects.requireNonNull(element);
        }
    }

    /** {a, b, c} */
    public static final class Enumeration extends VarType {
        public final List<String> symbols;

        public Enumeration(List<String> symbols) {
            if (symbols.isEmpty()) {
                throw new IllegalArgumentException("Enumeration needs at least one symbol");
            }
            this.symbols = Collections.unmodifiableList(new ArrayList<>(symbols));
        }
    }

    /** name : type; */
    public static final class VarDecl {
        public final String name;
        public final VarType type;

        public VarDecl(String name, VarType type) {
            this.name = Objects.requireNonNull(name);
            this.type = Objects.requireNonNull(type);
        }
    }

    /** init(target) := value; */
    public static final class Assignment {
        public final Term target;
        public final Term value;

        public Assignment(Term target, Term value) {
            this.target = Objects.requireNonNull(target);
            this.value = Objects.requireNonNull(value);
        }
    }

    /** guard : value; */
    public static final class Branch {
        public final Formula guard;
        public final Term value;

        public Branch(Formula guard, Term value) {
            this.guard = Objects.requireNonNull(guard);
            this.value = Objects.requireNonNull(value);
        }
    }

    /**
     * next(target) := case branches... TRUE : fallback; esac;
     * The first branch whose guard holds wins.
     */
    public static final class CaseAssignment {
        public final Term target;
        public final List<Branch> branches;
        public final Term fallback;

        public CaseAssignment(Term target, List<Branch> branches, Term fallback) {
            this.target = Objects.requireNonNull(target);
            this.branches = Collections.unmodifiableList(new ArrayList<>(branches));
            this.fallback = Objects.requireNonNull(fallback);
        }
    }

    /** name := body; */
    public static final class Define {
        public final String name;
        public final Formula body;

        public Define(String name, Formula body) {
            this.name = Objects.requireNonNull(name);
            this.body = Objects.requireNonNull(body);
        }
    }
}
