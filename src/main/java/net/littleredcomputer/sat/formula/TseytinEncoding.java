package net.littleredcomputer.sat.formula;

import com.google.common.collect.ImmutableMap;
import net.littleredcomputer.sat.SATProblem;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The clauses produced from a formula by {@link TseytinTransform}, together with what is
 * needed to read solutions back: variables 1 to {@link #originalVariables()} are the atoms of
 * the formula, and each later variable names one conjunction or disjunction of it.
 */
public final class TseytinEncoding {
    private final Formula formula;
    private final SATProblem problem;
    private final int[] auxNode;
    private final int rootLiteral;

    TseytinEncoding(Formula formula, SATProblem problem, int[] auxNode, int rootLiteral) {
        this.formula = formula;
        this.problem = problem;
        this.auxNode = auxNode;
        this.rootLiteral = rootLiteral;
    }

    public Formula formula() { return formula; }
    public SATProblem problem() { return problem; }
    public int originalVariables() { return formula.nVariables(); }
    public int auxiliaryVariables() { return auxNode.length; }

    /** @return the signed literal asserted by the final unit clause */
    public int rootLiteral() { return rootLiteral; }

    public boolean isAuxiliary(int variable) {
        checkArgument(variable >= 1 && variable <= problem.nVariables(), "no variable %s", variable);
        return variable > formula.nVariables();
    }

    /** @return the atom's name, or $v for auxiliary variable v */
    public String variableName(int variable) {
        return isAuxiliary(variable) ? "$" + variable : formula.variableName(variable);
    }

    /** @return the subformula an auxiliary variable stands for */
    public Optional<String> definition(int variable) {
        if (!isAuxiliary(variable)) return Optional.empty();
        return Optional.of(formula.toString(auxNode[variable - formula.nVariables() - 1]));
    }

    /**
     * @param model an assignment to every variable of the encoding, indexed by variable less one
     * @return the values of the formula's atoms, in variable order
     */
    public ImmutableMap<String, Boolean> project(boolean[] model) {
        checkArgument(model.length == problem.nVariables(), "model has %s values for %s variables", model.length, problem.nVariables());
        ImmutableMap.Builder<String, Boolean> b = ImmutableMap.builder();
        for (int v = 1; v <= formula.nVariables(); ++v) b.put(formula.variableName(v), model[v - 1]);
        return b.build();
    }

    /**
     * Extend an assignment to the atoms with the values the auxiliary variables take under it.
     * If the assignment satisfies the formula, the result satisfies the clauses.
     */
    public boolean[] extend(boolean[] atoms) {
        checkArgument(atoms.length == formula.nVariables(), "assignment has %s values for %s atoms", atoms.length, formula.nVariables());
        boolean[] nodeValues = formula.evaluateNodes(atoms);
        boolean[] full = new boolean[problem.nVariables()];
        System.arraycopy(atoms, 0, full, 0, atoms.length);
        for (int k = 0; k < auxNode.length; ++k) full[atoms.length + k] = nodeValues[auxNode[k]];
        return full;
    }

    @Override
    public String toString() {
        return String.format("%s: %d atoms, %d auxiliary variables, %d clauses",
                formula, originalVariables(), auxiliaryVariables(), problem.nClauses());
    }
}
