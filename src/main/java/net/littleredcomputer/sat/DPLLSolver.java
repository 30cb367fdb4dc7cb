package net.littleredcomputer.sat;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;
import java.util.Arrays;
import java.util.BitSet;

import static net.littleredcomputer.sat.Literals.*;

/**
 * The Davis-Putnam-Logemann-Loveland procedure: unit propagation to a fixpoint, pure literal
 * elimination, branching on the lowest-numbered open variable and chronological backtracking.
 * The search is a loop over explicit states rather than a recursion, so its depth is limited
 * only by the number of variables.
 */
public class DPLLSolver extends AbstractSATSolver {
    private static final Logger log = LogManager.getFormatterLogger(DPLLSolver.class);
    private boolean pureLiteralElimination = true;

    private enum State {
        PROPAGATE,
        DECIDE,
        BACKTRACK
    }

    public DPLLSolver(SATProblem problem) {
        super("DPLL", problem);
    }

    public DPLLSolver setPureLiteralElimination(boolean enabled) {
        pureLiteralElimination = enabled;
        return this;
    }

    @Override
    public Outcome solve(Budget budget) {
        start();
        final int[][] clauses = problem.clauseArrays();
        final Trail trail = new Trail(problem.nVariables());
        final BitSet flipped = new BitSet();  // levels whose decision literal has already been complemented
        final int[] occurrences = new int[2 * problem.nVariables() + 2];
        for (int[] c : clauses) if (c.length == 0) return finish(Outcome.Status.UNSATISFIABLE);

        State state = State.PROPAGATE;
        while (true) {
            ++stepCount;
            if (stepCount % logCheckSteps == 0) maybeReportProgress(trail);
            switch (state) {
                case PROPAGATE:
                    if (!propagate(clauses, trail)) {
                        ++conflictCount;
                        state = State.BACKTRACK;
                        continue;
                    }
                    if (countOpenOccurrences(clauses, trail, occurrences) == 0) return satisfiable(trail.model());
                    if (pureLiteralElimination) eliminatePureLiterals(trail, occurrences);
                    state = State.DECIDE;
                    continue;
                case DECIDE: {
                    if (countOpenOccurrences(clauses, trail, occurrences) == 0) return satisfiable(trail.model());
                    if (exhausted(budget)) return finish(Outcome.Status.RESOURCE_EXHAUSTED);
                    int l = chooseLiteral(trail, occurrences);
                    ++decisionCount;
                    trail.decide(l);
                    flipped.clear(trail.decisionLevel());
                    log.trace("%s: decide %s at level %d", name(), Literals.toString(l), trail.decisionLevel());
                    state = State.PROPAGATE;
                    continue;
                }
                case BACKTRACK: {
                    // Abandon every level whose both branches have been explored.
                    while (trail.decisionLevel() > 0 && flipped.get(trail.decisionLevel())) {
                        trail.backtrackTo(trail.decisionLevel() - 1);
                    }
                    final int d = trail.decisionLevel();
                    if (d == 0) return finish(Outcome.Status.UNSATISFIABLE);
                    int l = trail.decisionLiteral(d);
                    trail.backtrackTo(d - 1);
                    trail.decide(not(l));
                    flipped.set(d);
                    state = State.PROPAGATE;
                }
            }
        }
    }

    /**
     * Repeatedly assign the sole open literal of any clause whose other literals are all false,
     * until no such clause remains.
     * @return false if some clause has every literal false
     */
    @CheckReturnValue
    boolean propagate(int[][] clauses, Trail trail) {
        boolean changed = true;
        while (changed) {
            changed = false;
            CLAUSE:
            for (int c = 0; c < clauses.length; ++c) {
                int open = 0;
                int last = 0;
                for (int l : clauses[c]) {
                    if (trail.isTrue(l)) continue CLAUSE;
                    if (!trail.isFalse(l)) {
                        ++open;
                        last = l;
                    }
                }
                if (open == 0) return false;
                if (open == 1) {
                    trail.assign(last, c);
                    ++propagationCount;
                    changed = true;
                }
            }
        }
        return true;
    }

    /**
     * Tally, for each open literal, the number of unsatisfied clauses containing it.
     * @return the number of unsatisfied clauses
     */
    private static int countOpenOccurrences(int[][] clauses, Trail trail, int[] occurrences) {
        Arrays.fill(occurrences, 0);
        int unsatisfied = 0;
        CLAUSE:
        for (int[] c : clauses) {
            for (int l : c) if (trail.isTrue(l)) continue CLAUSE;
            ++unsatisfied;
            for (int l : c) if (!trail.isFalse(l)) ++occurrences[l];
        }
        return unsatisfied;
    }

    /**
     * A variable occurring in the unsatisfied clauses with only one sign can be given that sign
     * without loss. Doing so satisfies clauses and falsifies none, so it cannot produce a
     * conflict or a new unit clause.
     */
    private void eliminatePureLiterals(Trail trail, int[] occurrences) {
        for (int v = 1; v <= trail.nVariables(); ++v) {
            if (trail.isAssigned(v)) continue;
            int pos = occurrences[poslit(v)];
            int neg = occurrences[neglit(v)];
            if (pos > 0 && neg == 0) trail.assign(poslit(v), Trail.NO_REASON);
            else if (neg > 0 && pos == 0) trail.assign(neglit(v), Trail.NO_REASON);
        }
    }

    /**
     * Choose the lowest-numbered free variable that appears in an unsatisfied clause, with the
     * sign that appears there more often (preferring the positive sign on a tie).
     */
    private static int chooseLiteral(Trail trail, int[] occurrences) {
        for (int v = 1; v <= trail.nVariables(); ++v) {
            if (trail.isAssigned(v)) continue;
            int pos = occurrences[poslit(v)];
            int neg = occurrences[neglit(v)];
            if (pos + neg == 0) continue;
            return pos >= neg ? poslit(v) : neglit(v);
        }
        throw new IllegalStateException("no open variable in an unsatisfied clause");
    }
}
