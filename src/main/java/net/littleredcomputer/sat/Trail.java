package net.littleredcomputer.sat;

import gnu.trove.list.array.TIntArrayList;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static net.littleredcomputer.sat.Literals.thevar;

/**
 * The chronological record of a partial assignment. Each assigned literal is stored with the
 * decision level at which it was set and the clause which forced it (its antecedent), or one
 * of the markers {@link #DECISION} and {@link #NO_REASON}. Level 0 holds the consequences of
 * the unit clauses; level d > 0 begins with the d-th decision literal.
 */
public final class Trail {
    /** Antecedent of a branching choice. */
    public static final int DECISION = -1;
    /** Antecedent of a literal fixed by a rule other than a clause (e.g., a pure literal). */
    public static final int NO_REASON = -2;

    private final int nVariables;
    private final int[] x;  // x[v] is -1 when v is free, else the value (0 or 1) of v
    private final int[] level;
    private final int[] reason;
    private final TIntArrayList R = new TIntArrayList();  // the trail proper: literals, in order of assignment
    private final TIntArrayList levelStart = new TIntArrayList();  // levelStart[d-1] is the index in R of the d-th decision

    public Trail(int nVariables) {
        this.nVariables = nVariables;
        x = new int[nVariables + 1];
        level = new int[nVariables + 1];
        reason = new int[nVariables + 1];
        Arrays.fill(x, -1);
    }

    public int nVariables() { return nVariables; }
    public int size() { return R.size(); }
    public int get(int i) { return R.get(i); }
    public int decisionLevel() { return levelStart.size(); }
    public boolean isComplete() { return R.size() == nVariables; }

    public boolean isAssigned(int variable) { return x[variable] >= 0; }
    public boolean isTrue(int literal) { return x[thevar(literal)] == 1 - (literal & 1); }
    public boolean isFalse(int literal) { return x[thevar(literal)] == (literal & 1); }

    public int level(int variable) { return level[variable]; }
    public int reason(int variable) { return reason[variable]; }

    /**
     * Make the given literal true at the current decision level.
     * @param literal an encoded literal whose variable is currently free
     * @param antecedent index of the clause forcing the literal, or DECISION or NO_REASON
     */
    public void assign(int literal, int antecedent) {
        final int v = thevar(literal);
        checkArgument(v >= 1 && v <= nVariables, "literal %s outside universe of %s variables", literal, nVariables);
        checkState(x[v] < 0, "variable %s is already assigned", v);
        x[v] = 1 - (literal & 1);
        level[v] = decisionLevel();
        reason[v] = antecedent;
        R.add(literal);
    }

    /** Open a new decision level whose first literal is the given one. */
    public void decide(int literal) {
        levelStart.add(R.size());
        assign(literal, DECISION);
    }

    /** @return the decision literal that opened level d (1 &lt;= d &lt;= decisionLevel()) */
    public int decisionLiteral(int d) {
        return R.get(levelStart.get(d - 1));
    }

    /** @return the index in the trail of the first literal above decision level d */
    public int levelEnd(int d) {
        return d >= decisionLevel() ? R.size() : levelStart.get(d);
    }

    /**
     * Unassign every literal above decision level d, restoring the state in which level d was
     * the current level. Has no effect if d is not below the current level.
     */
    public void backtrackTo(int d) {
        checkArgument(d >= 0, "negative decision level");
        if (d >= decisionLevel()) return;
        truncate(levelStart.get(d));
        levelStart.remove(d, levelStart.size() - d);
    }

    private void truncate(int length) {
        if (length >= R.size()) return;
        for (int i = R.size() - 1; i >= length; --i) x[thevar(R.getQuick(i))] = -1;
        R.remove(length, R.size() - length);
    }

    /** @return the current assignment, indexed by variable number less one; free variables read as false */
    public boolean[] model() {
        boolean[] bs = new boolean[nVariables];
        for (int v = 1; v <= nVariables; ++v) bs[v - 1] = x[v] == 1;
        return bs;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int d = 0;
        for (int i = 0; i < R.size(); ++i) {
            if (d < decisionLevel() && levelStart.get(d) == i) {
                sb.append(" |");
                ++d;
            }
            sb.append(' ').append(Literals.toString(R.get(i)));
        }
        return sb.toString().trim();
    }
}
