package net.littleredcomputer.sat;

import gnu.trove.list.array.TIntArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static java.util.stream.Collectors.toList;
import static net.littleredcomputer.sat.Literals.*;

/**
 * Conflict-driven clause learning. Propagation uses two watched literals per clause; each
 * conflict is analyzed back to its first unique implication point, the resulting clause is
 * learned, and the search jumps back to the second highest level of that clause, where the
 * clause is unit. Branching follows variable activity (bumped for every variable met during
 * conflict analysis) with saved phases, and the trail is periodically discarded according to
 * a {@link RestartPolicy}.
 */
public class CDCLSolver extends AbstractSATSolver {
    private static final Logger log = LogManager.getFormatterLogger(CDCLSolver.class);
    private RestartPolicy restartPolicy = RestartPolicy.luby(32);
    private double activityDecay = 0.95;
    private List<int[]> lastLearned = Collections.emptyList();

    public CDCLSolver(SATProblem problem) {
        super("CDCL", problem);
    }

    public CDCLSolver setRestartPolicy(RestartPolicy policy) {
        restartPolicy = policy;
        return this;
    }

    public CDCLSolver setActivityDecay(double decay) {
        if (decay <= 0.0 || decay > 1.0) throw new IllegalArgumentException("decay must lie in (0, 1]");
        activityDecay = decay;
        return this;
    }

    /**
     * @return the clauses learned during the most recent solve, in signed form and in the
     * order they were learned
     */
    public List<List<Integer>> learnedClauses() {
        return lastLearned.stream()
                .map(c -> Arrays.stream(c).map(Literals::decode).boxed().collect(toList()))
                .collect(toList());
    }

    @Override
    public Outcome solve(Budget budget) {
        start();
        Search s = new Search();
        lastLearned = s.learned;
        if (!s.attachProblemClauses()) return finish(Outcome.Status.UNSATISFIABLE);
        final Trail trail = s.trail;
        while (true) {
            ++stepCount;
            if (stepCount % logCheckSteps == 0) maybeReportProgress(trail);
            int conflict = s.propagate();
            if (conflict >= 0) {
                ++conflictCount;
                ++s.conflictsSinceRestart;
                if (trail.decisionLevel() == 0) return finish(Outcome.Status.UNSATISFIABLE);
                int[] learned = s.analyze(conflict);
                s.backjump(backjumpLevel(learned, trail));
                s.learn(learned);
                continue;
            }
            if (trail.isComplete()) return satisfiable(trail.model());
            if (exhausted(budget)) return finish(Outcome.Status.RESOURCE_EXHAUSTED);
            if (s.conflictsSinceRestart >= restartPolicy.conflictLimit((int) restartCount)) {
                s.restart();
                continue;
            }
            ++decisionCount;
            trail.decide(s.pickBranchLiteral());
        }
    }

    /**
     * @param learned a clause whose first literal is the only one at the current level, and whose
     *                second literal (if any) has the highest level among the rest
     * @return the level at which the learned clause becomes unit
     */
    static int backjumpLevel(int[] learned, Trail trail) {
        return learned.length < 2 ? 0 : trail.level(thevar(learned[1]));
    }

    /** The mutable state of one solve. */
    private final class Search {
        final List<int[]> clauses = new ArrayList<>();
        final List<int[]> learned = new ArrayList<>();
        final TIntArrayList[] watches;
        final Trail trail;
        final double[] activity;
        final boolean[] phase;  // last value each variable held
        final boolean[] seen;
        double bump = 1.0;
        int qhead = 0;  // trail literals below qhead have had their consequences propagated
        long conflictsSinceRestart = 0;

        Search() {
            final int n = problem.nVariables();
            trail = new Trail(n);
            watches = new TIntArrayList[2 * n + 2];
            for (int l = 0; l < watches.length; ++l) watches[l] = new TIntArrayList();
            activity = new double[n + 1];
            phase = new boolean[n + 1];
            seen = new boolean[n + 1];
        }

        /**
         * Install the problem's clauses, watching the first two literals of each long clause
         * and asserting each unit clause at level 0.
         * @return false if the clauses are refuted outright (an empty clause, or contradictory units)
         */
        boolean attachProblemClauses() {
            for (int[] c : problem.clauseArrays()) {
                if (c.length == 0) return false;
                int ci = clauses.size();
                clauses.add(c);
                if (c.length == 1) {
                    if (trail.isFalse(c[0])) return false;
                    if (!trail.isTrue(c[0])) trail.assign(c[0], ci);
                } else {
                    watches[c[0]].add(ci);
                    watches[c[1]].add(ci);
                }
                for (int l : c) activity[thevar(l)] += 1e-3;  // break initial ties toward frequent variables
            }
            return true;
        }

        /**
         * Propagate the consequences of every trail literal not yet processed.
         * @return the index of a clause all of whose literals are false, or -1 if there is none
         */
        @CheckReturnValue
        int propagate() {
            while (qhead < trail.size()) {
                final int falseLit = not(trail.get(qhead++));
                final TIntArrayList ws = watches[falseLit];
                final int n = ws.size();
                int i = 0, j = 0;
                WATCH:
                while (i < n) {
                    final int ci = ws.getQuick(i++);
                    final int[] c = clauses.get(ci);
                    // Keep the false watch in position 1.
                    if (c[0] == falseLit) {
                        c[0] = c[1];
                        c[1] = falseLit;
                    }
                    if (trail.isTrue(c[0])) {
                        ws.setQuick(j++, ci);
                        continue;
                    }
                    for (int k = 2; k < c.length; ++k) {
                        if (!trail.isFalse(c[k])) {
                            c[1] = c[k];
                            c[k] = falseLit;
                            watches[c[1]].add(ci);
                            continue WATCH;
                        }
                    }
                    ws.setQuick(j++, ci);
                    if (trail.isFalse(c[0])) {
                        while (i < n) ws.setQuick(j++, ws.getQuick(i++));
                        if (j < n) ws.remove(j, n - j);
                        return ci;
                    }
                    trail.assign(c[0], ci);
                    ++propagationCount;
                }
                if (j < n) ws.remove(j, n - j);
            }
            return -1;
        }

        /**
         * Resolve the conflicting clause with the antecedents of its current-level literals, most
         * recent first, until a single current-level literal (the first UIP) remains. Literals
         * fixed at level 0 are omitted, being consequences of the problem on their own.
         *
         * @return the learned clause, with the negated UIP first and a literal of the highest
         * remaining level second
         */
        int[] analyze(int conflict) {
            final int current = trail.decisionLevel();
            TIntArrayList out = new TIntArrayList();
            out.add(0);  // room for the asserting literal
            int pathCount = 0;
            int p = -1;
            int index = trail.size() - 1;
            int ci = conflict;
            do {
                for (int q : clauses.get(ci)) {
                    if (q == p) continue;
                    final int v = thevar(q);
                    if (seen[v] || trail.level(v) == 0) continue;
                    seen[v] = true;
                    bumpActivity(v);
                    if (trail.level(v) >= current) ++pathCount;
                    else out.add(q);
                }
                // Walk back to the most recent literal taking part in the resolution.
                while (!seen[thevar(trail.get(index))]) --index;
                p = trail.get(index--);
                ci = trail.reason(thevar(p));
                seen[thevar(p)] = false;
                --pathCount;
            } while (pathCount > 0);
            out.set(0, not(p));
            for (int k = 1; k < out.size(); ++k) seen[thevar(out.get(k))] = false;

            int[] c = out.toArray();
            int max = 1;
            for (int k = 2; k < c.length; ++k) {
                if (trail.level(thevar(c[k])) > trail.level(thevar(c[max]))) max = k;
            }
            if (c.length > 1) {
                int t = c[1];
                c[1] = c[max];
                c[max] = t;
            }
            bump /= activityDecay;
            if (bump > 1e100) rescaleActivity();
            return c;
        }

        void bumpActivity(int v) {
            activity[v] += bump;
        }

        void rescaleActivity() {
            for (int v = 1; v < activity.length; ++v) activity[v] *= 1e-100;
            bump *= 1e-100;
        }

        /** Undo every assignment above level d, remembering the values for phase saving. */
        void backjump(int d) {
            for (int i = trail.levelEnd(d); i < trail.size(); ++i) {
                int l = trail.get(i);
                phase[thevar(l)] = !negated(l);
            }
            trail.backtrackTo(d);
            qhead = trail.size();
        }

        /** Store a learned clause and assert its first literal, which is now unit. */
        void learn(int[] c) {
            final int ci = clauses.size();
            clauses.add(c);
            learned.add(c.clone());
            ++learnedCount;
            if (c.length > 1) {
                watches[c[0]].add(ci);
                watches[c[1]].add(ci);
            }
            trail.assign(c[0], ci);
            log.trace("%s: learned clause of size %d, asserting %s at level %d",
                    name(), c.length, Literals.toString(c[0]), trail.decisionLevel());
        }

        void restart() {
            ++restartCount;
            log.debug("%s: restart %d after %d conflicts", name(), restartCount, conflictsSinceRestart);
            conflictsSinceRestart = 0;
            backjump(0);
        }

        /** @return the saved phase of the free variable of highest activity (lowest index on ties) */
        int pickBranchLiteral() {
            int best = 0;
            for (int v = 1; v < activity.length; ++v) {
                if (trail.isAssigned(v)) continue;
                if (best == 0 || activity[v] > activity[best]) best = v;
            }
            if (best == 0) throw new IllegalStateException("no free variable to branch on");
            return phase[best] ? poslit(best) : neglit(best);
        }
    }
}
