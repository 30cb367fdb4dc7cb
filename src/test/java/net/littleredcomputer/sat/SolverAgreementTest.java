package net.littleredcomputer.sat;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class SolverAgreementTest extends SATTestBase {
    private static void check(SATProblem p) {
        final boolean expected = bruteForceSatisfiable(p);
        Outcome d = new DPLLSolver(p).solve();
        Outcome c = new CDCLSolver(p).solve();
        Outcome n = new CDCLSolver(p).setRestartPolicy(RestartPolicy.NEVER).solve();
        assertThat(p.toString(), d.isSatisfiable(), is(expected));
        assertThat(p.toString(), c.isSatisfiable(), is(expected));
        assertThat(p.toString(), n.isSatisfiable(), is(expected));
        // Models may differ between the solvers; each must satisfy the problem.
        d.model().ifPresent(m -> assertTrue(p.evaluate(m)));
        c.model().ifPresent(m -> assertTrue(p.evaluate(m)));
        n.model().ifPresent(m -> assertTrue(p.evaluate(m)));
    }

    @Test
    public void random3SATAroundThreshold() {
        // 12 variables; the satisfiable/unsatisfiable transition is near 4.27 clauses per variable.
        for (int m = 30; m <= 70; m += 5) {
            for (long seed = 0; seed < 10; ++seed) check(SATProblem.randomInstance(3, m, 12, seed));
        }
    }

    @Test
    public void random2SAT() {
        for (long seed = 0; seed < 30; ++seed) check(SATProblem.randomInstance(2, 14, 10, seed));
    }

    @Test
    public void randomMixedWidths() {
        for (long seed = 0; seed < 30; ++seed) {
            SATProblem p = SATProblem.randomInstance(4, 60, 10, seed);
            SATProblem q = SATProblem.randomInstance(1, 2, 10, seed);
            SATProblem r = new SATProblem(10);
            for (int i = 0; i < p.nClauses(); ++i) r.addClause(p.getClause(i));
            for (int i = 0; i < q.nClauses(); ++i) r.addClause(q.getClause(i));
            check(r);
        }
    }

    @Test
    public void cannedProblems() {
        check(ex6);
        check(ex7);
        check(hole3);
        check(SATProblem.waerden(3, 3, 8));
        check(SATProblem.waerden(3, 3, 9));
        check(SATProblem.pigeonhole(3, 3));
    }
}
