package net.littleredcomputer.sat.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/** Random formulas over a handful of atoms, using every connective. */
final class RandomFormulas {
    private RandomFormulas() {}

    static Formula random(Random r, int atoms, int steps) {
        Formula.Builder b = new Formula.Builder();
        List<Integer> pool = new ArrayList<>();
        for (int i = 0; i < atoms; ++i) pool.add(b.atom("x" + i));
        int last = pool.get(r.nextInt(pool.size()));
        for (int s = 0; s < steps; ++s) {
            int a = pool.get(r.nextInt(pool.size()));
            int c = pool.get(r.nextInt(pool.size()));
            switch (r.nextInt(6)) {
                case 0: last = b.not(a); break;
                case 1: last = b.and(a, c); break;
                case 2: last = b.or(a, c); break;
                case 3: last = b.implies(a, c); break;
                case 4: last = b.iff(a, c); break;
                default: last = b.and(a, c, pool.get(r.nextInt(pool.size())));
            }
            pool.add(last);
        }
        return b.build(last);
    }

    static boolean bruteForceSatisfiable(Formula f) {
        final int n = f.nVariables();
        boolean[] x = new boolean[n];
        for (int bits = 0; bits < 1 << n; ++bits) {
            for (int v = 0; v < n; ++v) x[v] = (bits >> v & 1) != 0;
            if (f.evaluate(x)) return true;
        }
        return false;
    }

    static boolean equivalent(Formula f, Formula g) {
        final int n = f.nVariables();
        if (g.nVariables() != n) return false;
        boolean[] x = new boolean[n];
        for (int bits = 0; bits < 1 << n; ++bits) {
            for (int v = 0; v < n; ++v) x[v] = (bits >> v & 1) != 0;
            if (f.evaluate(x) != g.evaluate(x)) return false;
        }
        return true;
    }
}
