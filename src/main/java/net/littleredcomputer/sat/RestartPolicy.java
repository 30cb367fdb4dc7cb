package net.littleredcomputer.sat;

/**
 * Decides how many conflicts the CDCL search may suffer before it abandons its trail and
 * starts again from decision level 0. A restart keeps every learned clause, so no schedule
 * can change whether a problem is found satisfiable, only how quickly.
 */
@FunctionalInterface
public interface RestartPolicy {
    /**
     * @param restarts number of restarts performed so far in this solve
     * @return conflicts to allow after that many restarts before restarting again
     */
    long conflictLimit(int restarts);

    RestartPolicy NEVER = r -> Long.MAX_VALUE;

    /** The Luby sequence 1, 1, 2, 1, 1, 2, 4, 1, ... scaled by unit. */
    static RestartPolicy luby(int unit) {
        if (unit < 1) throw new IllegalArgumentException("unit must be positive");
        return r -> unit * lubyTerm(r);
    }

    /** Intervals first, first*factor, first*factor^2, ... */
    static RestartPolicy geometric(int first, double factor) {
        if (first < 1) throw new IllegalArgumentException("first interval must be positive");
        if (factor <= 1.0) throw new IllegalArgumentException("factor must exceed 1");
        return r -> (long) Math.min(first * Math.pow(factor, r), (double) Long.MAX_VALUE);
    }

    /** @return the i-th (zero-based) element of the Luby sequence */
    static long lubyTerm(int i) {
        // Find the finite subsequence containing index i, and its size.
        long size = 1;  // subsequence sizes 2^k - 1 outgrow an int for indices near 2^30
        int seq = 0;
        while (size < (long) i + 1) {
            ++seq;
            size = 2 * size + 1;
        }
        while (size - 1 != i) {
            size = (size - 1) >> 1;
            --seq;
            i = (int) (i % size);
        }
        return 1L << seq;
    }
}
