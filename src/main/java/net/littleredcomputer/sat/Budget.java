package net.littleredcomputer.sat;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Optional;

/**
 * Limits on the work a solver may do before giving up with
 * {@link Outcome.Status#RESOURCE_EXHAUSTED}. Solvers consult the budget at every decision.
 */
public final class Budget {
    public static final Budget UNLIMITED = new Budget(Long.MAX_VALUE, null);

    private final long maxConflicts;
    @Nullable private final Duration maxTime;

    private Budget(long maxConflicts, @Nullable Duration maxTime) {
        if (maxConflicts < 0) throw new IllegalArgumentException("conflict limit must not be negative");
        if (maxTime != null && maxTime.isNegative()) throw new IllegalArgumentException("time limit must not be negative");
        this.maxConflicts = maxConflicts;
        this.maxTime = maxTime;
    }

    /**
     * @param maxConflicts the search gives up at the first decision after its conflict count
     *                     exceeds this, so {@code conflicts(0)} still lets one conflict happen
     */
    public static Budget conflicts(long maxConflicts) { return new Budget(maxConflicts, null); }
    /** The search gives up at the first decision after more than maxTime has elapsed. */
    public static Budget time(Duration maxTime) { return new Budget(Long.MAX_VALUE, maxTime); }

    public Budget withConflicts(long conflicts) { return new Budget(conflicts, maxTime); }
    public Budget withTime(Duration time) { return new Budget(maxConflicts, time); }

    public long maxConflicts() { return maxConflicts; }
    public Optional<Duration> maxTime() { return Optional.ofNullable(maxTime); }

    boolean exhausted(long conflicts, Duration elapsed) {
        return conflicts > maxConflicts || (maxTime != null && elapsed.compareTo(maxTime) > 0);
    }

    @Override
    public String toString() {
        if (this == UNLIMITED) return "unlimited";
        return (maxConflicts == Long.MAX_VALUE ? "" : maxConflicts + " conflicts ")
                + (maxTime == null ? "" : maxTime.toString());
    }
}
