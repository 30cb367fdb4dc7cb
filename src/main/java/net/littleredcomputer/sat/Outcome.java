package net.littleredcomputer.sat;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Optional;

/**
 * The result of one solve call: a satisfying assignment, a refutation, or the admission that
 * the budget ran out first. Carries the counters accumulated during the search.
 */
public final class Outcome {
    public enum Status {
        SATISFIABLE,
        UNSATISFIABLE,
        RESOURCE_EXHAUSTED
    }

    private final Status status;
    @Nullable private final boolean[] model;
    private final String solver;
    private final long decisions;
    private final long conflicts;
    private final long propagations;
    private final long learnedClauses;
    private final long restarts;
    private final Duration elapsed;

    private Outcome(Status status, @Nullable boolean[] model, AbstractSATSolver s, Duration elapsed) {
        this.status = status;
        this.model = model;
        this.solver = s.name();
        this.decisions = s.decisionCount;
        this.conflicts = s.conflictCount;
        this.propagations = s.propagationCount;
        this.learnedClauses = s.learnedCount;
        this.restarts = s.restartCount;
        this.elapsed = elapsed;
    }

    static Outcome satisfiable(boolean[] model, AbstractSATSolver s, Duration elapsed) {
        return new Outcome(Status.SATISFIABLE, model.clone(), s, elapsed);
    }

    static Outcome of(Status status, AbstractSATSolver s, Duration elapsed) {
        if (status == Status.SATISFIABLE) throw new IllegalArgumentException("a satisfiable outcome needs a model");
        return new Outcome(status, null, s, elapsed);
    }

    public Status status() { return status; }
    public boolean isSatisfiable() { return status == Status.SATISFIABLE; }
    public boolean isUnsatisfiable() { return status == Status.UNSATISFIABLE; }

    /** @return the satisfying assignment (indexed by variable number less one), when there is one */
    public Optional<boolean[]> model() {
        return model == null ? Optional.empty() : Optional.of(model.clone());
    }

    public String solver() { return solver; }
    public long decisions() { return decisions; }
    public long conflicts() { return conflicts; }
    public long propagations() { return propagations; }
    public long learnedClauses() { return learnedClauses; }
    public long restarts() { return restarts; }
    public Duration elapsed() { return elapsed; }

    @Override
    public String toString() {
        return String.format("%s %s: %d decisions, %d conflicts, %d propagations, %d learned, %d restarts, %s",
                solver, status, decisions, conflicts, propagations, learnedClauses, restarts, elapsed);
    }
}
