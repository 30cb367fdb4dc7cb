package net.littleredcomputer.sat;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Common machinery of the solvers: the problem, progress reporting, resource accounting and
 * outcome construction. Each call to {@link #solve(Budget)} builds its own search state, so a
 * solver may be asked to solve its problem repeatedly, but not from two threads at once.
 */
public abstract class AbstractSATSolver {
    private static final Logger log = LogManager.getFormatterLogger(AbstractSATSolver.class);
    final int logCheckSteps = 10000;
    final SATProblem problem;
    long stepCount;
    long decisionCount;
    long conflictCount;
    long propagationCount;
    long learnedCount;
    long restartCount;
    private long lastStepCount;
    private final String name;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private Stopwatch stopwatch = Stopwatch.createUnstarted();

    public void setLogInterval(Duration interval) { logInterval = interval; }

    AbstractSATSolver(String name, SATProblem problem) {
        this.name = name;
        this.problem = problem;
    }

    public String name() { return name; }

    public SATProblem problem() { return problem; }

    void start() {
        stepCount = decisionCount = conflictCount = propagationCount = learnedCount = restartCount = 0;
        stopwatch = Stopwatch.createStarted();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
        log.debug("%s: starting on %d variables, %d clauses", name, problem.nVariables(), problem.nClauses());
    }

    void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();

        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%s %d steps %s %.0f/sec %d conflicts %s", name, stepCount, stopwatch, perSec, conflictCount, s.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }

    void maybeReportProgress(Trail trail) {
        maybeReportProgress(() -> "level " + trail.decisionLevel() + " assigned " + trail.size());
    }

    boolean exhausted(Budget budget) {
        return budget.exhausted(conflictCount, stopwatch.elapsed());
    }

    Outcome satisfiable(boolean[] model) {
        stopwatch.stop();
        if (!problem.evaluate(model)) throw new IllegalStateException(name + " produced a model which falsifies the problem");
        Outcome o = Outcome.satisfiable(model, this, stopwatch.elapsed());
        log.debug("%s", o);
        return o;
    }

    Outcome finish(Outcome.Status status) {
        stopwatch.stop();
        Outcome o = Outcome.of(status, this, stopwatch.elapsed());
        log.debug("%s", o);
        return o;
    }

    /**
     * Search for a satisfying assignment of the problem within the given budget.
     */
    public abstract Outcome solve(Budget budget);

    public Outcome solve() {
        return solve(Budget.UNLIMITED);
    }
}
