package org.rescuenet.routing.vrp;

import java.time.Duration;

/**
 * Wall-clock deadline, iteration cap and interruption check of one solve.
 */
final class SolveBudget {
    /** {@link Long#MIN_VALUE} for no deadline. */
    private final long deadlineNanos;
    private final int maxIterations;
    private int iterations;

    private SolveBudget(long deadlineNanos, int maxIterations) {
        this.deadlineNanos = deadlineNanos;
        this.maxIterations = maxIterations;
    }

    static SolveBudget start(Duration timeLimit, int maxIterations) {
        long now = System.nanoTime();
        long limit;
        try {
            limit = timeLimit.toNanos();
        } catch (ArithmeticException ex) {
            limit = Long.MAX_VALUE;
        }
        long deadline = limit > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + limit;
        return new SolveBudget(deadline, maxIterations);
    }

    /**
     * Budget without a deadline, bounded only by the iteration cap and interruption.
     */
    static SolveBudget iterations(int maxIterations) {
        return new SolveBudget(Long.MIN_VALUE, maxIterations);
    }

    boolean exhausted() {
        return iterations >= maxIterations || deadlinePassed();
    }

    /**
     * Deadline or interruption only, ignoring the iteration cap.
     */
    boolean deadlinePassed() {
        return Thread.currentThread().isInterrupted()
                || deadlineNanos != Long.MIN_VALUE && System.nanoTime() - deadlineNanos >= 0;
    }

    void tick() {
        iterations++;
    }

    int iterations() {
        return iterations;
    }

}
