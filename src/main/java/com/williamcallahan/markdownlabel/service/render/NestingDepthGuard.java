package com.williamcallahan.markdownlabel.service.render;

/**
 * Depth counter around structurally recursive block constructs.
 *
 * <p>Callers {@link #enter()} before descending into a list or block quote and
 * {@link #exit()} in a {@code finally} block afterwards. Once {@link #isExceeded()} reports
 * true, the caller renders a placeholder instead of the subtree.</p>
 */
public final class NestingDepthGuard {

    public static final int MAX_NESTING_DEPTH = 10;
    public static final String TRUNCATION_TEXT = "[...content truncated due to deep nesting...]";

    private final int maxDepth;
    private int depth;

    public NestingDepthGuard() {
        this(MAX_NESTING_DEPTH);
    }

    NestingDepthGuard(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Maximum nesting depth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Records one more level of nesting.
     * @return depth after entering
     */
    public int enter() {
        return ++depth;
    }

    /**
     * Leaves the current level.
     * @throws IllegalStateException when called more often than {@link #enter()}
     */
    public void exit() {
        if (depth == 0) {
            throw new IllegalStateException("exit() without matching enter()");
        }
        depth--;
    }

    public boolean isExceeded() {
        return depth > maxDepth;
    }

    public int depth() {
        return depth;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
