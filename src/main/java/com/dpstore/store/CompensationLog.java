package com.dpstore.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Undo steps for a multi-step write that the backend cannot make atomic.
 * Each completed write registers how to undo it; on failure the steps run in
 * reverse order. Undo is best effort: a failing step is logged and the rest still run.
 */
public class CompensationLog {

    private static final Logger logger = LoggerFactory.getLogger(CompensationLog.class);

    /**
     * A single undo action.
     */
    @FunctionalInterface
    public interface Undo {
        void run() throws IOException;
    }

    private final String operation;
    private final Deque<Step> steps = new ArrayDeque<>();

    public CompensationLog(String operation) {
        this.operation = operation;
    }

    /**
     * Register the undo action for a write that just succeeded.
     */
    public void record(String description, Undo undo) {
        steps.push(new Step(description, undo));
    }

    /**
     * Run all registered undo actions, newest first, and forget them.
     *
     * @return number of undo actions that failed
     */
    public int compensate() {
        int failures = 0;
        while (!steps.isEmpty()) {
            Step step = steps.pop();
            try {
                step.undo.run();
                logger.debug("Compensated {}: {}", operation, step.description);
            } catch (IOException | RuntimeException e) {
                failures++;
                logger.warn("Compensation of {} failed at '{}', residue left in backend: {}",
                        operation, step.description, e.getMessage());
            }
        }
        return failures;
    }

    /**
     * Forget all undo actions after the whole operation succeeded.
     */
    public void commit() {
        steps.clear();
    }

    public int size() {
        return steps.size();
    }

    private static final class Step {
        final String description;
        final Undo undo;

        Step(String description, Undo undo) {
            this.description = description;
            this.undo = undo;
        }
    }
}
