package dev.lukebemish.testbench.framework.listener;

import dev.lukebemish.testbench.framework.execution.ExecutionResult;
import dev.lukebemish.testbench.framework.model.TestNode;
import dev.lukebemish.testbench.framework.model.TestPlan;

/**
 * Receives the lifecycle events of an execution run. Every node, the root included, gets exactly one
 * {@link #executionStarted} followed by exactly one {@link #executionFinished}; a child's pair always falls between
 * its parent's.
 */
public interface ExecutionListener {
    default void planExecutionStarted(TestPlan plan) {}

    default void executionStarted(TestNode node) {}

    default void executionFinished(TestNode node, ExecutionResult result) {}

    default void planExecutionFinished(TestPlan plan) {}
}
