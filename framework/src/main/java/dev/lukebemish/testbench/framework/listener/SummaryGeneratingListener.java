package dev.lukebemish.testbench.framework.listener;

import dev.lukebemish.testbench.framework.execution.ExecutionResult;
import dev.lukebemish.testbench.framework.execution.FailureKind;
import dev.lukebemish.testbench.framework.model.TestNode;
import dev.lukebemish.testbench.framework.model.TestPlan;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Accumulates an {@link ExecutionSummary}. The plan root stands for the engine and is not counted. A container that
 * only failed because of its descendants counts as successful; its descendants carry the failures.
 */
public class SummaryGeneratingListener implements ExecutionListener {
    private ExecutionSummary summary = new ExecutionSummary();

    public ExecutionSummary getSummary() {
        return summary;
    }

    @Override
    public void planExecutionStarted(TestPlan plan) {
        summary = new ExecutionSummary();
        summary.timeStarted = System.currentTimeMillis();
        summary.containersFound.addAndGet(plan.countContainers());
        summary.testsFound.addAndGet(plan.countTests());
    }

    @Override
    public void executionStarted(TestNode node) {
        if (node.isRoot()) {
            return;
        }
        (node.isContainer() ? summary.containersStarted : summary.testsStarted).incrementAndGet();
    }

    @Override
    public void executionFinished(TestNode node, ExecutionResult result) {
        if (node.isRoot()) {
            return;
        }
        boolean container = node.isContainer();
        switch (result.getStatus()) {
            case SUCCESSFUL -> counter(container, summary.containersSucceeded, summary.testsSucceeded).incrementAndGet();
            case SKIPPED -> counter(container, summary.containersSkipped, summary.testsSkipped).incrementAndGet();
            case ABORTED -> counter(container, summary.containersAborted, summary.testsAborted).incrementAndGet();
            case FAILED -> {
                var cause = result.getFailureCause().orElseThrow();
                if (container && cause.kind() == FailureKind.DESCENDANT) {
                    summary.containersSucceeded.incrementAndGet();
                } else {
                    counter(container, summary.containersFailed, summary.testsFailed).incrementAndGet();
                    summary.addFailure(new ExecutionSummary.Failure(node.id(), node.displayName(), cause));
                }
            }
        }
    }

    @Override
    public void planExecutionFinished(TestPlan plan) {
        summary.timeFinished = System.currentTimeMillis();
    }

    private static AtomicLong counter(boolean container, AtomicLong containers, AtomicLong tests) {
        return container ? containers : tests;
    }
}
