package dev.lukebemish.testbench.framework.execution;

import dev.lukebemish.testbench.framework.listener.CompositeExecutionListener;
import dev.lukebemish.testbench.framework.listener.ExecutionListener;
import dev.lukebemish.testbench.framework.listener.ExecutionSummary;
import dev.lukebemish.testbench.framework.listener.SummaryGeneratingListener;
import dev.lukebemish.testbench.framework.model.TestAction;
import dev.lukebemish.testbench.framework.model.TestNode;
import dev.lukebemish.testbench.framework.model.TestPlan;
import dev.lukebemish.testbench.framework.model.StructureException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.RecursiveTask;

/**
 * Walks a {@link TestPlan} depth-first, invoking every leaf once and reporting each node to the registered
 * listeners. Leaf failures end up in results; only a malformed plan makes {@link #execute} throw.
 */
public final class ExecutionEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutionEngine.class);

    static final String CANCELLED = "Execution cancelled";

    private final List<ExecutionListener> listeners;
    private final LeafInvoker invoker;
    private final int parallelism;

    private ExecutionEngine(List<ExecutionListener> listeners, LeafInvoker invoker, int parallelism) {
        this.listeners = List.copyOf(listeners);
        this.invoker = invoker;
        this.parallelism = parallelism;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ExecutionSummary execute(TestPlan plan) {
        return execute(plan, new CancellationToken());
    }

    public ExecutionSummary execute(TestPlan plan, CancellationToken token) {
        var summaryListener = new SummaryGeneratingListener();
        var all = new ArrayList<ExecutionListener>(listeners.size() + 1);
        all.add(summaryListener);
        all.addAll(listeners);
        var dispatcher = new CompositeExecutionListener(all);

        LOGGER.debug("Executing {}", plan);
        dispatcher.planExecutionStarted(plan);
        var run = new Run(dispatcher, token);
        if (parallelism > 1) {
            var pool = new ForkJoinPool(parallelism);
            try {
                pool.invoke(run.new NodeTask(plan.getRoot()));
            } finally {
                pool.shutdownNow();
            }
        } else {
            run.visit(plan.getRoot());
        }
        dispatcher.planExecutionFinished(plan);
        return summaryListener.getSummary();
    }

    static ExecutionResult aggregate(List<ExecutionResult> results) {
        int unsuccessful = 0;
        int skipped = 0;
        for (ExecutionResult result : results) {
            switch (result.getStatus()) {
                case FAILED, ABORTED -> unsuccessful++;
                case SKIPPED -> skipped++;
                default -> {}
            }
        }
        if (unsuccessful > 0) {
            return ExecutionResult.failed(new FailureCause(FailureKind.DESCENDANT, new DescendantFailureException(unsuccessful, results.size())));
        }
        if (!results.isEmpty() && skipped == results.size()) {
            return ExecutionResult.skipped("All children skipped");
        }
        return ExecutionResult.successful();
    }

    private final class Run {
        private final ExecutionListener listener;
        private final CancellationToken token;
        private final Set<TestNode> visited = Collections.newSetFromMap(new ConcurrentHashMap<>());

        private Run(ExecutionListener listener, CancellationToken token) {
            this.listener = listener;
            this.token = token;
        }

        ExecutionResult visit(TestNode node) {
            markVisited(node);
            if (token.isCancellationRequested()) {
                return skip(node, CANCELLED);
            }
            listener.executionStarted(node);
            var result = node.isLeaf() ? invokeLeaf(node) : executeContainer(node);
            listener.executionFinished(node, result);
            return result;
        }

        private void markVisited(TestNode node) {
            if (!visited.add(node)) {
                throw new StructureException("Node " + node.id() + " was reached twice; the plan is not a tree");
            }
        }

        private ExecutionResult skip(TestNode node, String reason) {
            listener.executionStarted(node);
            for (TestNode child : node.children()) {
                markVisited(child);
                skip(child, reason);
            }
            var result = ExecutionResult.skipped(reason);
            listener.executionFinished(node, result);
            return result;
        }

        private ExecutionResult invokeLeaf(TestNode leaf) {
            try {
                return invoker.invoke(leaf);
            } catch (Throwable t) {
                LOGGER.warn("Leaf invoker threw instead of reporting a result for {}", leaf.id(), t);
                return ExecutionResult.fromThrowable(t);
            } finally {
                clearInterrupt(leaf);
            }
        }

        // An interrupt raised by one node belongs to that node's result, not to the nodes run after it.
        private void clearInterrupt(TestNode node) {
            if (Thread.interrupted()) {
                LOGGER.debug("Cleared interrupt left behind by {}", node.id());
            }
        }

        private ExecutionResult executeContainer(TestNode container) {
            var lifecycle = container.lifecycle();
            var before = runHook(container, lifecycle.before());
            if (before.isPresent()) {
                for (TestNode child : container.children()) {
                    markVisited(child);
                    skip(child, "Setup of " + container.displayName() + " did not succeed");
                }
                runHook(container, lifecycle.after());
                return before.get();
            }
            var results = executeChildren(container.children());
            var after = runHook(container, lifecycle.after());
            return after.orElseGet(() -> aggregate(results));
        }

        private List<ExecutionResult> executeChildren(List<TestNode> children) {
            if (parallelism > 1 && children.size() > 1) {
                var tasks = new ArrayList<NodeTask>(children.size());
                for (TestNode child : children) {
                    tasks.add(new NodeTask(child));
                }
                ForkJoinTask.invokeAll(tasks);
                var results = new ArrayList<ExecutionResult>(tasks.size());
                for (NodeTask task : tasks) {
                    results.add(task.join());
                }
                return results;
            }
            var results = new ArrayList<ExecutionResult>(children.size());
            for (TestNode child : children) {
                results.add(visit(child));
            }
            return results;
        }

        private Optional<ExecutionResult> runHook(TestNode container, @Nullable TestAction action) {
            if (action == null) {
                return Optional.empty();
            }
            try {
                action.execute();
                return Optional.empty();
            } catch (Throwable t) {
                return Optional.of(ExecutionResult.fromThrowable(t));
            } finally {
                clearInterrupt(container);
            }
        }

        private final class NodeTask extends RecursiveTask<ExecutionResult> {
            private final TestNode node;

            private NodeTask(TestNode node) {
                this.node = node;
            }

            @Override
            protected ExecutionResult compute() {
                return visit(node);
            }
        }
    }

    public static final class Builder {
        private final List<ExecutionListener> listeners = new ArrayList<>();
        private LeafInvoker invoker = LeafInvoker.direct();
        private int parallelism = 1;

        private Builder() {}

        public Builder listeners(ExecutionListener... listeners) {
            return listeners(Arrays.asList(listeners));
        }

        public Builder listeners(Collection<? extends ExecutionListener> listeners) {
            this.listeners.addAll(listeners);
            return this;
        }

        public Builder invoker(LeafInvoker invoker) {
            this.invoker = invoker;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism < 1) {
                throw new IllegalArgumentException("Parallelism must be at least 1, was " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        public ExecutionEngine build() {
            return new ExecutionEngine(listeners, invoker, parallelism);
        }
    }
}
