package dev.lukebemish.testbench.framework;

import dev.lukebemish.testbench.framework.execution.ExecutionEngine;
import dev.lukebemish.testbench.framework.execution.LeafInvoker;
import dev.lukebemish.testbench.framework.execution.TimeoutLeafInvoker;
import dev.lukebemish.testbench.framework.listener.ExecutionListener;
import dev.lukebemish.testbench.framework.listener.ExecutionSummary;
import dev.lukebemish.testbench.framework.listener.FailurePrintingListener;
import dev.lukebemish.testbench.framework.listener.SummaryPrinter;
import dev.lukebemish.testbench.framework.model.TestPlan;
import dev.lukebemish.testbench.framework.reflect.ReflectiveDiscovery;

import java.io.PrintWriter;
import java.util.List;

public class Framework {
    public static void main(String[] args) {
        var configuration = RunConfiguration.fromSystemProperties();
        var out = new PrintWriter(System.out, true);
        var errorPrinter = new FailurePrintingListener(new PrintWriter(System.err, true));

        var summary = run(configuration, List.of(errorPrinter));
        SummaryPrinter.printTo(summary, out);

        if (errorPrinter.hasFailures()) {
            throw new RuntimeException("Some tests failed. See the output above for details.");
        }

        if (summary.getTestsFoundCount() < 1) {
            throw new RuntimeException("No tests were found");
        }
    }

    public static TestPlan discover(RunConfiguration configuration) {
        return ReflectiveDiscovery.engine().discover(configuration.toDiscoveryRequest());
    }

    public static ExecutionSummary run(RunConfiguration configuration, List<? extends ExecutionListener> listeners) {
        TestPlan plan = discover(configuration);
        var timeout = configuration.timeout();
        if (timeout == null) {
            return execute(configuration, plan, LeafInvoker.direct(), listeners);
        }
        try (var invoker = new TimeoutLeafInvoker(LeafInvoker.direct(), timeout)) {
            return execute(configuration, plan, invoker, listeners);
        }
    }

    private static ExecutionSummary execute(RunConfiguration configuration, TestPlan plan, LeafInvoker invoker, List<? extends ExecutionListener> listeners) {
        return ExecutionEngine.builder()
            .listeners(listeners)
            .invoker(invoker)
            .parallelism(configuration.parallelism())
            .build()
            .execute(plan);
    }
}
