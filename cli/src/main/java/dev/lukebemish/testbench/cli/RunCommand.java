package dev.lukebemish.testbench.cli;

import dev.lukebemish.testbench.framework.Framework;
import dev.lukebemish.testbench.framework.discovery.DiscoveryException;
import dev.lukebemish.testbench.framework.listener.ExecutionListener;
import dev.lukebemish.testbench.framework.listener.ExecutionSummary;
import dev.lukebemish.testbench.framework.listener.FailurePrintingListener;
import dev.lukebemish.testbench.framework.listener.SummaryPrinter;
import dev.lukebemish.testbench.framework.listener.TreePrintingListener;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "run", mixinStandardHelpOptions = true, description = "Discover and execute tests, then print a summary")
class RunCommand implements Callable<Integer> {
    enum Details {
        TREE,
        FAILURES,
        NONE
    }

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    SelectionOptions selection;

    @CommandLine.Option(names = "--details", defaultValue = "TREE", description = "How much to print while running: ${COMPLETION-CANDIDATES}")
    Details details;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        List<ExecutionListener> listeners = new ArrayList<>();
        if (details == Details.TREE) {
            listeners.add(new TreePrintingListener(out));
        }
        if (details != Details.NONE) {
            listeners.add(new FailurePrintingListener(err));
        }

        ExecutionSummary summary;
        try {
            summary = Framework.run(selection.toConfiguration(), listeners);
        } catch (DiscoveryException e) {
            err.println("Discovery failed: " + e.getMessage());
            err.flush();
            return Main.DISCOVERY_FAILED;
        }
        SummaryPrinter.printTo(summary, out);
        SummaryPrinter.printFailuresTo(summary, out);

        if (summary.getTotalFailureCount() > 0) {
            return Main.TESTS_FAILED;
        }
        if (summary.getTestsFoundCount() < 1) {
            err.println("No tests were found");
            err.flush();
            return Main.NO_TESTS;
        }
        return Main.OK;
    }
}
