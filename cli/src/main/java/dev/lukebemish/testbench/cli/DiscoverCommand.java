package dev.lukebemish.testbench.cli;

import dev.lukebemish.testbench.framework.Framework;
import dev.lukebemish.testbench.framework.discovery.DiscoveryException;
import dev.lukebemish.testbench.framework.model.TestNode;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "discover", mixinStandardHelpOptions = true, description = "Print the discovered test plan without running it")
class DiscoverCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    SelectionOptions selection;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        try {
            var plan = Framework.discover(selection.toConfiguration());
            print(plan.getRoot(), out);
            out.printf("%d containers, %d tests%n", plan.countContainers(), plan.countTests());
            out.flush();
            return plan.containsTests() ? Main.OK : Main.NO_TESTS;
        } catch (DiscoveryException e) {
            err.println("Discovery failed: " + e.getMessage());
            err.flush();
            return Main.DISCOVERY_FAILED;
        }
    }

    private static void print(TestNode node, PrintWriter out) {
        out.println("  ".repeat(node.depth()) + node.displayName() + " " + node.id());
        for (TestNode child : node.children()) {
            print(child, out);
        }
    }
}
