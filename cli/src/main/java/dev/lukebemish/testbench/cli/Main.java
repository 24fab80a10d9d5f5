package dev.lukebemish.testbench.cli;

import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(
    name = "testbench",
    mixinStandardHelpOptions = true,
    description = "Discover and run testbench containers from the classpath",
    subcommands = {DiscoverCommand.class, RunCommand.class}
)
public class Main implements Callable<Integer> {
    public static final int OK = 0;
    public static final int TESTS_FAILED = 1;
    public static final int DISCOVERY_FAILED = 3;
    public static final int NO_TESTS = 4;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    public static CommandLine commandLine() {
        return new CommandLine(new Main())
            .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return OK;
    }
}
