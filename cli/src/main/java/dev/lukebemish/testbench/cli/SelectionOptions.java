package dev.lukebemish.testbench.cli;

import dev.lukebemish.testbench.framework.RunConfiguration;
import dev.lukebemish.testbench.framework.discovery.DiscoveryFilter;
import dev.lukebemish.testbench.framework.discovery.NameFilter;
import dev.lukebemish.testbench.framework.discovery.Selector;
import dev.lukebemish.testbench.framework.discovery.Selectors;
import picocli.CommandLine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

class SelectionOptions {
    @CommandLine.Spec(CommandLine.Spec.Target.MIXEE)
    CommandLine.Model.CommandSpec mixee;

    @CommandLine.Option(names = "--select", paramLabel = "SELECTOR", description = "What to discover: package:<name> or class:<name>. Repeatable.")
    List<String> selectors = new ArrayList<>();

    @CommandLine.Option(names = "--include-container", paramLabel = "REGEX", description = "Only keep containers whose class name matches")
    List<String> includeContainers = new ArrayList<>();

    @CommandLine.Option(names = "--exclude-container", paramLabel = "REGEX", description = "Drop containers whose class name matches")
    List<String> excludeContainers = new ArrayList<>();

    @CommandLine.Option(names = "--include-unit", paramLabel = "REGEX", description = "Only keep units whose name matches")
    List<String> includeUnits = new ArrayList<>();

    @CommandLine.Option(names = "--exclude-unit", paramLabel = "REGEX", description = "Drop units whose name matches")
    List<String> excludeUnits = new ArrayList<>();

    @CommandLine.Option(names = "--timeout", paramLabel = "DURATION", converter = DurationConverter.class, description = "Abort any unit running longer than this (ISO-8601 or seconds)")
    Duration timeout;

    @CommandLine.Option(names = "--parallelism", paramLabel = "N", description = "Run sibling containers and units on up to N threads")
    Integer parallelism;

    /**
     * Layers the options on top of the configuration found in system properties.
     */
    RunConfiguration toConfiguration() {
        try {
            var base = RunConfiguration.fromSystemProperties();
            List<Selector> allSelectors = new ArrayList<>(base.selectors());
            allSelectors.addAll(Selectors.parseAll(selectors));
            List<DiscoveryFilter> filters = new ArrayList<>(base.filters());
            includeContainers.forEach(pattern -> filters.add(NameFilter.includeContainers(pattern)));
            excludeContainers.forEach(pattern -> filters.add(NameFilter.excludeContainers(pattern)));
            includeUnits.forEach(pattern -> filters.add(NameFilter.includeUnits(pattern)));
            excludeUnits.forEach(pattern -> filters.add(NameFilter.excludeUnits(pattern)));
            return new RunConfiguration(
                allSelectors,
                filters,
                timeout != null ? timeout : base.timeout(),
                parallelism != null ? parallelism : base.parallelism()
            );
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(mixee.commandLine(), e.getMessage(), e);
        }
    }

    static class DurationConverter implements CommandLine.ITypeConverter<Duration> {
        @Override
        public Duration convert(String value) {
            try {
                return RunConfiguration.parseDuration(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
