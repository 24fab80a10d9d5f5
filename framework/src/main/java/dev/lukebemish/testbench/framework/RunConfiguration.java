package dev.lukebemish.testbench.framework;

import dev.lukebemish.testbench.framework.discovery.DiscoveryException;
import dev.lukebemish.testbench.framework.discovery.DiscoveryFilter;
import dev.lukebemish.testbench.framework.discovery.DiscoveryRequest;
import dev.lukebemish.testbench.framework.discovery.NameFilter;
import dev.lukebemish.testbench.framework.discovery.Selector;
import dev.lukebemish.testbench.framework.discovery.Selectors;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.function.Function;

public record RunConfiguration(
    List<Selector> selectors,
    List<DiscoveryFilter> filters,
    @Nullable Duration timeout,
    int parallelism
) {
    public static final String PREFIX = "dev.lukebemish.testbench.";
    public static final String INCLUDE_PACKAGES = PREFIX + "include-packages";
    public static final String INCLUDE_CLASSES = PREFIX + "include-classes";
    public static final String INCLUDE_CONTAINERS = PREFIX + "include-containers";
    public static final String EXCLUDE_CONTAINERS = PREFIX + "exclude-containers";
    public static final String INCLUDE_UNITS = PREFIX + "include-units";
    public static final String EXCLUDE_UNITS = PREFIX + "exclude-units";
    public static final String TIMEOUT = PREFIX + "timeout";
    public static final String PARALLELISM = PREFIX + "parallelism";

    public RunConfiguration {
        selectors = List.copyOf(selectors);
        filters = List.copyOf(filters);
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1, was " + parallelism);
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("Timeout must be positive, was " + timeout);
        }
    }

    public static RunConfiguration fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    public static RunConfiguration fromProperties(Properties properties) {
        var selectors = new ArrayList<Selector>();
        for (String pkg : split(properties.getProperty(INCLUDE_PACKAGES, ""))) {
            selectors.add(Selectors.selectPackage(pkg));
        }
        for (String cls : split(properties.getProperty(INCLUDE_CLASSES, ""))) {
            selectors.add(Selectors.selectClass(cls));
        }
        var filters = new ArrayList<DiscoveryFilter>();
        addFilters(filters, properties.getProperty(INCLUDE_CONTAINERS, ""), NameFilter::includeContainers);
        addFilters(filters, properties.getProperty(EXCLUDE_CONTAINERS, ""), NameFilter::excludeContainers);
        addFilters(filters, properties.getProperty(INCLUDE_UNITS, ""), NameFilter::includeUnits);
        addFilters(filters, properties.getProperty(EXCLUDE_UNITS, ""), NameFilter::excludeUnits);

        var timeoutText = properties.getProperty(TIMEOUT, "");
        Duration timeout = timeoutText.isBlank() ? null : parseDuration(timeoutText);

        var parallelismText = properties.getProperty(PARALLELISM, "1").trim();
        int parallelism;
        try {
            parallelism = Integer.parseInt(parallelismText);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PARALLELISM + ": " + parallelismText, e);
        }
        return new RunConfiguration(selectors, filters, timeout, parallelism);
    }

    public DiscoveryRequest toDiscoveryRequest() {
        return DiscoveryRequest.builder()
            .selectors(selectors)
            .filters(filters)
            .build();
    }

    /**
     * Accepts either an ISO-8601 duration ({@code PT1.5S}) or a plain number of seconds. The result is at least one
     * millisecond long.
     */
    public static Duration parseDuration(String text) {
        var trimmed = text.trim();
        Duration duration;
        try {
            if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
                duration = Duration.parse(trimmed);
            } else {
                double seconds = Double.parseDouble(trimmed);
                if (!Double.isFinite(seconds)) {
                    throw new IllegalArgumentException("Invalid duration '" + text + "'");
                }
                duration = Duration.ofMillis(Math.round(seconds * 1000));
            }
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException("Invalid duration '" + text + "'", e);
        }
        if (duration.toMillis() < 1) {
            throw new IllegalArgumentException("Duration must be at least 1ms, was '" + text + "'");
        }
        return duration;
    }

    private static void addFilters(List<DiscoveryFilter> filters, String value, Function<String, DiscoveryFilter> factory) {
        for (String pattern : split(value)) {
            filters.add(factory.apply(pattern));
        }
    }

    private static List<String> split(String value) {
        if (value.isBlank()) {
            return List.of();
        }
        var parts = new ArrayList<String>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                parts.add(part.trim());
            }
        }
        return parts;
    }
}
