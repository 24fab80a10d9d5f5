package dev.lukebemish.testbench.framework.model;

import org.jspecify.annotations.Nullable;

import java.util.Optional;

public record TestSource(@Nullable String container, @Nullable String unit) {
    private static final TestSource NONE = new TestSource(null, null);

    public static TestSource none() {
        return NONE;
    }

    public static TestSource ofContainer(String container) {
        return new TestSource(container, null);
    }

    public static TestSource ofUnit(String container, String unit) {
        return new TestSource(container, unit);
    }

    public Optional<String> containerName() {
        return Optional.ofNullable(container);
    }

    public Optional<String> unitName() {
        return Optional.ofNullable(unit);
    }

    public String describe() {
        if (container == null) {
            return "unknown source";
        }
        if (unit == null) {
            return "container " + container;
        }
        return "unit " + unit + " defined in container " + container;
    }

    @Override
    public String toString() {
        return describe();
    }
}
