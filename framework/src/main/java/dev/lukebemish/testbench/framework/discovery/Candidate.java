package dev.lukebemish.testbench.framework.discovery;

import dev.lukebemish.testbench.framework.model.TestSource;

import java.util.Objects;

/**
 * What a resolver reports about one container or leaf candidate. {@code name} becomes the node's id segment and
 * drives ordering and name filters.
 */
public record Candidate(String name, String displayName, TestSource source) {
    public Candidate {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(source, "source");
    }
}
