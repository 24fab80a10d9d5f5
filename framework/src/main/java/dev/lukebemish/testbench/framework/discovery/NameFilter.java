package dev.lukebemish.testbench.framework.discovery;

import dev.lukebemish.testbench.framework.model.NodeKind;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public final class NameFilter implements DiscoveryFilter {
    private final NodeKind target;
    private final Pattern pattern;
    private final boolean include;

    private NameFilter(NodeKind target, String pattern, boolean include) {
        this.target = target;
        this.include = include;
        try {
            this.pattern = Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new DiscoveryException("Invalid name pattern '" + pattern + "'", e);
        }
    }

    public static NameFilter includeContainers(String pattern) {
        return new NameFilter(NodeKind.CONTAINER, pattern, true);
    }

    public static NameFilter excludeContainers(String pattern) {
        return new NameFilter(NodeKind.CONTAINER, pattern, false);
    }

    public static NameFilter includeUnits(String pattern) {
        return new NameFilter(NodeKind.LEAF, pattern, true);
    }

    public static NameFilter excludeUnits(String pattern) {
        return new NameFilter(NodeKind.LEAF, pattern, false);
    }

    @Override
    public NodeKind target() {
        return target;
    }

    @Override
    public boolean includes(Candidate candidate) {
        return pattern.matcher(candidate.name()).matches() == include;
    }

    @Override
    public String toString() {
        return (include ? "include " : "exclude ") + target.name().toLowerCase() + " matching " + pattern.pattern();
    }
}
