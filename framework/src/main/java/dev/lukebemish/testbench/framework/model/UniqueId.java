package dev.lukebemish.testbench.framework.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Structural identifier of a test node. Every id starts with the engine segment of the engine that discovered it;
 * child ids extend their parent's id by exactly one segment.
 */
public final class UniqueId {
    public static final String ENGINE_SEGMENT_TYPE = "engine";

    private final List<Segment> segments;

    private UniqueId(List<Segment> segments) {
        this.segments = List.copyOf(segments);
    }

    public static UniqueId root(String engineId) {
        return new UniqueId(List.of(new Segment(ENGINE_SEGMENT_TYPE, engineId)));
    }

    public UniqueId append(String segmentType, String segmentValue) {
        if (ENGINE_SEGMENT_TYPE.equals(segmentType)) {
            throw new IllegalArgumentException("Segment type '" + ENGINE_SEGMENT_TYPE + "' is reserved for engine roots");
        }
        var next = new ArrayList<Segment>(segments.size() + 1);
        next.addAll(segments);
        next.add(new Segment(segmentType, segmentValue));
        return new UniqueId(next);
    }

    public List<Segment> getSegments() {
        return segments;
    }

    public Segment getLastSegment() {
        return segments.get(segments.size() - 1);
    }

    public String getEngineId() {
        return segments.get(0).value();
    }

    public boolean isRoot() {
        return segments.size() == 1;
    }

    public Optional<UniqueId> getParent() {
        if (isRoot()) {
            return Optional.empty();
        }
        return Optional.of(new UniqueId(segments.subList(0, segments.size() - 1)));
    }

    public boolean hasPrefix(UniqueId prefix) {
        return prefix.segments.size() <= segments.size()
            && segments.subList(0, prefix.segments.size()).equals(prefix.segments);
    }

    public boolean isDirectChildOf(UniqueId parent) {
        return segments.size() == parent.segments.size() + 1 && hasPrefix(parent);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UniqueId other)) return false;
        return segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segments);
    }

    @Override
    public String toString() {
        return segments.stream().map(Segment::toString).collect(Collectors.joining("/"));
    }

    public record Segment(String type, String value) {
        public Segment {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return "[" + type + ":" + value + "]";
        }
    }
}
