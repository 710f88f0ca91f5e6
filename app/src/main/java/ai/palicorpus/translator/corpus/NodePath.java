package ai.palicorpus.translator.corpus;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Stable path-like identity of a corpus node, e.g. {@code dn/silakkhandha/dn1/section5}.
 */
public record NodePath(List<String> segments) {

    private static final String SEPARATOR = "/";

    public NodePath {
        segments = List.copyOf(Objects.requireNonNull(segments, "segments"));
        for (String segment : segments) {
            if (segment == null || segment.isBlank() || segment.contains(SEPARATOR) || segment.contains(SlotPath.FIELD_SEPARATOR)) {
                throw new IllegalArgumentException("Invalid path segment: " + segment);
            }
        }
    }

    public static NodePath root(String id) {
        return new NodePath(List.of(id));
    }

    public static NodePath parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Node path must not be blank");
        }
        String trimmed = raw.trim();
        while (trimmed.startsWith(SEPARATOR)) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith(SEPARATOR)) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return new NodePath(Arrays.asList(trimmed.split(SEPARATOR)));
    }

    public NodePath child(String segment) {
        List<String> extended = new ArrayList<>(segments.size() + 1);
        extended.addAll(segments);
        extended.add(segment);
        return new NodePath(extended);
    }

    public String lastSegment() {
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    public int depth() {
        return segments.size();
    }

    /**
     * True when this path equals {@code other} or lies below it.
     */
    public boolean startsWith(NodePath other) {
        if (other.segments.size() > segments.size()) {
            return false;
        }
        return segments.subList(0, other.segments.size()).equals(other.segments);
    }

    /**
     * True when the trailing segments of this path equal all segments of {@code suffix}.
     */
    public boolean endsWith(NodePath suffix) {
        int offset = segments.size() - suffix.segments.size();
        if (offset < 0) {
            return false;
        }
        return segments.subList(offset, segments.size()).equals(suffix.segments);
    }

    @Override
    public String toString() {
        return String.join(SEPARATOR, segments);
    }
}
