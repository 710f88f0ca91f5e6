package ai.palicorpus.translator.corpus;

import java.util.Objects;

/**
 * Address of a single translatable field: {@code <node path>#<field>}.
 */
public record SlotPath(NodePath node, FieldKind field) {

    static final String FIELD_SEPARATOR = "#";

    public SlotPath {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(field, "field");
    }

    public static SlotPath parse(String raw) {
        if (raw == null || !raw.contains(FIELD_SEPARATOR)) {
            throw new IllegalArgumentException("Slot path must have the form <node>#<field>: " + raw);
        }
        int index = raw.lastIndexOf(FIELD_SEPARATOR);
        return new SlotPath(NodePath.parse(raw.substring(0, index)), FieldKind.fromKey(raw.substring(index + 1).trim()));
    }

    public static boolean isSlotKey(String raw) {
        return raw != null && raw.contains(FIELD_SEPARATOR);
    }

    @Override
    public String toString() {
        return node + FIELD_SEPARATOR + field.key();
    }
}
