package ai.palicorpus.translator.corpus;

/**
 * Translatable fields a corpus node can carry. Declaration order is the traversal order within a node.
 */
public enum FieldKind {
    NAME("name"),
    TITLE("title"),
    VAGGA("vagga"),
    BODY("body"),
    FOOTER("footer");

    private final String key;

    FieldKind(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static FieldKind fromKey(String key) {
        for (FieldKind kind : values()) {
            if (kind.key.equals(key)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown field: " + key);
    }
}
