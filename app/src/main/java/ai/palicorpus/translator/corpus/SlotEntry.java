package ai.palicorpus.translator.corpus;

import java.util.Objects;

/**
 * A slot together with its position in the deterministic traversal of the tree.
 */
public record SlotEntry(int ordinal, SlotPath path, TextSlot slot) {

    public SlotEntry {
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must not be negative");
        }
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(slot, "slot");
    }
}
