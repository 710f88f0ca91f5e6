package ai.palicorpus.translator.merge;

import ai.palicorpus.translator.corpus.SlotPath;
import java.util.List;

/**
 * Outcome of merging one translation into every location of a unit.
 *
 * @param applied locations that received the text
 * @param unchanged locations already holding the identical text
 * @param conflicts locations blocking the merge; when non-empty nothing was written
 */
public record MergeResult(List<SlotPath> applied, List<SlotPath> unchanged, List<MergeConflict> conflicts) {

    public MergeResult {
        applied = List.copyOf(applied);
        unchanged = List.copyOf(unchanged);
        conflicts = List.copyOf(conflicts);
    }

    public static MergeResult conflict(List<MergeConflict> conflicts) {
        if (conflicts.isEmpty()) {
            throw new IllegalArgumentException("A conflict result needs at least one conflict");
        }
        return new MergeResult(List.of(), List.of(), conflicts);
    }

    public boolean isConflict() {
        return !conflicts.isEmpty();
    }

    /**
     * True when the tree already held the text everywhere.
     */
    public boolean isNoOp() {
        return !isConflict() && applied.isEmpty();
    }
}
