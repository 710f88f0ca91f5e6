package ai.palicorpus.translator.batch;

import ai.palicorpus.translator.extract.TranslatableUnit;
import java.util.List;

/**
 * Contiguous slice of the extraction order.
 *
 * @param index zero-based position of the batch
 * @param firstUnitIndex position of the first unit within the extraction result
 */
public record TranslationBatch(int index, int firstUnitIndex, List<TranslatableUnit> units) {

    public TranslationBatch {
        if (index < 0 || firstUnitIndex < 0) {
            throw new IllegalArgumentException("Batch positions must not be negative");
        }
        units = List.copyOf(units);
    }

    public int size() {
        return units.size();
    }
}
