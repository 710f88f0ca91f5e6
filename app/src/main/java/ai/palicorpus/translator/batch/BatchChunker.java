package ai.palicorpus.translator.batch;

import ai.palicorpus.translator.extract.TranslatableUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits extracted units into bounded batches. Batch boundaries depend only on unit positions.
 */
public class BatchChunker {

    public List<TranslationBatch> chunk(List<TranslatableUnit> units, int maxBatchSize) {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be at least 1");
        }
        if (units == null || units.isEmpty()) {
            return List.of();
        }
        List<TranslationBatch> batches = new ArrayList<>((units.size() + maxBatchSize - 1) / maxBatchSize);
        for (int start = 0; start < units.size(); start += maxBatchSize) {
            int end = Math.min(start + maxBatchSize, units.size());
            batches.add(new TranslationBatch(batches.size(), start, units.subList(start, end)));
        }
        return List.copyOf(batches);
    }
}
