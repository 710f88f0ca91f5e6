package ai.palicorpus.translator.batch;

import ai.palicorpus.translator.extract.ReviewItem;
import ai.palicorpus.translator.merge.MergeConflict;
import java.util.List;

/**
 * Counts are per (unit, language) pair.
 *
 * @param skipped filled values for pairs the corpus no longer needs
 */
public record BatchImportReport(int files, int applied, int unchanged, int skipped,
                                List<ReviewItem> reviewItems, List<MergeConflict> conflicts) {

    public BatchImportReport {
        reviewItems = List.copyOf(reviewItems);
        conflicts = List.copyOf(conflicts);
    }
}
