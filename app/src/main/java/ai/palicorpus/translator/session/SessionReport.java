package ai.palicorpus.translator.session;

import ai.palicorpus.translator.extract.ReviewItem;
import ai.palicorpus.translator.merge.MergeConflict;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one session run. Translation counts are per (unit, language) pair.
 *
 * @param alreadyComplete slots in scope that held every required language before the run
 * @param skippedByCheckpoint units at or before the resume position
 * @param retryAfter provider-suggested delay when the run paused on quota
 * @param failure message of the error that paused the run
 */
public record SessionReport(String scope,
                            SessionState finalState,
                            int translated,
                            int reused,
                            int alreadyComplete,
                            int skippedByCheckpoint,
                            int unitsProcessed,
                            List<ReviewItem> reviewItems,
                            List<MergeConflict> conflicts,
                            Optional<String> lastCompletedLocation,
                            Optional<Duration> retryAfter,
                            Optional<String> failure) {

    public SessionReport {
        reviewItems = List.copyOf(reviewItems);
        conflicts = List.copyOf(conflicts);
        lastCompletedLocation = lastCompletedLocation == null ? Optional.empty() : lastCompletedLocation;
        retryAfter = retryAfter == null ? Optional.empty() : retryAfter;
        failure = failure == null ? Optional.empty() : failure;
    }

    public int flaggedForReview() {
        return reviewItems.size();
    }

    public int conflictCount() {
        return conflicts.size();
    }
}
