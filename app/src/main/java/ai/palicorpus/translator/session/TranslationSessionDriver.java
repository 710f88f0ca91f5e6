package ai.palicorpus.translator.session;

import ai.palicorpus.translator.batch.BatchChunker;
import ai.palicorpus.translator.batch.TranslationBatch;
import ai.palicorpus.translator.corpus.CorpusTree;
import ai.palicorpus.translator.corpus.Language;
import ai.palicorpus.translator.corpus.NodePath;
import ai.palicorpus.translator.corpus.TreeIntegrityException;
import ai.palicorpus.translator.extract.ExtractionResult;
import ai.palicorpus.translator.extract.MissingUnitExtractor;
import ai.palicorpus.translator.extract.ReviewItem;
import ai.palicorpus.translator.extract.TranslatableUnit;
import ai.palicorpus.translator.merge.MergeConflict;
import ai.palicorpus.translator.merge.MergeEngine;
import ai.palicorpus.translator.merge.MergeResult;
import ai.palicorpus.translator.sanitize.SanitizationResult;
import ai.palicorpus.translator.sanitize.TextSanitizer;
import ai.palicorpus.translator.sanitize.ValidationError;
import ai.palicorpus.translator.translate.ProviderUnavailableException;
import ai.palicorpus.translator.translate.QuotaExceededException;
import ai.palicorpus.translator.translate.TransientProviderException;
import ai.palicorpus.translator.translate.TranslationException;
import ai.palicorpus.translator.translate.Translator;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Drives one translation session over a corpus scope.
 *
 * <p>Units are processed strictly in extraction order. After each unit the tree is saved and the checkpoint
 * advanced, so a paused or crashed run resumes with the first unit that did not finish. Quota stops pause the
 * session without retrying; validation failures and conflicts are recorded and the run continues.
 */
public class TranslationSessionDriver {

    static final String MDC_SESSION = "session";
    static final String MDC_UNIT = "unit";

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationSessionDriver.class);

    private final Translator translator;
    private final TextSanitizer sanitizer;
    private final MergeEngine mergeEngine;
    private final CheckpointStore checkpointStore;
    private final CorpusSaver corpusSaver;
    private final MissingUnitExtractor extractor;
    private final BatchChunker chunker;
    private final Clock clock;
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private volatile SessionState state = SessionState.IDLE;

    public TranslationSessionDriver(Translator translator, TextSanitizer sanitizer, MergeEngine mergeEngine,
                                    CheckpointStore checkpointStore, CorpusSaver corpusSaver) {
        this(translator, sanitizer, mergeEngine, checkpointStore, corpusSaver, new MissingUnitExtractor(),
                new BatchChunker(), Clock.systemUTC());
    }

    public TranslationSessionDriver(Translator translator, TextSanitizer sanitizer, MergeEngine mergeEngine,
                                    CheckpointStore checkpointStore, CorpusSaver corpusSaver,
                                    MissingUnitExtractor extractor, BatchChunker chunker, Clock clock) {
        this.translator = Objects.requireNonNull(translator, "translator");
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer");
        this.mergeEngine = Objects.requireNonNull(mergeEngine, "mergeEngine");
        this.checkpointStore = Objects.requireNonNull(checkpointStore, "checkpointStore");
        this.corpusSaver = Objects.requireNonNull(corpusSaver, "corpusSaver");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SessionState state() {
        return state;
    }

    /**
     * Asks the running session to stop after the unit in flight. The session ends in {@link SessionState#PAUSED_USER}.
     * A request made before {@link #run} starts pauses that run before its first unit.
     */
    public void requestStop() {
        stopRequested.set(true);
    }

    public SessionReport run(CorpusTree tree, SessionSettings settings) {
        return run(tree, null, settings);
    }

    /**
     * @param scope subtree to translate; the whole tree when null
     */
    public SessionReport run(CorpusTree tree, NodePath scope, SessionSettings settings) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(settings, "settings");
        NodePath effectiveScope = scope == null ? tree.root().path() : scope;
        if (tree.node(effectiveScope).isEmpty()) {
            throw new IllegalArgumentException("Scope " + effectiveScope + " is not part of the corpus");
        }
        if (!state.canTransitionTo(SessionState.RUNNING)) {
            throw new IllegalStateException("Session is already " + state);
        }
        String scopeKey = effectiveScope.toString();
        SessionCheckpoint checkpoint = checkpointStore.acquire(scopeKey, settings.owner());
        transition(SessionState.RUNNING);
        MDC.put(MDC_SESSION, scopeKey);
        try {
            return new Run(tree, effectiveScope, settings, checkpoint).execute();
        } finally {
            stopRequested.set(false);
            MDC.remove(MDC_UNIT);
            MDC.remove(MDC_SESSION);
        }
    }

    private synchronized void transition(SessionState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal session transition " + state + " -> " + next);
        }
        LOGGER.debug("Session state {} -> {}", state, next);
        state = next;
    }

    private final class Run {

        private final CorpusTree tree;
        private final NodePath scope;
        private final SessionSettings settings;
        private final List<ReviewItem> reviewItems = new ArrayList<>();
        private final List<MergeConflict> conflicts = new ArrayList<>();
        private final int unitsDoneBefore;
        private SessionCheckpoint checkpoint;
        private int translated;
        private int reused;
        private int alreadyComplete;
        private int skipped;
        private int processed;

        private Run(CorpusTree tree, NodePath scope, SessionSettings settings, SessionCheckpoint checkpoint) {
            this.tree = tree;
            this.scope = scope;
            this.settings = settings;
            this.checkpoint = checkpoint;
            this.unitsDoneBefore = checkpoint.completedUnits();
        }

        SessionReport execute() {
            List<TranslationBatch> batches;
            int resumeOrdinal;
            try {
                ExtractionResult extraction = extractor.extract(tree, scope, settings.languages());
                alreadyComplete = extraction.completeSlots();
                batches = chunker.chunk(extraction.units(), settings.batchSize());
                resumeOrdinal = resumeOrdinal();
                LOGGER.info("Session {}: {} unit(s) missing translations in {} batch(es), {} slot(s) already complete",
                        scope, extraction.units().size(), batches.size(), alreadyComplete);
            } catch (TreeIntegrityException | IllegalArgumentException ex) {
                LOGGER.error("Cannot start session {}: {}", scope, ex.getMessage());
                return pause(SessionState.PAUSED_ERROR, ex.getMessage(), Optional.empty());
            }

            for (TranslationBatch batch : batches) {
                for (TranslatableUnit unit : batch.units()) {
                    Optional<SessionReport> paused = processInOrder(unit, resumeOrdinal);
                    if (paused.isPresent()) {
                        return paused.get();
                    }
                }
            }
            return complete();
        }

        private Optional<SessionReport> processInOrder(TranslatableUnit unit, int resumeOrdinal) {
            try {
                int ordinal = tree.ordinalOf(unit.canonicalLocation())
                        .orElseThrow(() -> new TreeIntegrityException("Unit location " + unit.canonicalLocation()
                                + " is not in the tree"));
                if (ordinal <= resumeOrdinal) {
                    skipped++;
                    return Optional.empty();
                }
                if (stopRequested.get()) {
                    LOGGER.info("Stop requested; pausing before {}", unit.canonicalLocation());
                    return Optional.of(pause(SessionState.PAUSED_USER, null, Optional.empty()));
                }
                if (settings.maxUnitsPerRun() > 0 && processed >= settings.maxUnitsPerRun()) {
                    LOGGER.info("Processed {} unit(s), the per-run limit; pausing before {}",
                            processed, unit.canonicalLocation());
                    return Optional.of(pause(SessionState.PAUSED_USER, null, Optional.empty()));
                }
                MDC.put(MDC_UNIT, unit.canonicalLocation().toString());
                Optional<SessionReport> paused = translateUnit(unit);
                if (paused.isPresent()) {
                    return paused;
                }
                corpusSaver.save(tree);
                checkpoint = checkpointStore.save(checkpoint.withProgress(unit.canonicalLocation().toString(),
                        unitsDone() + 1, settings.batchSize(), clock.instant()), settings.owner());
                processed++;
                return Optional.empty();
            } catch (SessionLockedException ex) {
                LOGGER.error("Lost the session lock: {}", ex.getMessage());
                transition(SessionState.PAUSED_ERROR);
                return Optional.of(report(SessionState.PAUSED_ERROR, ex.getMessage(), Optional.empty()));
            } catch (RuntimeException ex) {
                LOGGER.error("Session {} halted at {}: {}", scope, unit.canonicalLocation(), ex.getMessage(), ex);
                return Optional.of(pause(SessionState.PAUSED_ERROR, ex.getMessage(), Optional.empty()));
            } finally {
                MDC.remove(MDC_UNIT);
            }
        }

        private Optional<SessionReport> translateUnit(TranslatableUnit unit) {
            for (Language language : unit.missingLanguages()) {
                Optional<String> reusable = unit.reusableTranslation(language);
                String text;
                if (reusable.isPresent()) {
                    text = reusable.get();
                } else {
                    String raw;
                    try {
                        raw = translator.translate(unit.sourceText(), language);
                    } catch (QuotaExceededException ex) {
                        LOGGER.warn("Provider quota exhausted at {} ({}); pausing", unit.canonicalLocation(), language.key());
                        corpusSaver.save(tree);
                        return Optional.of(pause(SessionState.PAUSED_QUOTA, ex.getMessage(), ex.retryAfter()));
                    } catch (TransientProviderException | ProviderUnavailableException ex) {
                        LOGGER.error("Provider failure at {} ({}): {}", unit.canonicalLocation(), language.key(),
                                ex.getMessage());
                        corpusSaver.save(tree);
                        return Optional.of(pause(SessionState.PAUSED_ERROR, ex.getMessage(), Optional.empty()));
                    } catch (TranslationException ex) {
                        LOGGER.warn("Provider rejected {} ({}): {}", unit.canonicalLocation(), language.key(), ex.getMessage());
                        reviewItems.add(new ReviewItem(unit.canonicalLocation(), language, unit.sourceText(),
                                ReviewItem.PROVIDER_REJECTED, ex.getMessage()));
                        continue;
                    }
                    SanitizationResult result = sanitizer.sanitize(raw, unit.sourceText(), language);
                    if (!result.isAccepted()) {
                        ValidationError error = result.error().orElseThrow();
                        LOGGER.warn("Translation of {} ({}) needs review: {}", unit.canonicalLocation(), language.key(),
                                error.message());
                        reviewItems.add(new ReviewItem(unit.canonicalLocation(), language, unit.sourceText(),
                                error.kind().name(), error.message()));
                        continue;
                    }
                    text = result.text().orElseThrow();
                }
                MergeResult merge = mergeEngine.merge(tree, unit, language, text, settings.force());
                if (merge.isConflict()) {
                    conflicts.addAll(merge.conflicts());
                } else if (reusable.isPresent()) {
                    reused++;
                } else {
                    translated++;
                }
            }
            return Optional.empty();
        }

        /**
         * Units of the scope finished before the unit in flight. Finished units drop out of a fresh extraction, so
         * the count carries over from the checkpoint; an operator resume key counts the units it skips instead.
         */
        private int unitsDone() {
            int before = settings.resumeFrom().isPresent() ? skipped : unitsDoneBefore;
            return before + processed;
        }

        private int resumeOrdinal() {
            if (settings.resumeFrom().isPresent()) {
                String key = settings.resumeFrom().get();
                LOGGER.info("Resuming after operator-supplied position {}", key);
                return tree.resumeOrdinal(key);
            }
            return checkpoint.lastCompleted()
                    .map(location -> {
                        LOGGER.info("Resuming after checkpoint position {}", location);
                        return tree.resumeOrdinal(location);
                    })
                    .orElse(-1);
        }

        private SessionReport pause(SessionState pausedState, String failure, Optional<Duration> retryAfter) {
            transition(pausedState);
            try {
                checkpoint = checkpointStore.save(checkpoint.released(pausedState, clock.instant()), settings.owner());
            } catch (RuntimeException ex) {
                LOGGER.error("Could not release the lock of scope {}: {}", scope, ex.getMessage(), ex);
            }
            retryAfter.ifPresent(delay -> LOGGER.warn("Provider asked to retry in {} s", delay.toSeconds()));
            LOGGER.info("Session {} paused ({}) after {} unit(s)", scope, pausedState, processed);
            return report(pausedState, failure, retryAfter);
        }

        private SessionReport complete() {
            transition(SessionState.COMPLETE);
            checkpoint = checkpointStore.save(checkpoint.released(SessionState.COMPLETE, clock.instant()),
                    settings.owner());
            LOGGER.info("Session {} complete: {} translated, {} reused, {} skipped, {} for review, {} conflict(s)",
                    scope, translated, reused, skipped, reviewItems.size(), conflicts.size());
            return report(SessionState.COMPLETE, null, Optional.empty());
        }

        private SessionReport report(SessionState finalState, String failure, Optional<Duration> retryAfter) {
            return new SessionReport(scope.toString(), finalState, translated, reused, alreadyComplete, skipped,
                    processed, reviewItems, conflicts, checkpoint.lastCompleted(), retryAfter,
                    Optional.ofNullable(failure));
        }
    }
}
