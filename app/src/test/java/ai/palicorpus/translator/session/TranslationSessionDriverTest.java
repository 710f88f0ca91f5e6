package ai.palicorpus.translator.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.palicorpus.translator.corpus.ChapterNode;
import ai.palicorpus.translator.corpus.CorpusFixtures;
import ai.palicorpus.translator.corpus.CorpusTree;
import ai.palicorpus.translator.corpus.FieldKind;
import ai.palicorpus.translator.corpus.Language;
import ai.palicorpus.translator.corpus.NodePath;
import ai.palicorpus.translator.corpus.SectionNode;
import ai.palicorpus.translator.corpus.SlotEntry;
import ai.palicorpus.translator.corpus.SlotPath;
import ai.palicorpus.translator.extract.ReviewItem;
import ai.palicorpus.translator.merge.MergeEngine;
import ai.palicorpus.translator.sanitize.TextSanitizer;
import ai.palicorpus.translator.sanitize.ValidationErrorKind;
import ai.palicorpus.translator.translate.QuotaExceededException;
import ai.palicorpus.translator.translate.TransientProviderException;
import ai.palicorpus.translator.translate.TranslationException;
import ai.palicorpus.translator.translate.Translator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class TranslationSessionDriverTest {

    private static final Set<Language> BOTH = EnumSet.of(Language.ENGLISH, Language.SINHALA);
    private static final String SINHALA_TEXT = "ධර්ම දේශනාව";

    private final InMemoryCheckpointStore store = new InMemoryCheckpointStore();
    private final List<String> calls = new ArrayList<>();

    private final Translator scripted = (source, target) -> {
        calls.add(source + "|" + target.key());
        return target == Language.ENGLISH ? "EN " + source : SINHALA_TEXT;
    };

    @Test
    void translatesEveryMissingUnitOnce() {
        CorpusTree tree = CorpusFixtures.twoChapterBook();
        AtomicInteger saves = new AtomicInteger();

        SessionReport report = driver(scripted, saved -> saves.incrementAndGet()).run(tree, settings(0));

        assertThat(report.finalState()).isEqualTo(SessionState.COMPLETE);
        assertThat(report.unitsProcessed()).isEqualTo(13);
        assertThat(report.translated()).isEqualTo(26);
        assertThat(calls).hasSize(26);
        assertThat(calls).filteredOn(call -> call.startsWith("Dutiyavaggo")).hasSize(2);
        assertThat(saves).hasValue(13);
        assertThat(tree.slots()).allSatisfy(entry -> assertThat(entry.slot().isComplete(BOTH)).isTrue());
        assertThat(tree.slot(SlotPath.parse("book/chapterB/section1#vagga")).orElseThrow()
                .translation(Language.ENGLISH)).contains("EN Dutiyavaggo");
        assertThat(store.load("book").orElseThrow().state()).isEqualTo(SessionState.COMPLETE);
    }

    @Test
    void quotaPauseThenResumeMatchesAnUninterruptedRun() {
        CorpusTree uninterrupted = CorpusFixtures.twoChapterBook();
        driver(scripted, CorpusSaver.discarding()).run(uninterrupted, settings(0));
        calls.clear();

        CorpusTree tree = CorpusFixtures.twoChapterBook();
        AtomicInteger budget = new AtomicInteger(9);
        Translator limited = (source, target) -> {
            if (budget.decrementAndGet() < 0) {
                throw new QuotaExceededException("quota", Duration.ofSeconds(42), null);
            }
            return scripted.translate(source, target);
        };
        SessionReport paused = driver(limited, CorpusSaver.discarding()).run(tree, settings(0));

        assertThat(paused.finalState()).isEqualTo(SessionState.PAUSED_QUOTA);
        assertThat(paused.retryAfter()).contains(Duration.ofSeconds(42));
        assertThat(paused.unitsProcessed()).isEqualTo(4);
        assertThat(paused.lastCompletedLocation()).contains("book/chapterA/section2#body");
        SessionCheckpoint stored = store.load("book").orElseThrow();
        assertThat(stored.state()).isEqualTo(SessionState.PAUSED_QUOTA);
        assertThat(stored.lockOwner()).isNull();

        calls.clear();
        SessionReport resumed = driver(scripted, CorpusSaver.discarding()).run(tree, settings(0));

        assertThat(resumed.finalState()).isEqualTo(SessionState.COMPLETE);
        assertThat(resumed.skippedByCheckpoint()).isZero();
        assertThat(calls.get(0)).isEqualTo("Pāḷi paragraph A3|sinhala");
        assertThat(translations(tree)).isEqualTo(translations(uninterrupted));
    }

    @Test
    void resumesAfterAnOperatorSuppliedNode() {
        CorpusTree tree = CorpusFixtures.twoChapterBook();
        SessionSettings settings = new SessionSettings(BOTH, 200, 0, Optional.of("chapterA/section5"), false, "alpha");

        SessionReport report = driver(scripted, CorpusSaver.discarding()).run(tree, settings);

        assertThat(report.finalState()).isEqualTo(SessionState.COMPLETE);
        assertThat(report.skippedByCheckpoint()).isEqualTo(8);
        assertThat(calls.get(0)).isEqualTo("Pāḷi paragraph A6|english");
        assertThat(tree.slot(SlotPath.parse("book/chapterA/section5#body")).orElseThrow()
                .isMissing(Language.ENGLISH)).isTrue();
    }

    @Test
    void invalidResumeKeyPausesWithError() {
        CorpusTree tree = CorpusFixtures.twoChapterBook();
        SessionSettings settings = new SessionSettings(BOTH, 200, 0, Optional.of("chapterZ"), false, "alpha");

        SessionReport report = driver(scripted, CorpusSaver.discarding()).run(tree, settings);

        assertThat(report.finalState()).isEqualTo(SessionState.PAUSED_ERROR);
        assertThat(report.failure()).hasValueSatisfying(message -> assertThat(message).contains("chapterZ"));
        assertThat(calls).isEmpty();
    }

    @Test
    void flagsRejectedOutputForReviewAndKeepsGoing() {
        CorpusTree tree = CorpusFixtures.twoChapterBook();
        Translator picky = (source, target) -> {
            if (source.equals("Pāḷi paragraph A2") && target == Language.ENGLISH) {
                return "Here is the English translation:";
            }
            if (source.equals("Pāḷi paragraph A3") && target == Language.SINHALA) {
                return "Thus have I heard.";
            }
            if (source.equals("Pāḷi paragraph B2")) {
                throw new TranslationException("Response blocked: SAFETY");
            }
            return scripted.translate(source, target);
        };

        SessionReport report = driver(picky, CorpusSaver.discarding()).run(tree, settings(0));

        assertThat(report.finalState()).isEqualTo(SessionState.COMPLETE);
        assertThat(report.reviewItems()).extracting(ReviewItem::reason).containsExactly(
                ValidationErrorKind.EMPTY_TRANSLATION.name(),
                ValidationErrorKind.FOREIGN_CHARACTER.name(),
                ReviewItem.PROVIDER_REJECTED,
                ReviewItem.PROVIDER_REJECTED);
        assertThat(report.flaggedForReview()).isEqualTo(4);
        assertThat(tree.slot(SlotPath.parse("book/chapterA/section2#body")).orElseThrow()
                .isMissing(Language.ENGLISH)).isTrue();
        assertThat(tree.slot(SlotPath.parse("book/chapterA/section2#body")).orElseThrow()
                .translation(Language.SINHALA)).contains(SINHALA_TEXT);
    }

    @Test
    void reusesAnExistingTranslationWithoutCallingTheProvider() {
        ChapterNode chapter = new ChapterNode("chapter", 1);
        SectionNode first = new SectionNode(1);
        first.putSlot(FieldKind.VAGGA, CorpusFixtures.slot("Dutiyavaggo", "The Second Chapter", SINHALA_TEXT));
        SectionNode second = new SectionNode(2);
        second.putSlot(FieldKind.VAGGA, CorpusFixtures.slot("Dutiyavaggo"));
        chapter.addSection(first).addSection(second);
        CorpusTree tree = new CorpusTree(chapter);

        SessionReport report = driver(scripted, CorpusSaver.discarding()).run(tree, settings(0));

        assertThat(report.reused()).isEqualTo(2);
        assertThat(report.translated()).isZero();
        assertThat(calls).isEmpty();
        assertThat(tree.slot(SlotPath.parse("chapter/section2#vagga")).orElseThrow()
                .translation(Language.ENGLISH)).contains("The Second Chapter");
    }

    @Test
    void stopRequestPausesAfterTheUnitInFlight() {
        CorpusTree tree = CorpusFixtures.twoChapterBook();
        TranslationSessionDriver[] holder = new TranslationSessionDriver[1];
        Translator stopping = (source, target) -> {
            holder[0].requestStop();
            return scripted.translate(source, target);
        };
        holder[0] = driver(stopping, CorpusSaver.discarding());

        SessionReport report = holder[0].run(tree, settings(0));

        assertThat(report.finalState()).isEqualTo(SessionState.PAUSED_USER);
        assertThat(report.unitsProcessed()).isEqualTo(1);
        assertThat(report.lastCompletedLocation()).contains("book#title");
        assertThat(holder[0].state()).isEqualTo(SessionState.PAUSED_USER);
    }

    @Test
    void unitLimitPausesAndNextRunContinues() {
        CorpusTree tree = CorpusFixtures.twoChapterBook();

        SessionReport first = driver(scripted, CorpusSaver.discarding()).run(tree, settings(3));
        SessionReport second = driver(scripted, CorpusSaver.discarding()).run(tree, settings(0));

        assertThat(first.finalState()).isEqualTo(SessionState.PAUSED_USER);
        assertThat(first.unitsProcessed()).isEqualTo(3);
        assertThat(first.lastCompletedLocation()).contains("book/chapterA/section1#body");
        assertThat(second.skippedByCheckpoint()).isZero();
        assertThat(second.unitsProcessed()).isEqualTo(10);
        assertThat(second.finalState()).isEqualTo(SessionState.COMPLETE);
    }

    @Test
    void transientFailurePausesWithError() {
        CorpusTree tree = CorpusFixtures.twoChapterBook();
        AtomicInteger saves = new AtomicInteger();
        Translator failing = (source, target) -> {
            if (source.equals("Brahmajālasuttaṃ")) {
                throw new TransientProviderException("503 overloaded", null);
            }
            return scripted.translate(source, target);
        };

        SessionReport report = driver(failing, saved -> saves.incrementAndGet()).run(tree, settings(0));

        assertThat(report.finalState()).isEqualTo(SessionState.PAUSED_ERROR);
        assertThat(report.unitsProcessed()).isEqualTo(1);
        assertThat(report.failure()).contains("503 overloaded");
        assertThat(saves).hasValue(2);
    }

    @Test
    void lockedScopeIsRefused() {
        store.acquire("book", "someone-else");
        TranslationSessionDriver driver = driver(scripted, CorpusSaver.discarding());

        assertThatThrownBy(() -> driver.run(CorpusFixtures.twoChapterBook(), settings(0)))
                .isInstanceOf(SessionLockedException.class);
        assertThat(driver.state()).isEqualTo(SessionState.IDLE);
        assertThat(calls).isEmpty();
    }

    @Test
    void scopeNestedInALockedScopeIsRefused() {
        store.acquire("book", "someone-else");
        TranslationSessionDriver driver = driver(scripted, CorpusSaver.discarding());

        assertThatThrownBy(() -> driver.run(CorpusFixtures.twoChapterBook(), NodePath.parse("book/chapterB"),
                settings(0)))
                .isInstanceOf(SessionLockedException.class)
                .hasMessageContaining("'book'");
        assertThat(calls).isEmpty();
        assertThat(store.load("book/chapterB")).isEmpty();
    }

    @Test
    void resumedRunsRecordTheSameBatchPositionAsAnUninterruptedRun() {
        InMemoryCheckpointStore uninterruptedStore = new InMemoryCheckpointStore();
        new TranslationSessionDriver(scripted, new TextSanitizer(), new MergeEngine(), uninterruptedStore,
                CorpusSaver.discarding()).run(CorpusFixtures.twoChapterBook(), settings(7));
        SessionCheckpoint expected = uninterruptedStore.load("book").orElseThrow();

        CorpusTree tree = CorpusFixtures.twoChapterBook();
        driver(scripted, CorpusSaver.discarding()).run(tree, settings(4));
        driver(scripted, CorpusSaver.discarding()).run(tree, settings(3));
        SessionCheckpoint resumed = store.load("book").orElseThrow();

        assertThat(expected.completedUnits()).isEqualTo(7);
        assertThat(expected.lastCompletedBatchIndex()).isEqualTo(1);
        assertThat(resumed.lastCompleted()).isEqualTo(expected.lastCompleted());
        assertThat(resumed.completedUnits()).isEqualTo(7);
        assertThat(resumed.lastCompletedBatchIndex()).isEqualTo(1);
        assertThat(resumed.batchSize()).isEqualTo(5);
    }

    @Test
    void resumesAfterTheStoredCheckpointLocation() {
        SessionCheckpoint seeded = store.acquire("book", "earlier-run");
        store.save(seeded.withProgress("chapterA/section5", 8, 5, seeded.timestamp())
                .released(SessionState.PAUSED_QUOTA, seeded.timestamp()), "earlier-run");
        CorpusTree tree = CorpusFixtures.twoChapterBook();

        SessionReport report = driver(scripted, CorpusSaver.discarding()).run(tree, settings(0));

        assertThat(report.finalState()).isEqualTo(SessionState.COMPLETE);
        assertThat(report.skippedByCheckpoint()).isEqualTo(8);
        assertThat(report.unitsProcessed()).isEqualTo(5);
        assertThat(calls.get(0)).isEqualTo("Pāḷi paragraph A6|english");
        assertThat(calls).noneMatch(call -> call.startsWith("Pāḷi paragraph A5"));
        assertThat(tree.slot(SlotPath.parse("book/chapterA/section5#body")).orElseThrow()
                .isMissing(Language.ENGLISH)).isTrue();
        assertThat(store.load("book").orElseThrow().completedUnits()).isEqualTo(13);
    }

    @Test
    void unitFlaggedBeforeAPauseIsNotRetriedOnResume() {
        CorpusTree tree = CorpusFixtures.twoChapterBook();
        Translator flaggingThenOutOfQuota = (source, target) -> {
            if (source.equals("Pāḷi paragraph A4")) {
                throw new QuotaExceededException("quota", Duration.ofSeconds(30), null);
            }
            if (source.equals("Pāḷi paragraph A2") && target == Language.ENGLISH) {
                return "Here is the English translation:";
            }
            return scripted.translate(source, target);
        };

        SessionReport paused = driver(flaggingThenOutOfQuota, CorpusSaver.discarding()).run(tree, settings(0));
        calls.clear();
        SessionReport resumed = driver(scripted, CorpusSaver.discarding()).run(tree, settings(0));

        assertThat(paused.finalState()).isEqualTo(SessionState.PAUSED_QUOTA);
        assertThat(paused.reviewItems()).extracting(ReviewItem::reason)
                .containsExactly(ValidationErrorKind.EMPTY_TRANSLATION.name());
        assertThat(paused.lastCompletedLocation()).contains("book/chapterA/section3#body");
        assertThat(resumed.finalState()).isEqualTo(SessionState.COMPLETE);
        assertThat(resumed.skippedByCheckpoint()).isEqualTo(1);
        assertThat(calls).doesNotContain("Pāḷi paragraph A2|english");
        assertThat(calls.get(0)).isEqualTo("Pāḷi paragraph A4|english");
        assertThat(tree.slot(SlotPath.parse("book/chapterA/section2#body")).orElseThrow()
                .isMissing(Language.ENGLISH)).isTrue();
        assertThat(store.load("book").orElseThrow().completedUnits()).isEqualTo(13);
    }

    @Test
    void scopedSessionsKeepSeparateCheckpoints() {
        CorpusTree tree = CorpusFixtures.twoChapterBook();

        SessionReport chapterB = driver(scripted, CorpusSaver.discarding())
                .run(tree, NodePath.parse("book/chapterB"), settings(0));

        assertThat(chapterB.scope()).isEqualTo("book/chapterB");
        assertThat(chapterB.unitsProcessed()).isEqualTo(4);
        assertThat(store.load("book/chapterB")).isPresent();
        assertThat(store.load("book")).isEmpty();
        assertThat(tree.slot(SlotPath.parse("book/chapterA/section5#vagga")).orElseThrow()
                .translation(Language.ENGLISH)).isEmpty();
    }

    private TranslationSessionDriver driver(Translator translator, CorpusSaver saver) {
        return new TranslationSessionDriver(translator, new TextSanitizer(), new MergeEngine(), store, saver);
    }

    private static SessionSettings settings(int limit) {
        return new SessionSettings(BOTH, 5, limit, Optional.empty(), false, "alpha");
    }

    private static Map<String, String> translations(CorpusTree tree) {
        Map<String, String> values = new LinkedHashMap<>();
        for (SlotEntry entry : tree.slots()) {
            for (Language language : Language.values()) {
                values.put(entry.path() + "|" + language.key(), entry.slot().translation(language).orElse(null));
            }
        }
        return values;
    }
}
