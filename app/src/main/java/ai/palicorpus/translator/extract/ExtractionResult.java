package ai.palicorpus.translator.extract;

import java.util.List;

/**
 * Ordered output of one extraction pass.
 *
 * @param units missing units in first-seen traversal order
 * @param scannedSlots slots visited
 * @param completeSlots visited slots already holding every required language
 */
public record ExtractionResult(List<TranslatableUnit> units, int scannedSlots, int completeSlots) {

    public ExtractionResult {
        units = List.copyOf(units);
    }

    public boolean isEmpty() {
        return units.isEmpty();
    }

    /**
     * Number of (unit, language) pairs still to translate.
     */
    public int pendingTranslations() {
        return units.stream().mapToInt(unit -> unit.missingLanguages().size()).sum();
    }
}
