package ai.palicorpus.translator.corpus.io;

import ai.palicorpus.translator.corpus.Language;
import ai.palicorpus.translator.corpus.TextSlot;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Ties a {@link TextSlot} to the JSON object and keys it was read from.
 */
record SlotBinding(Path document, ObjectNode container, Map<Language, String> translationKeys) {

    SlotBinding {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(container, "container");
        translationKeys = new EnumMap<>(translationKeys);
    }

    Map<Language, String> readTranslations() {
        Map<Language, String> values = new EnumMap<>(Language.class);
        translationKeys.forEach((language, key) -> {
            JsonNode value = container.get(key);
            if (value != null && value.isTextual()) {
                values.put(language, value.asText());
            }
        });
        return values;
    }

    /**
     * Copies non-missing translations from the slot into the JSON object.
     *
     * @return true when the JSON object changed
     */
    boolean apply(TextSlot slot) {
        boolean changed = false;
        for (Map.Entry<Language, String> entry : translationKeys.entrySet()) {
            String value = slot.translation(entry.getKey()).orElse(null);
            if (value == null) {
                continue;
            }
            JsonNode current = container.get(entry.getValue());
            if (current == null || !current.isTextual() || !current.asText().equals(value)) {
                container.put(entry.getValue(), value);
                changed = true;
            }
        }
        return changed;
    }
}
