package ai.palicorpus.translator.batch;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One line of a batch exchange file. {@code targetFields} is keyed by language key
 * ({@code english}, {@code sinhala}); exported files carry empty strings to be filled in.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchEntry(String sourceText, Map<String, String> targetFields, int usageCount, String sampleContext) {

    public BatchEntry {
        targetFields = targetFields == null ? Map.of() : new LinkedHashMap<>(targetFields);
    }
}
