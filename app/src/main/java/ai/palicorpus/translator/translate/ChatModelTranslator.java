package ai.palicorpus.translator.translate;

import ai.palicorpus.translator.corpus.Language;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.BiPredicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translator backed by a LangChain4j {@link ChatModel} implementation.
 *
 * <p>Provider failures are classified into quota, transient, unavailable and rejected requests.
 */
public class ChatModelTranslator implements Translator {

    private static final Pattern RETRY_DELAY_PATTERN =
            Pattern.compile("(?:retry in |retryDelay\"?:\\s*\")([0-9]+(?:\\.[0-9]+)?)s", Pattern.CASE_INSENSITIVE);

    private static final Pattern SERVER_ERROR = Pattern.compile("\\b50[0-4]\\b");
    private static final Pattern RATE_LIMITED = Pattern.compile("\\b429\\b");
    private static final Pattern AUTH_ERROR = Pattern.compile("\\b40[13]\\b");

    private final ChatModel model;
    private final String providerName;
    private final String modelName;

    public ChatModelTranslator(ChatModel model, String providerName, String modelName) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
    }

    @Override
    public String translate(String sourceText, Language target) {
        if (sourceText == null || sourceText.isBlank()) {
            return "";
        }
        try {
            String response = model.chat(buildPrompt(sourceText, target));
            return response == null ? "" : response;
        } catch (RuntimeException ex) {
            throw classify(ex);
        }
    }

    String buildPrompt(String sourceText, Language target) {
        String joinerRule = target.usesJoiner()
                ? "- Keep conjunct letters intact; write the zero-width joiner (U+200D) as the character itself, never as a placeholder such as <ZWJ>.\n"
                : "";
        return """
Translate the Pali text below from the Theravada Tipitaka into %s.
Rules:
- Output only the %s translation. No preamble, notes, transliteration or page numbers.
- Keep Pali proper names and doctrinal terms the way established %s translations render them.
- Do not add numbering that is not in the source.
- Keep the length proportional to the source; a short heading stays a short heading.
%s
<pali>
%s
</pali>""".formatted(target.displayName(), target.displayName(), target.displayName(), joinerRule, sourceText);
    }

    TranslationException classify(RuntimeException failure) {
        if (anyCause(failure, ChatModelTranslator::isQuotaSignal)) {
            return new QuotaExceededException("%s quota exhausted for model '%s'".formatted(providerName, modelName),
                    extractRetryAfter(failure), failure);
        }
        if (anyCause(failure, ChatModelTranslator::isUnavailableSignal)) {
            return new ProviderUnavailableException("%s model '%s' is not available.".formatted(providerName, modelName),
                    failure);
        }
        if (anyCause(failure, ChatModelTranslator::isTransientSignal)) {
            return new TransientProviderException("%s request failed transiently".formatted(providerName), failure);
        }
        return new TranslationException("%s rejected the translation request".formatted(providerName), failure);
    }

    private static boolean isQuotaSignal(Throwable cause, String message) {
        return cause instanceof RateLimitException || RATE_LIMITED.matcher(message).find()
                || message.contains("RESOURCE_EXHAUSTED") || message.toLowerCase(Locale.ROOT).contains("quota");
    }

    private static boolean isUnavailableSignal(Throwable cause, String message) {
        return cause instanceof ModelNotFoundException || AUTH_ERROR.matcher(message).find()
                || message.contains("UNAUTHENTICATED") || message.contains("PERMISSION_DENIED");
    }

    private static boolean isTransientSignal(Throwable cause, String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        return cause instanceof IOException || cause instanceof TimeoutException
                || lower.contains("timed out") || lower.contains("timeout") || lower.contains("overloaded")
                || message.contains("UNAVAILABLE") || SERVER_ERROR.matcher(message).find();
    }

    private static boolean anyCause(Throwable failure, BiPredicate<Throwable, String> signal) {
        Throwable cause = failure;
        while (cause != null) {
            if (signal.test(cause, cause.getMessage() == null ? "" : cause.getMessage())) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    static Duration extractRetryAfter(Throwable failure) {
        Throwable cause = failure;
        while (cause != null) {
            if (cause.getMessage() != null) {
                Matcher matcher = RETRY_DELAY_PATTERN.matcher(cause.getMessage());
                if (matcher.find()) {
                    double seconds = Double.parseDouble(matcher.group(1));
                    return Duration.ofMillis(Math.max(0, (long) (seconds * 1000)));
                }
            }
            cause = cause.getCause();
        }
        return null;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
