package ai.palicorpus.translator.translate;

/**
 * Runtime exception used to propagate translation failures. Thrown as-is it means the provider
 * rejected this particular request.
 */
public class TranslationException extends RuntimeException {

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
