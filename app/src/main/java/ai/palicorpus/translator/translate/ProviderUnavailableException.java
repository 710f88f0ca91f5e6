package ai.palicorpus.translator.translate;

/**
 * The provider cannot serve any request: unknown model or rejected credentials.
 */
public class ProviderUnavailableException extends TranslationException {

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
