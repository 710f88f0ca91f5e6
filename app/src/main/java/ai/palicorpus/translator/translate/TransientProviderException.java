package ai.palicorpus.translator.translate;

/**
 * Network, timeout or overload failure worth retrying.
 */
public class TransientProviderException extends TranslationException {

    public TransientProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
