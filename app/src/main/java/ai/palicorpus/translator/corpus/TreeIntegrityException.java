package ai.palicorpus.translator.corpus;

/**
 * Raised when the corpus structure is corrupt. Sessions halt on this error.
 */
public class TreeIntegrityException extends RuntimeException {

    public TreeIntegrityException(String message) {
        super(message);
    }

    public TreeIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
