package ai.palicorpus.translator.sink;

/**
 * Runtime exception wrapping database failures of the sink.
 */
public class SinkException extends RuntimeException {

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
