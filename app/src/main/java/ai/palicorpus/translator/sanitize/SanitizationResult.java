package ai.palicorpus.translator.sanitize;

import java.util.Optional;

/**
 * Either the normalised text or the reason it was refused.
 */
public final class SanitizationResult {

    private final String text;
    private final ValidationError error;

    private SanitizationResult(String text, ValidationError error) {
        this.text = text;
        this.error = error;
    }

    public static SanitizationResult accepted(String text) {
        if (text == null) {
            throw new IllegalArgumentException("accepted text must not be null");
        }
        return new SanitizationResult(text, null);
    }

    public static SanitizationResult rejected(ValidationErrorKind kind, String message) {
        return new SanitizationResult(null, new ValidationError(kind, message));
    }

    public boolean isAccepted() {
        return error == null;
    }

    public Optional<String> text() {
        return Optional.ofNullable(text);
    }

    public Optional<ValidationError> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isAccepted() ? "Accepted[" + text.length() + " chars]" : "Rejected[" + error.kind() + ": " + error.message() + "]";
    }
}
