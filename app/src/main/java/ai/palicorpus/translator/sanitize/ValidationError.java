package ai.palicorpus.translator.sanitize;

import java.util.Objects;

public record ValidationError(ValidationErrorKind kind, String message) {

    public ValidationError {
        Objects.requireNonNull(kind, "kind");
        message = message == null ? kind.name() : message;
    }
}
