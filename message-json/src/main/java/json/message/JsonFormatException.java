package json.message;

import java.util.Objects;

/// Thrown when a message cannot be formatted as JSON. The whole format call
/// is abandoned; no partial output is returned.
@SuppressWarnings("serial")
public final class JsonFormatException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /// The conditions under which formatting fails.
    public enum Error {
        /// A value's shape does not fit the kind its field declares, or a map key kind is not allowed.
        INVALID_SCHEMA_STATE("invalid schema state: %s"),

        /// A well-known type instance breaks that type's own invariants.
        MALFORMED_WELL_KNOWN_TYPE("malformed %s: %s"),

        /// A string holds an unpaired UTF-16 surrogate.
        MALFORMED_TEXT("malformed text: %s");

        private final String messageTemplate;

        Error(String messageTemplate) {
            this.messageTemplate = messageTemplate;
        }

        /// {@return the formatted message for this error}
        public String message(Object... args) {
            return String.format(messageTemplate, args);
        }
    }

    private final Error error;

    JsonFormatException(Error error, Object... args) {
        super(error.message(args));
        this.error = Objects.requireNonNull(error, "error must not be null");
    }

    /// {@return the condition that stopped formatting}
    public Error error() {
        return error;
    }
}
