package io.storyloom.core.json;

import java.io.Serial;

/// Thrown when text that must be JSON cannot be parsed.
public class JsonFormatException extends Exception {
    @Serial private static final long serialVersionUID = 2902815637790144461L;

    public JsonFormatException(String message) {
        super(message);
    }

    public JsonFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
