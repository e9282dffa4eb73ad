package basalt.error;

import javax.annotation.Nullable;

/**
 * Base class for all errors raised by basalt players and nodes.
 */
public class BasaltException extends RuntimeException {
    public BasaltException(@Nullable String message) {
        super(message);
    }

    public BasaltException(@Nullable String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
