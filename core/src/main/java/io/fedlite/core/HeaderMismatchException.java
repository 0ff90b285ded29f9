package io.fedlite.core;

/**
 * A response header disagrees with the identities this client expects.
 * <p>
 * This is a configuration or logic defect, never a transient condition,
 * so nothing retries on it.
 */
public final class HeaderMismatchException extends IllegalStateException {

    /** Header fields in the order they are checked. */
    public enum Field {
        RECEIVER,
        SENDER,
        FEDERATION_UUID,
        COMMON_NAME
    }

    private final Field field;
    private final String expected;
    private final String actual;

    public HeaderMismatchException(Field field, String expected, String actual) {
        super("Header field %s mismatch: expected '%s' but got '%s'".formatted(field, expected, actual));
        this.field = field;
        this.expected = expected;
        this.actual = actual;
    }

    public Field field() {
        return field;
    }

    public String expected() {
        return expected;
    }

    public String actual() {
        return actual;
    }
}
