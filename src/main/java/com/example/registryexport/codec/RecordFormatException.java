package com.example.registryexport.codec;

/**
 * A single record could not be decoded. Reported per record; whether the
 * surrounding batch skips the record or stops is up to the caller.
 */
public class RecordFormatException extends RuntimeException {

    public enum Reason {
        LENGTH_MISMATCH,
        INVALID_FIELD
    }

    private final Reason reason;

    public RecordFormatException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RecordFormatException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    static RecordFormatException lengthMismatch(int expected, int actual) {
        return new RecordFormatException(Reason.LENGTH_MISMATCH,
                "record length " + actual + " does not match layout width " + expected);
    }
}
