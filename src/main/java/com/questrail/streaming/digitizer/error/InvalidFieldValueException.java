package com.questrail.streaming.digitizer.error;

/**
 * A fixed-width field decoded from the buffer holds a value outside its
 * declared range (for example an hour of 24 or a running flag of 7).
 */
public final class InvalidFieldValueException extends DigitizerCodecException
{
    private final String field;

    public InvalidFieldValueException(String field, String message, Throwable cause) {
        super("Invalid value for '" + field + "': " + message, cause);
        this.field = field;
    }

    public String field() {
        return field;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_FIELD_VALUE;
    }
}
