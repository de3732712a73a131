package com.questrail.streaming.digitizer.error;

/**
 * A sub-object declared required by the schema is absent.
 */
public final class MissingRequiredFieldException extends DigitizerCodecException
{
    private final String field;

    public MissingRequiredFieldException(String field) {
        super("Required field '" + field + "' is absent");
        this.field = field;
    }

    public String field() {
        return field;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.MISSING_REQUIRED_FIELD;
    }
}
