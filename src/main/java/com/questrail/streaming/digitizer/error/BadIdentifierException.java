package com.questrail.streaming.digitizer.error;

/**
 * The buffer's 4-byte format identifier does not name the expected message
 * kind. Such a buffer is safe to ignore or reroute.
 */
public final class BadIdentifierException extends DigitizerCodecException
{
    private final String expected;
    private final String found;

    public BadIdentifierException(String expected, String found) {
        super("Expected format identifier \"" + expected + "\" but found \"" + found + "\"");
        this.expected = expected;
        this.found = found;
    }

    public String expected() {
        return expected;
    }

    public String found() {
        return found;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.BAD_IDENTIFIER;
    }
}
