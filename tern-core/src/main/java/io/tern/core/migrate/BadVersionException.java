package io.tern.core.migrate;

import io.tern.core.TernException;

/**
 * Thrown when the requested or the recorded schema version lies outside
 * 0..N where N is the number of known migrations.
 */
public class BadVersionException extends TernException
{
    public BadVersionException(String message)
    {
        super(message);
    }
}
