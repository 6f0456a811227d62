package io.tern.core.migrate;

import io.tern.core.TernException;

/**
 * The version table is missing, empty, or can't be read or written.
 */
public class VersionTableException extends TernException
{
    public VersionTableException(String message)
    {
        super(message);
    }

    public VersionTableException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
