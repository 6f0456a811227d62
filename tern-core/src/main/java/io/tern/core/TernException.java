package io.tern.core;

/**
 * Base class of the failures reported by tern.
 *
 * Every subclass is deterministic: running the same operation against the same
 * migrations and database state fails the same way.
 */
public class TernException extends Exception
{
    public TernException(String message)
    {
        super(message);
    }

    public TernException(Throwable cause)
    {
        super(cause);
    }

    public TernException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
