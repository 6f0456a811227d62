package io.tern.core.migrate;

import io.tern.core.TernException;

public class MigrationCancelledException extends TernException
{
    public MigrationCancelledException(String message)
    {
        super(message);
    }

    public MigrationCancelledException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
