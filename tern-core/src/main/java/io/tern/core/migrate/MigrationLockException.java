package io.tern.core.migrate;

import io.tern.core.TernException;

public class MigrationLockException extends TernException
{
    public MigrationLockException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
