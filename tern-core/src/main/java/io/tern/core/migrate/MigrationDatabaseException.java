package io.tern.core.migrate;

import io.tern.core.TernException;

/**
 * Connection level failure that is not caused by a migration statement, such as
 * a lost connection while starting a transaction.
 */
public class MigrationDatabaseException extends TernException
{
    public MigrationDatabaseException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
