package io.tern.core.migrate;

import io.tern.core.TernException;

/**
 * A migration set that can't be loaded. Raised before any database access.
 */
public class MigrationDiscoveryException extends TernException
{
    public MigrationDiscoveryException(String message)
    {
        super(message);
    }

    public MigrationDiscoveryException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
