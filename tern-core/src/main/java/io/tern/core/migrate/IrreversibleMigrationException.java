package io.tern.core.migrate;

import io.tern.core.TernException;

public class IrreversibleMigrationException extends TernException
{
    private final int sequence;
    private final String migrationName;

    public IrreversibleMigrationException(int sequence, String migrationName)
    {
        super(String.format("Irreversible migration: %d - %s", sequence, migrationName));
        this.sequence = sequence;
        this.migrationName = migrationName;
    }

    public int getSequence()
    {
        return sequence;
    }

    public String getMigrationName()
    {
        return migrationName;
    }
}
