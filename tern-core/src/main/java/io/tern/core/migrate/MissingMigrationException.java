package io.tern.core.migrate;

public class MissingMigrationException extends MigrationDiscoveryException
{
    private final int sequence;

    public MissingMigrationException(int sequence)
    {
        super("Missing migration " + sequence);
        this.sequence = sequence;
    }

    public int getSequence()
    {
        return sequence;
    }
}
