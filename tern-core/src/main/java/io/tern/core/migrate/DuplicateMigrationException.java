package io.tern.core.migrate;

public class DuplicateMigrationException extends MigrationDiscoveryException
{
    private final int sequence;

    public DuplicateMigrationException(int sequence)
    {
        super("Duplicate migration " + sequence);
        this.sequence = sequence;
    }

    public int getSequence()
    {
        return sequence;
    }
}
