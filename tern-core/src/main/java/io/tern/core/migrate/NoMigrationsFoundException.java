package io.tern.core.migrate;

public class NoMigrationsFoundException extends MigrationDiscoveryException
{
    public NoMigrationsFoundException()
    {
        super("migrations not found");
    }
}
