package io.tern.core.migrate;

public class NoForwardSqlException extends MigrationDiscoveryException
{
    private final String migrationName;

    public NoForwardSqlException(String migrationName)
    {
        super("no sql in forward migration step: " + migrationName);
        this.migrationName = migrationName;
    }

    public String getMigrationName()
    {
        return migrationName;
    }
}
