package io.tern.core.migrate;

import org.jdbi.v3.core.Handle;

/**
 * A database schema state transition. It performs the modifications needed
 * to bring the database schema up from its prior state to the new state, and
 * optionally back down again.
 */
public interface MigrationStep
{
    /**
     * Version of the schema after {@link #up} has been applied.
     */
    int getSequence();

    String getName();

    /**
     * True if the step can't run inside a transaction in the given direction,
     * for example {@code create index concurrently}.
     */
    boolean isDisableTx(Direction direction);

    boolean isIrreversible();

    /**
     * SQL text reported to {@link MigrationListener}. Empty for code steps.
     */
    String getSql(Direction direction);

    void up(Handle handle, MigrationContext context)
        throws MigrationExecutionException, MigrationCancelledException;

    void down(Handle handle, MigrationContext context)
        throws MigrationExecutionException, MigrationCancelledException, IrreversibleMigrationException;
}
