package io.tern.core.migrate;

import com.google.common.base.Optional;
import org.jdbi.v3.core.Handle;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Migration step defined by code that receives the live {@link Handle}.
 *
 * The handle runs in a transaction started by the {@link Migrator} unless
 * {@code disableTx} is set.
 */
public class FunctionMigration
        implements MigrationStep
{
    private final int sequence;
    private final String name;
    private final MigrationFunction up;
    private final Optional<MigrationFunction> down;
    private final boolean disableTx;

    public FunctionMigration(int sequence, String name,
            MigrationFunction up, Optional<MigrationFunction> down, boolean disableTx)
    {
        checkArgument(sequence > 0, "sequence must be positive: %s", sequence);
        this.sequence = sequence;
        this.name = checkNotNull(name, "name");
        this.up = checkNotNull(up, "up");
        this.down = checkNotNull(down, "down");
        this.disableTx = disableTx;
    }

    public static FunctionMigration of(int sequence, String name, MigrationFunction up, MigrationFunction down)
    {
        return new FunctionMigration(sequence, name, up, Optional.of(down), false);
    }

    public static FunctionMigration irreversible(int sequence, String name, MigrationFunction up)
    {
        return new FunctionMigration(sequence, name, up, Optional.absent(), false);
    }

    @Override
    public int getSequence()
    {
        return sequence;
    }

    @Override
    public String getName()
    {
        return name;
    }

    @Override
    public boolean isDisableTx(Direction direction)
    {
        return disableTx;
    }

    @Override
    public boolean isIrreversible()
    {
        return !down.isPresent();
    }

    @Override
    public String getSql(Direction direction)
    {
        return "";
    }

    @Override
    public void up(Handle handle, MigrationContext context)
        throws MigrationExecutionException, MigrationCancelledException
    {
        call(up, handle, context);
    }

    @Override
    public void down(Handle handle, MigrationContext context)
        throws MigrationExecutionException, MigrationCancelledException, IrreversibleMigrationException
    {
        if (!down.isPresent()) {
            throw new IrreversibleMigrationException(sequence, name);
        }
        call(down.get(), handle, context);
    }

    private void call(MigrationFunction function, Handle handle, MigrationContext context)
        throws MigrationExecutionException, MigrationCancelledException
    {
        MigrationContext.checkCancelled();
        try {
            function.migrate(handle, context);
        }
        catch (MigrationExecutionException | MigrationCancelledException ex) {
            throw ex;
        }
        catch (InterruptedException ex) {
            throw new MigrationCancelledException("Migration cancelled", ex);
        }
        catch (Exception ex) {
            throw new MigrationExecutionException(name, "", ex);
        }
    }

    @Override
    public String toString()
    {
        return "FunctionMigration{" + sequence + " - " + name + "}";
    }
}
