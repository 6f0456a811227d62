package io.tern.core.migrate;

import io.tern.core.sqlsplit.SqlSplitter;
import org.jdbi.v3.core.Handle;

import java.util.List;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Migration step defined by SQL text.
 */
public class SqlMigration
        implements MigrationStep
{
    static final Pattern DISABLE_TX_PATTERN = Pattern.compile("^---- tern: disable-tx ----$", Pattern.MULTILINE);

    private final int sequence;
    private final String name;
    private final String upSql;
    private final String downSql;

    /**
     * @param downSql empty if the migration is irreversible
     */
    public SqlMigration(int sequence, String name, String upSql, String downSql)
    {
        checkArgument(sequence > 0, "sequence must be positive: %s", sequence);
        this.sequence = sequence;
        this.name = checkNotNull(name, "name");
        this.upSql = checkNotNull(upSql, "upSql");
        this.downSql = checkNotNull(downSql, "downSql");
        checkArgument(!upSql.isEmpty(), "must specify forward sql for migration %s", name);
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

    public String getUpSql()
    {
        return upSql;
    }

    public String getDownSql()
    {
        return downSql;
    }

    @Override
    public String getSql(Direction direction)
    {
        return direction == Direction.UP ? upSql : downSql;
    }

    @Override
    public boolean isDisableTx(Direction direction)
    {
        return DISABLE_TX_PATTERN.matcher(getSql(direction)).find();
    }

    @Override
    public boolean isIrreversible()
    {
        return downSql.isEmpty();
    }

    @Override
    public void up(Handle handle, MigrationContext context)
        throws MigrationExecutionException, MigrationCancelledException
    {
        run(handle, context, upSql);
    }

    @Override
    public void down(Handle handle, MigrationContext context)
        throws MigrationExecutionException, MigrationCancelledException, IrreversibleMigrationException
    {
        if (isIrreversible()) {
            throw new IrreversibleMigrationException(sequence, name);
        }
        run(handle, context, downSql);
    }

    private void run(Handle handle, MigrationContext context, String sql)
        throws MigrationExecutionException, MigrationCancelledException
    {
        for (String statement : statements(sql)) {
            context.execute(handle, name, statement);
        }
    }

    /**
     * Statements are sent one at a time, in a transaction or not, so that a
     * server error position is an offset into the failing statement.
     */
    static List<String> statements(String sql)
    {
        return SqlSplitter.split(DISABLE_TX_PATTERN.matcher(sql).replaceAll(""));
    }

    @Override
    public String toString()
    {
        return "SqlMigration{" + sequence + " - " + name + "}";
    }
}
