package io.tern.core.migrate;

import com.google.common.base.Optional;
import com.google.common.base.Throwables;
import io.tern.core.TernException;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;

import java.sql.SQLException;

/**
 * A statement of a migration (or code package) failed on the database.
 *
 * {@link #getSql()} is the exact statement that was sent. When the database
 * reported a character position in that statement, {@link #getErrorLine()}
 * locates it.
 */
public class MigrationExecutionException extends TernException
{
    private final String migrationName;
    private final String sql;

    public MigrationExecutionException(String migrationName, String sql, Throwable cause)
    {
        super(buildMessage(migrationName, cause), cause);
        this.migrationName = migrationName;
        this.sql = sql;
    }

    private static String buildMessage(String migrationName, Throwable cause)
    {
        if (migrationName.isEmpty()) {
            return cause.getMessage();
        }
        return migrationName + ": " + cause.getMessage();
    }

    public String getMigrationName()
    {
        return migrationName;
    }

    public String getSql()
    {
        return sql;
    }

    /**
     * SQLSTATE reported by the database, if the failure came from a statement.
     */
    public Optional<String> getSqlState()
    {
        for (Throwable t : Throwables.getCausalChain(getCause())) {
            if (t instanceof SQLException) {
                return Optional.fromNullable(((SQLException) t).getSQLState());
            }
        }
        return Optional.absent();
    }

    /**
     * 1-based character offset in {@link #getSql()}, or 0 if unknown.
     */
    public int getPosition()
    {
        ServerErrorMessage message = serverErrorMessage();
        if (message == null) {
            return 0;
        }
        return message.getPosition();
    }

    public Optional<String> getDetail()
    {
        ServerErrorMessage message = serverErrorMessage();
        if (message == null) {
            return Optional.absent();
        }
        return Optional.fromNullable(message.getDetail());
    }

    public Optional<ErrorLine> getErrorLine()
    {
        int position = getPosition();
        if (position <= 0 || position > sql.codePointCount(0, sql.length())) {
            return Optional.absent();
        }
        return Optional.of(ErrorLine.extract(sql, position));
    }

    private ServerErrorMessage serverErrorMessage()
    {
        for (Throwable t : Throwables.getCausalChain(getCause())) {
            if (t instanceof PSQLException) {
                return ((PSQLException) t).getServerErrorMessage();
            }
        }
        return null;
    }
}
