package io.tern.core.code;

import io.tern.core.TernException;
import io.tern.core.migrate.AdvisoryLock;
import io.tern.core.migrate.MigrationContext;
import io.tern.core.migrate.MigrationDatabaseException;
import io.tern.core.migrate.MigrationExecutionException;
import io.tern.core.sqlsplit.SqlSplitter;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Installs a {@link CodePackage} in one transaction while holding the
 * migration lock.
 */
public class CodePackageInstaller
{
    private static final Logger logger = LoggerFactory.getLogger(CodePackageInstaller.class);

    private CodePackageInstaller()
    { }

    public static void install(Handle handle, CodePackage codePackage, Map<String, ?> data)
        throws TernException
    {
        String sql = codePackage.eval(data);
        execute(handle, sql);
    }

    /**
     * Runs {@code sql} in a transaction under the migration lock.
     */
    public static void execute(Handle handle, String sql)
        throws TernException
    {
        MigrationContext context = MigrationContext.of(handle);
        try (AdvisoryLock lock = AdvisoryLock.acquire(handle, context)) {
            begin(handle);
            try {
                for (String statement : SqlSplitter.split(sql)) {
                    context.execute(handle, CodePackage.INSTALL_FILE, statement);
                }
                handle.commit();
            }
            catch (JdbiException ex) {
                MigrationExecutionException failure = new MigrationExecutionException(CodePackage.INSTALL_FILE, "commit", ex);
                rollback(handle, failure);
                throw failure;
            }
            catch (TernException | RuntimeException ex) {
                rollback(handle, ex);
                throw ex;
            }
        }
        logger.info("Installed code package");
    }

    private static void begin(Handle handle)
        throws MigrationDatabaseException
    {
        try {
            handle.begin();
        }
        catch (JdbiException ex) {
            throw new MigrationDatabaseException("Unable to begin transaction", ex);
        }
    }

    private static void rollback(Handle handle, Throwable primary)
    {
        try {
            if (handle.isInTransaction()) {
                handle.rollback();
            }
        }
        catch (JdbiException ex) {
            primary.addSuppressed(ex);
        }
    }
}
