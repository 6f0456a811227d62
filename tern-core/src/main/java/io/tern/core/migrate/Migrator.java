package io.tern.core.migrate;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.tern.core.TernException;
import io.tern.core.template.JinjaTemplateEngine;
import io.tern.core.template.TemplateEngine;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Moves the schema of a database between versions by applying migration
 * steps up or down, one step per transaction.
 *
 * A Migrator is bound to one {@link Handle} and must not be used from
 * multiple threads at the same time. Separate Migrators on separate
 * connections exclude each other with an {@link AdvisoryLock}.
 *
 * Steps are atomic on PostgreSQL only. H2 commits DDL statements
 * implicitly, so a failed step on H2 keeps the DDL it ran before the
 * failure while the version stays at the previous step.
 *
 * The migrating thread can be interrupted to cancel a migration. The
 * migration stops before the next statement or step, rolls back the step
 * in progress, and throws {@link MigrationCancelledException}.
 */
public class Migrator
{
    private static final Logger logger = LoggerFactory.getLogger(Migrator.class);

    private final Handle handle;
    private final MigratorConfig config;
    private final TemplateEngine templateEngine;
    private final MigrationContext context;
    private final VersionTable versionTable;
    private final List<MigrationStep> migrations = new ArrayList<>();
    private Optional<MigrationListener> listener = Optional.absent();

    Migrator(Handle handle, MigratorConfig config, TemplateEngine templateEngine, MigrationContext context)
    {
        this.handle = handle;
        this.config = config;
        this.templateEngine = templateEngine;
        this.context = context;
        this.versionTable = new VersionTable(handle, context, config.getVersionTable());
    }

    /**
     * Creates a Migrator and the version table if it doesn't exist yet.
     */
    public static Migrator create(Handle handle, MigratorConfig config)
        throws TernException
    {
        return create(handle, config, new JinjaTemplateEngine());
    }

    public static Migrator create(Handle handle, MigratorConfig config, TemplateEngine templateEngine)
        throws TernException
    {
        Migrator migrator = new Migrator(handle, config, templateEngine, MigrationContext.of(handle));
        migrator.versionTable.ensureExists();
        return migrator;
    }

    public MigratorConfig getConfig()
    {
        return config;
    }

    public void setListener(MigrationListener listener)
    {
        this.listener = Optional.fromNullable(listener);
    }

    public List<MigrationStep> getMigrations()
    {
        return ImmutableList.copyOf(migrations);
    }

    /**
     * Appends a SQL migration with the next sequence number. An empty
     * {@code downSql} makes it irreversible.
     */
    public void appendMigration(String name, String upSql, String downSql)
    {
        migrations.add(new SqlMigration(migrations.size() + 1, name, upSql, downSql));
    }

    public void appendMigration(MigrationStep step)
    {
        checkArgument(step.getSequence() == migrations.size() + 1,
                "migration %s must have sequence %s but has %s",
                step.getName(), migrations.size() + 1, step.getSequence());
        migrations.add(step);
    }

    /**
     * Loads the migrations of {@code source} rendered against {@code data}
     * and appends them.
     */
    public void loadMigrations(MigrationSource source, Map<String, ?> data)
        throws TernException
    {
        List<SqlMigration> loaded = new MigrationLoader(templateEngine).load(source, data);
        for (SqlMigration migration : loaded) {
            appendMigration(new SqlMigration(migrations.size() + 1,
                        migration.getName(), migration.getUpSql(), migration.getDownSql()));
        }
    }

    public int getCurrentVersion()
        throws VersionTableException
    {
        return versionTable.getCurrentVersion();
    }

    /**
     * Applies every migration that is not applied yet.
     */
    public void migrate()
        throws TernException
    {
        migrateTo(migrations.size());
    }

    public void migrateTo(int targetVersion)
        throws TernException
    {
        int n = migrations.size();
        if (targetVersion < 0 || targetVersion > n) {
            throw new BadVersionException(String.format(
                        "destination version %d is outside the valid versions of 0 to %d", targetVersion, n));
        }

        try (AdvisoryLock lock = AdvisoryLock.acquire(handle, context)) {
            int currentVersion = versionTable.getCurrentVersion();
            if (currentVersion < 0 || currentVersion > n) {
                throw new BadVersionException(String.format(
                            "current version %d is outside the valid versions of 0 to %d", currentVersion, n));
            }

            if (currentVersion == targetVersion) {
                logger.debug("Already at version {}", currentVersion);
                return;
            }

            Direction direction = currentVersion < targetVersion ? Direction.UP : Direction.DOWN;
            while (currentVersion != targetVersion) {
                MigrationContext.checkCancelled();

                MigrationStep step;
                int newVersion;
                if (direction == Direction.UP) {
                    step = migrations.get(currentVersion);
                    newVersion = step.getSequence();
                }
                else {
                    step = migrations.get(currentVersion - 1);
                    if (step.isIrreversible()) {
                        throw new IrreversibleMigrationException(step.getSequence(), step.getName());
                    }
                    newVersion = step.getSequence() - 1;
                }

                boolean useTx = !config.getDisableTx() && !step.isDisableTx(direction);
                applyStep(step, direction, useTx, newVersion);

                currentVersion += direction.getDelta();
            }
        }
    }

    private void applyStep(MigrationStep step, Direction direction, boolean useTx, int newVersion)
        throws TernException
    {
        MigrationContext stepContext = context.withTransactional(useTx);

        if (useTx) {
            begin();
        }
        try {
            if (listener.isPresent()) {
                listener.get().onStart(step.getSequence(), step.getName(), direction, step.getSql(direction));
            }
            logger.info("Migrating {} {} - {}{}", direction, step.getSequence(), step.getName(),
                    useTx ? "" : " (without transaction)");

            if (direction == Direction.UP) {
                step.up(handle, stepContext);
            }
            else {
                step.down(handle, stepContext);
            }

            // a migration may have changed session settings such as search_path
            resetSession();
            versionTable.setVersion(newVersion);

            if (useTx) {
                commit(step);
            }
        }
        catch (TernException | RuntimeException ex) {
            if (useTx) {
                rollback(ex);
                if (!context.isPostgres()) {
                    logger.warn("Migration {} failed on H2. DDL statements it ran are not rolled back", step.getName());
                }
            }
            throw ex;
        }

        logger.info("Migrated to version {}", newVersion);
    }

    private void resetSession()
        throws MigrationDatabaseException
    {
        if (!context.isPostgres()) {
            return;
        }
        try {
            handle.execute("reset all");
        }
        catch (JdbiException ex) {
            throw new MigrationDatabaseException("Unable to reset session", ex);
        }
    }

    private void begin()
        throws MigrationDatabaseException
    {
        try {
            handle.begin();
        }
        catch (JdbiException ex) {
            throw new MigrationDatabaseException("Unable to begin transaction", ex);
        }
    }

    private void commit(MigrationStep step)
        throws MigrationExecutionException
    {
        try {
            handle.commit();
        }
        catch (JdbiException ex) {
            throw new MigrationExecutionException(step.getName(), "commit", ex);
        }
    }

    private void rollback(Throwable primary)
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
