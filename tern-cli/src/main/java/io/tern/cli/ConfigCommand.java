package io.tern.cli;

import com.beust.jcommander.ParametersDelegate;
import io.tern.core.database.DataSourceProvider;
import io.tern.core.database.JdbiHelper;
import io.tern.core.template.JinjaTemplateEngine;
import io.tern.core.template.TemplateEngine;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import static io.tern.cli.SystemExitException.systemExit;

/**
 * A command that reads configuration files and may connect to the database.
 */
public abstract class ConfigCommand
        extends Command
{
    @ParametersDelegate
    protected ConnectionOptions connectionOptions = new ConnectionOptions();

    @ParametersDelegate
    protected MigrationsPathOption migrationsPathOption = new MigrationsPathOption();

    protected final TemplateEngine templateEngine = new JinjaTemplateEngine();

    protected interface HandleAction
    {
        void run(Handle handle) throws Exception;
    }

    protected Path migrationsPath()
    {
        return migrationsPathOption.resolve(env);
    }

    protected TernConfig loadConfig()
        throws Exception
    {
        ConfigLoader loader = new ConfigLoader(env, templateEngine);
        Properties props = loader.loadProperties(loader.resolveConfigPaths(configPaths, Paths.get("")));
        connectionOptions.applyTo(props);
        try {
            return ConfigLoader.toConfig(props);
        }
        catch (IllegalArgumentException ex) {
            throw systemExit("Error loading config: " + ex.getMessage());
        }
    }

    protected TernConfig loadValidConfig()
        throws Exception
    {
        TernConfig config = loadConfig();
        try {
            config.validate();
        }
        catch (IllegalArgumentException ex) {
            throw systemExit("Invalid config: " + ex.getMessage());
        }
        return config;
    }

    protected void withHandle(TernConfig config, HandleAction action)
        throws Exception
    {
        try (DataSourceProvider dsp = new DataSourceProvider(config.getDatabase())) {
            Jdbi jdbi = JdbiHelper.createJdbi(dsp.get(), config.getDatabase().getType());
            try (Handle handle = jdbi.open()) {
                action.run(handle);
            }
        }
    }

    protected void showConfigOptions()
    {
        err.println("    -c, --config PATH                configuration file (default: $TERN_CONFIG or ./tern.conf)");
        MigrationsPathOption.showOptions(err);
        ConnectionOptions.showOptions(err);
    }
}
