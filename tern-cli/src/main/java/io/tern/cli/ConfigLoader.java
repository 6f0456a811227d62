package io.tern.cli;

import com.google.common.base.Optional;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.tern.core.database.DatabaseConfig;
import io.tern.core.database.ImmutableDatabaseConfig;
import io.tern.core.template.TemplateContext;
import io.tern.core.template.TemplateEngine;
import io.tern.core.template.TemplateRenderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Builds a {@link TernConfig} from configuration files.
 *
 * A configuration file is a properties file that is rendered as a template
 * first, so that it can read environment variables:
 *
 * <pre>
 * database.host = localhost
 * database.password = {{ env("PGPASSWORD") }}
 * data.prefix = foo
 * </pre>
 *
 * Files given later override earlier ones. Standard PostgreSQL environment
 * variables (PGHOST, PGPORT, PGDATABASE, PGUSER, PGPASSWORD, PGSSLMODE,
 * PGSSLROOTCERT) supply values that no file sets.
 */
public class ConfigLoader
{
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    static final String DEFAULT_CONFIG_FILE = "tern.conf";
    static final String CONFIG_ENV_NAME = "TERN_CONFIG";

    static final String TYPE = "database.type";
    static final String CONN_STRING = "database.conn_string";
    static final String HOST = "database.host";
    static final String PORT = "database.port";
    static final String USER = "database.user";
    static final String PASSWORD = "database.password";
    static final String DATABASE = "database.database";
    static final String SSLMODE = "database.sslmode";
    static final String SSLROOTCERT = "database.sslrootcert";
    static final String PATH = "database.path";
    static final String VERSION_TABLE = "database.version_table";
    static final String DATA_PREFIX = "data.";

    private static final Map<String, String> PG_ENV = ImmutableMap.<String, String>builder()
        .put("PGHOST", HOST)
        .put("PGPORT", PORT)
        .put("PGDATABASE", DATABASE)
        .put("PGUSER", USER)
        .put("PGPASSWORD", PASSWORD)
        .put("PGSSLMODE", SSLMODE)
        .put("PGSSLROOTCERT", SSLROOTCERT)
        .build();

    private final Map<String, String> env;
    private final TemplateEngine templateEngine;

    public ConfigLoader(Map<String, String> env, TemplateEngine templateEngine)
    {
        this.env = env;
        this.templateEngine = templateEngine;
    }

    /**
     * Configuration files to read: the ones given on the command line, or
     * {@code TERN_CONFIG}, or {@code tern.conf} of {@code workingDir} if it
     * exists.
     */
    public List<Path> resolveConfigPaths(List<String> cliPaths, Path workingDir)
    {
        if (!cliPaths.isEmpty()) {
            ImmutableList.Builder<Path> paths = ImmutableList.builder();
            for (String path : cliPaths) {
                paths.add(Paths.get(path));
            }
            return paths.build();
        }

        String fromEnv = env.get(CONFIG_ENV_NAME);
        if (!Strings.isNullOrEmpty(fromEnv)) {
            return ImmutableList.of(Paths.get(fromEnv));
        }

        Path defaultPath = workingDir.resolve(DEFAULT_CONFIG_FILE);
        if (Files.isRegularFile(defaultPath)) {
            return ImmutableList.of(defaultPath);
        }
        logger.debug("No configuration file given and {} does not exist", defaultPath);
        return ImmutableList.of();
    }

    public Properties loadProperties(List<Path> paths)
        throws IOException, TemplateRenderException
    {
        Properties props = new Properties();
        for (Map.Entry<String, String> pair : PG_ENV.entrySet()) {
            String value = env.get(pair.getKey());
            if (!Strings.isNullOrEmpty(value)) {
                props.setProperty(pair.getValue(), value);
            }
        }
        for (Path path : paths) {
            props.putAll(loadFile(path));
        }
        return props;
    }

    Properties loadFile(Path path)
        throws IOException, TemplateRenderException
    {
        String source = new String(Files.readAllBytes(path), UTF_8);
        String rendered = templateEngine.render(path.toString(), source,
                TemplateContext.of(ImmutableMap.of()).withEnv(env));
        Properties props = new Properties();
        props.load(new StringReader(rendered));
        logger.debug("Loaded configuration file {}", path);
        return props;
    }

    /**
     * Converts merged properties to a config.
     *
     * @throws IllegalArgumentException if a value is malformed
     */
    public static TernConfig toConfig(Properties props)
    {
        String type = props.getProperty(TYPE, DatabaseConfig.POSTGRESQL);

        ImmutableDatabaseConfig.Builder db = DatabaseConfig.builder()
            .type(type)
            .host(optional(props, HOST))
            .database(optional(props, DATABASE))
            .user(optional(props, USER))
            .password(optional(props, PASSWORD))
            .sslmode(optional(props, SSLMODE))
            .sslrootcert(optional(props, SSLROOTCERT))
            .connString(optional(props, CONN_STRING))
            .path(optional(props, PATH));

        Optional<String> port = optional(props, PORT);
        if (port.isPresent()) {
            db.port(parsePort(port.get()));
        }

        if (DatabaseConfig.isPostgres(type) && !props.containsKey(USER)) {
            // libpq connects as the OS user by default
            db.user(Optional.fromNullable(System.getProperty("user.name")));
        }

        ImmutableTernConfig.Builder config = TernConfig.builder()
            .database(db.build())
            .data(toMap(props, DATA_PREFIX));
        Optional<String> versionTable = optional(props, VERSION_TABLE);
        if (versionTable.isPresent()) {
            config.versionTable(versionTable.get());
        }
        return config.build();
    }

    private static int parsePort(String value)
    {
        int port;
        try {
            port = Integer.parseInt(value.trim());
        }
        catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid port: " + value, ex);
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + value);
        }
        return port;
    }

    private static Optional<String> optional(Properties props, String key)
    {
        String value = props.getProperty(key);
        if (Strings.isNullOrEmpty(value)) {
            return Optional.absent();
        }
        return Optional.of(value);
    }

    static Map<String, String> toMap(Properties props, String prefix)
    {
        Map<String, String> map = new HashMap<>();
        for (String key : props.stringPropertyNames()) {
            if (key.startsWith(prefix)) {
                map.put(key.substring(prefix.length()), props.getProperty(key));
            }
        }
        return map;
    }
}
