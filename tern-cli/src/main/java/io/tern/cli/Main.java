package io.tern.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.MissingCommandException;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.TypeLiteral;
import io.tern.core.TernVersion;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.Map;

import static io.tern.cli.SystemExitException.systemExit;
import static io.tern.core.TernVersion.buildVersion;

public class Main
{
    private static final String DEFAULT_PROGRAM_NAME = "tern";

    private final TernVersion version;
    private final Map<String, String> env;
    private final PrintStream out;
    private final PrintStream err;
    private final InputStream in;
    private final String programName;

    public Main(TernVersion version, Map<String, String> env, PrintStream out, PrintStream err, InputStream in)
    {
        this.version = version;
        this.env = env;
        this.out = out;
        this.err = err;
        this.in = in;
        this.programName = System.getProperty("io.tern.cli.programName", DEFAULT_PROGRAM_NAME);
    }

    public static class MainOptions
    {
        @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
        boolean help;
    }

    public static void main(String... args)
    {
        int code = new Main(buildVersion(), System.getenv(), System.out, System.err, System.in).cli(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    protected void addCommands(final JCommander jc, final Injector injector)
    {
        jc.addCommand("init", injector.getInstance(Init.class));
        jc.addCommand("new", injector.getInstance(New.class));
        jc.addCommand("migrate", injector.getInstance(Migrate.class));
        jc.addCommand("status", injector.getInstance(Status.class));
        jc.addCommand("code", injector.getInstance(Code.class));
        jc.addCommand("renumber", injector.getInstance(Renumber.class));
        jc.addCommand("gengen", injector.getInstance(Gengen.class));
        jc.addCommand("print-connstring", injector.getInstance(PrintConnString.class));
        jc.addCommand("version", injector.getInstance(Version.class));
    }

    public int cli(String... args)
    {
        for (String arg : args) {
            if ("--version".equals(arg)) {
                out.println(Version.format(version));
                return 0;
            }
        }
        if (args.length == 0) {
            usage(null);
            return 0;
        }

        boolean verbose = false;

        MainOptions mainOpts = new MainOptions();
        JCommander jc = new JCommander(mainOpts);
        jc.setProgramName(programName);

        Injector injector = Guice.createInjector(new AbstractModule()
        {
            @Override
            protected void configure()
            {
                bind(new TypeLiteral<Map<String, String>>() {}).annotatedWith(Environment.class).toInstance(env);
                bind(TernVersion.class).toInstance(version);
                bind(String.class).annotatedWith(ProgramName.class).toInstance(programName);
                bind(InputStream.class).annotatedWith(StdIn.class).toInstance(in);
                bind(PrintStream.class).annotatedWith(StdOut.class).toInstance(out);
                bind(PrintStream.class).annotatedWith(StdErr.class).toInstance(err);
            }
        });

        addCommands(jc, injector);

        // Disable @ expansion
        jc.setExpandAtSign(false);
        jc.getCommands().values().forEach(c -> c.setExpandAtSign(false));

        try {
            try {
                jc.parse(args);
            }
            catch (MissingCommandException ex) {
                throw usage("available commands are: " + jc.getCommands().keySet());
            }

            if (mainOpts.help) {
                throw usage(null);
            }

            Command command = getParsedCommand(jc);
            if (command == null) {
                throw usage(null);
            }

            verbose = processCommonOptions(command);

            command.main();
            return 0;
        }
        catch (ParameterException ex) {
            err.println("error: " + ex.getMessage());
            return 1;
        }
        catch (SystemExitException ex) {
            if (ex.getMessage() != null) {
                err.println("error: " + ex.getMessage());
            }
            return ex.getCode();
        }
        catch (Exception ex) {
            String message = ErrorPrinter.formatExceptionMessage(ex);
            if (message.trim().isEmpty()) {
                // prevent silent crash
                ex.printStackTrace(err);
            }
            else {
                ErrorPrinter.print(err, ex);
                if (verbose) {
                    ex.printStackTrace(err);
                }
            }
            return 1;
        }
    }

    private static Command getParsedCommand(JCommander jc)
    {
        String commandName = jc.getParsedCommand();
        if (commandName == null) {
            return null;
        }

        return (Command) jc.getCommands().get(commandName).getObjects().get(0);
    }

    private boolean processCommonOptions(Command command)
            throws SystemExitException
    {
        if (command.help) {
            throw command.usage(null);
        }

        boolean verbose;

        switch (command.logLevel) {
        case "error":
        case "warn":
        case "info":
            verbose = false;
            break;
        case "debug":
        case "trace":
            verbose = true;
            break;
        default:
            throw usage("Unknown log level '" + command.logLevel + "'");
        }

        configureLogging(command.logLevel, command.logPath);

        for (Map.Entry<String, String> pair : command.systemProperties.entrySet()) {
            System.setProperty(pair.getKey(), pair.getValue());
        }

        return verbose;
    }

    private static void configureLogging(String level, String logPath)
    {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();

        // logback uses system property to embed variables in XML file
        Level lv = Level.toLevel(level.toUpperCase(), Level.DEBUG);
        System.setProperty("tern.log.level", lv.toString());

        String name;
        if (logPath.equals("-")) {
            if (System.console() != null) {
                name = "/io/tern/cli/logback-color.xml";
            }
            else {
                name = "/io/tern/cli/logback-console.xml";
            }
        }
        else {
            System.setProperty("tern.log.path", logPath);
            name = "/io/tern/cli/logback-file.xml";
        }
        try {
            configurator.doConfigure(Main.class.getResource(name));
        }
        catch (JoranException ex) {
            throw new RuntimeException(ex);
        }
    }

    private SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " <command> [options...]");
        err.println("  Commands:");
        err.println("    init [dir]                         create a tern.conf and a sample migration");
        err.println("    new <name>                         create a new migration");
        err.println("    migrate                            migrate the database");
        err.println("    status                             show the migration status of the database");
        err.println("    code install <path>                install a code package into the database");
        err.println("    code compile <path>                print the SQL of a code package");
        err.println("    code snapshot <path>               snapshot a code package into a new migration");
        err.println("    renumber start                     record the migrations before a merge");
        err.println("    renumber finish                    renumber migrations added by a merge");
        err.println("    gengen                             generate a SQL script that prints pending migrations");
        err.println("    print-connstring                   print the connection string of the database");
        err.println("    version                            show the version");
        err.println("");
        err.println("  Options:");
        showCommonOptions(err);
        if (error == null) {
            err.println("Use `<command> --help` to see detailed usage of a command.");
            return systemExit(null);
        }
        else {
            return systemExit(error);
        }
    }

    public static void showCommonOptions(PrintStream err)
    {
        err.println("    -L, --log PATH                   output log messages to a file (default: -)");
        err.println("    -l, --log-level LEVEL            log level (error, warn, info, debug or trace. default: warn)");
        err.println("    -X KEY=VALUE                     set a system property");
        err.println("    --version                        show the version");
        err.println("");
    }
}
