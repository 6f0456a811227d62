package io.tern.cli;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.google.common.base.Joiner;
import com.google.inject.Inject;
import io.tern.core.TernVersion;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public abstract class Command
{
    @Inject @Environment protected Map<String, String> env;
    @Inject protected TernVersion version;
    @Inject @ProgramName protected String programName;
    @Inject @StdIn protected InputStream in;
    @Inject @StdOut protected PrintStream out;
    @Inject @StdErr protected PrintStream err;

    @Parameter()
    protected List<String> args = new ArrayList<>();

    @Parameter(names = {"-c", "--config"})
    protected List<String> configPaths = new ArrayList<>();

    @Parameter(names = {"-L", "--log"})
    protected String logPath = "-";

    @Parameter(names = {"-l", "--log-level"})
    protected String logLevel = "warn";

    @DynamicParameter(names = "-X")
    protected Map<String, String> systemProperties = new HashMap<>();

    @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
    protected boolean help;

    public abstract void main() throws Exception;

    public abstract SystemExitException usage(String error);

    /**
     * Unknown options end up in {@code args} too, so they are reported here.
     */
    protected void checkArgumentCount(int min, int max)
        throws SystemExitException
    {
        if (args.size() > max) {
            throw usage("Unexpected arguments: " + Joiner.on(' ').join(args.subList(max, args.size())));
        }
        if (args.size() < min) {
            throw usage("Missing arguments");
        }
    }

    protected void showCommonOptions()
    {
        Main.showCommonOptions(err);
    }
}
