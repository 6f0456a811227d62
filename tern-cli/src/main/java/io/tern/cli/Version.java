package io.tern.cli;

import io.tern.core.TernVersion;

import static io.tern.cli.SystemExitException.systemExit;

public class Version
    extends Command
{
    @Override
    public void main()
        throws SystemExitException
    {
        checkArgumentCount(0, 0);
        out.println(format(version));
    }

    static String format(TernVersion version)
    {
        return "tern v" + version;
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " version");
        err.println("  Options:");
        showCommonOptions();
        return systemExit(error);
    }
}
