package io.tern.cli;

import com.google.common.io.ByteStreams;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static io.tern.cli.SystemExitException.systemExit;
import static java.nio.file.StandardOpenOption.CREATE_NEW;
import static java.nio.file.StandardOpenOption.WRITE;

public class Init
    extends Command
{
    static final String RESOURCE_PREFIX = "/io/tern/cli/init/";

    static final String CONFIG_FILE = "tern.conf";
    static final String SAMPLE_MIGRATION_FILE = "001_create_people.sql.example";

    @Override
    public void main()
        throws Exception
    {
        checkArgumentCount(0, 1);

        Path destDir;
        if (args.isEmpty()) {
            destDir = Paths.get(".");
        }
        else {
            destDir = Paths.get(args.get(0));
            Files.createDirectory(destDir);
        }

        init(destDir);
    }

    private void init(Path destDir)
        throws IOException
    {
        copyResource(CONFIG_FILE, destDir.resolve(CONFIG_FILE));
        copyResource(SAMPLE_MIGRATION_FILE, destDir.resolve(SAMPLE_MIGRATION_FILE));
    }

    // fails if the destination exists
    private void copyResource(String name, Path dest)
        throws IOException
    {
        out.println("  Creating " + dest);
        try (InputStream in = getClass().getResourceAsStream(RESOURCE_PREFIX + name)) {
            if (in == null) {
                throw new IllegalStateException("Resource does not exist: " + name);
            }
            try (OutputStream out = Files.newOutputStream(dest, CREATE_NEW, WRITE)) {
                ByteStreams.copy(in, out);
            }
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " init [dir] [options...]");
        err.println("  Creates tern.conf and a sample migration in dir (default: the current directory).");
        err.println("  dir is created and must not exist.");
        err.println("  Options:");
        showCommonOptions();
        err.println("  Example:");
        err.println("    $ " + programName + " init migrations");
        return systemExit(error);
    }
}
