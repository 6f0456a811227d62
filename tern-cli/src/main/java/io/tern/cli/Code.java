package io.tern.cli;

import io.tern.core.code.CodePackage;
import io.tern.core.code.CodePackageInstaller;
import io.tern.core.migrate.MigrationDiscoveryException;
import io.tern.core.migrate.MigrationLoader;
import io.tern.core.migrate.PathMigrationSource;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Locale;

import static io.tern.cli.SystemExitException.systemExit;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardCopyOption.COPY_ATTRIBUTES;
import static java.nio.file.StandardOpenOption.CREATE_NEW;
import static java.nio.file.StandardOpenOption.WRITE;

public class Code
    extends ConfigCommand
{
    static final String SNAPSHOTS_DIR = "snapshots";

    @Override
    public void main()
        throws Exception
    {
        checkArgumentCount(2, 2);

        Path packagePath = Paths.get(args.get(1));
        switch (args.get(0)) {
        case "install":
            install(packagePath);
            break;
        case "compile":
            compile(packagePath);
            break;
        case "snapshot":
            snapshot(packagePath);
            break;
        default:
            throw usage("Unknown subcommand: " + args.get(0));
        }
    }

    private CodePackage loadPackage(Path packagePath)
        throws MigrationDiscoveryException
    {
        return CodePackage.load(new PathMigrationSource(packagePath), templateEngine);
    }

    private void install(Path packagePath)
        throws Exception
    {
        CodePackage codePackage = loadPackage(packagePath);
        TernConfig config = loadValidConfig();
        withHandle(config, handle -> CodePackageInstaller.install(handle, codePackage, config.getData()));
    }

    private void compile(Path packagePath)
        throws Exception
    {
        CodePackage codePackage = loadPackage(packagePath);
        TernConfig config = loadConfig();
        out.println(codePackage.eval(config.getData()));
    }

    private void snapshot(Path packagePath)
        throws Exception
    {
        loadPackage(packagePath);  // fails unless install.sql exists
        Path migration = snapshot(packagePath, migrationsPath());
        out.println("  Creating " + migration);
    }

    /**
     * Copies a code package to {@code snapshots/NNN} of the migrations and
     * writes migration NNN that installs the copy.
     */
    static Path snapshot(Path packagePath, Path migrationsPath)
        throws IOException, MigrationDiscoveryException
    {
        List<String> migrations = MigrationLoader.findMigrations(new PathMigrationSource(migrationsPath));
        String migrationId = String.format(Locale.ENGLISH, "%03d", migrations.size() + 1);

        copyDirectory(packagePath, migrationsPath.resolve(SNAPSHOTS_DIR).resolve(migrationId));

        Path packageName = packagePath.toAbsolutePath().normalize().getFileName();
        Path migration = migrationsPath.resolve(migrationId + "_install_" + packageName + ".sql");
        String text = "{{ install_snapshot(\"" + migrationId + "\") }}";
        Files.write(migration, text.getBytes(UTF_8), CREATE_NEW, WRITE);
        return migration;
    }

    private static void copyDirectory(Path src, Path dest)
        throws IOException
    {
        Files.walkFileTree(src, new SimpleFileVisitor<Path>()
        {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs)
                throws IOException
            {
                Files.createDirectories(dest.resolve(src.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                throws IOException
            {
                Files.copy(file, dest.resolve(src.relativize(file).toString()), COPY_ATTRIBUTES);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " code (install|compile|snapshot) <path> [options...]");
        err.println("  install    installs the code package at path into the database");
        err.println("  compile    prints the SQL that install would run");
        err.println("  snapshot   copies the code package into the migrations and adds a migration installing it");
        err.println("  Options:");
        showConfigOptions();
        showCommonOptions();
        err.println("  Example:");
        err.println("    $ " + programName + " code install functions");
        return systemExit(error);
    }
}
