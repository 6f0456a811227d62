package io.tern.core.migrate;

import com.google.common.collect.ImmutableList;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * {@link MigrationSource} over a directory of any {@link java.nio.file.FileSystem},
 * including zip file systems for migrations packaged in a jar.
 */
public class PathMigrationSource
        implements MigrationSource
{
    private final Path root;

    public PathMigrationSource(Path root)
    {
        this.root = root;
    }

    public Path getRoot()
    {
        return root;
    }

    @Override
    public List<SourceEntry> list(String dir)
        throws IOException
    {
        Path path = resolve(dir);
        if (!Files.isDirectory(path)) {
            throw new FileNotFoundException("Not a directory: " + path);
        }
        try (Stream<Path> stream = Files.list(path)) {
            return stream
                .map(p -> SourceEntry.of(p.getFileName().toString(), Files.isDirectory(p)))
                .sorted(Comparator.comparing(SourceEntry::getName))
                .collect(Collectors.toList());
        }
    }

    @Override
    public String read(String path)
        throws IOException
    {
        return new String(Files.readAllBytes(resolve(path)), UTF_8);
    }

    @Override
    public List<String> walk()
        throws IOException
    {
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        walk("", builder);
        return builder.build();
    }

    private void walk(String dir, ImmutableList.Builder<String> builder)
        throws IOException
    {
        for (SourceEntry entry : list(dir)) {
            String path = dir.isEmpty() ? entry.getName() : dir + "/" + entry.getName();
            if (entry.isDirectory()) {
                walk(path, builder);
            }
            else {
                builder.add(path);
            }
        }
    }

    @Override
    public MigrationSource sub(String dir)
        throws IOException
    {
        Path path = resolve(dir);
        if (!Files.isDirectory(path)) {
            throw new FileNotFoundException("Not a directory: " + path);
        }
        return new PathMigrationSource(path);
    }

    private Path resolve(String path)
    {
        if (path.isEmpty()) {
            return root;
        }
        Path resolved = root;
        for (String name : path.split("/")) {
            if (!name.isEmpty()) {
                resolved = resolved.resolve(name);
            }
        }
        return resolved;
    }

    @Override
    public String toString()
    {
        return root.toString();
    }
}
