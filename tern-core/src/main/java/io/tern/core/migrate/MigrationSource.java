package io.tern.core.migrate;

import java.io.IOException;
import java.util.List;

/**
 * Read-only directory tree that migrations are loaded from.
 *
 * Paths are relative to the root of the source and use '/' as the separator.
 */
public interface MigrationSource
{
    /**
     * Entries directly under {@code dir}, sorted by name. {@code ""} is the root.
     */
    List<SourceEntry> list(String dir) throws IOException;

    String read(String path) throws IOException;

    /**
     * Paths of all regular files of the tree, depth first, sorted by name.
     */
    List<String> walk() throws IOException;

    /**
     * Source rooted at {@code dir} of this source.
     */
    MigrationSource sub(String dir) throws IOException;

    default boolean isFile(String path)
        throws IOException
    {
        int slash = path.lastIndexOf('/');
        String dir = slash < 0 ? "" : path.substring(0, slash);
        String name = path.substring(slash + 1);
        for (SourceEntry entry : list(dir)) {
            if (entry.getName().equals(name) && !entry.isDirectory()) {
                return true;
            }
        }
        return false;
    }
}
