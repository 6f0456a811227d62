package io.tern.core.migrate;

import org.immutables.value.Value;

@Value.Immutable
public interface SourceEntry
{
    String getName();

    boolean isDirectory();

    static SourceEntry of(String name, boolean directory)
    {
        return ImmutableSourceEntry.builder()
            .name(name)
            .isDirectory(directory)
            .build();
    }
}
