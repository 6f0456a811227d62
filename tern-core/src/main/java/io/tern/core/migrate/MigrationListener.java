package io.tern.core.migrate;

@FunctionalInterface
public interface MigrationListener
{
    /**
     * Called right before a step is applied. {@code sql} is empty for
     * migrations implemented in code.
     */
    void onStart(int sequence, String name, Direction direction, String sql);
}
