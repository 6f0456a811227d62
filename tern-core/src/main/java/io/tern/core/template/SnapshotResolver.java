package io.tern.core.template;

/**
 * Renders the code package snapshot of the given name to SQL.
 */
@FunctionalInterface
public interface SnapshotResolver
{
    String resolve(String name) throws Exception;
}
