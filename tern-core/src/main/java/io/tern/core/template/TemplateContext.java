package io.tern.core.template;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Everything a template can see: the data variables, shared partials that
 * can be included by path, environment variables and the snapshot resolver.
 *
 * The data map is referenced, not copied.
 */
public final class TemplateContext
{
    private final Map<String, ?> data;
    private final Map<String, String> partials;
    private final Map<String, String> env;
    private final Optional<SnapshotResolver> snapshotResolver;

    private TemplateContext(Map<String, ?> data, Map<String, String> partials,
            Map<String, String> env, Optional<SnapshotResolver> snapshotResolver)
    {
        this.data = checkNotNull(data, "data");
        this.partials = checkNotNull(partials, "partials");
        this.env = checkNotNull(env, "env");
        this.snapshotResolver = checkNotNull(snapshotResolver, "snapshotResolver");
    }

    public static TemplateContext of(Map<String, ?> data)
    {
        return new TemplateContext(data, ImmutableMap.of(), System.getenv(), Optional.absent());
    }

    public TemplateContext withPartials(Map<String, String> partials)
    {
        return new TemplateContext(data, ImmutableMap.copyOf(partials), env, snapshotResolver);
    }

    public TemplateContext withEnv(Map<String, String> env)
    {
        return new TemplateContext(data, partials, ImmutableMap.copyOf(env), snapshotResolver);
    }

    public TemplateContext withSnapshotResolver(SnapshotResolver resolver)
    {
        return new TemplateContext(data, partials, env, Optional.of(resolver));
    }

    public Map<String, ?> getData()
    {
        return data;
    }

    public Map<String, String> getPartials()
    {
        return partials;
    }

    public Map<String, String> getEnv()
    {
        return env;
    }

    public Optional<SnapshotResolver> getSnapshotResolver()
    {
        return snapshotResolver;
    }
}
