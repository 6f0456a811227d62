package io.tern.core.template;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class JinjaTemplateEngineTest
{
    @Rule
    public final ExpectedException exception = ExpectedException.none();

    private final TemplateEngine engine = new JinjaTemplateEngine();

    @Test
    public void rendersVariablesAndLoops()
        throws Exception
    {
        TemplateContext context = TemplateContext.of(ImmutableMap.of(
                    "table", "people",
                    "columns", ImmutableList.of("a", "b")));
        String sql = engine.render("t", "create table {{ table }}({% for c in columns %}{{ c }} int{% if not loop.last %}, {% endif %}{% endfor %});", context);
        assertThat(sql, is("create table people(a int, b int);"));
    }

    @Test
    public void undefinedVariableFails()
        throws Exception
    {
        exception.expect(TemplateRenderException.class);
        exception.expectMessage("001_a.sql up: ");
        engine.render("001_a.sql up", "select {{ nope }};", TemplateContext.of(ImmutableMap.of()));
    }

    @Test
    public void envReadsGivenEnvironment()
        throws Exception
    {
        TemplateContext context = TemplateContext.of(ImmutableMap.of())
            .withEnv(ImmutableMap.of("APP_USER", "app"));
        assertThat(engine.render("t", "grant select on t1 to {{ env(\"APP_USER\") }};", context),
                is("grant select on t1 to app;"));
        assertThat(engine.render("t", "[{{ env(\"NOT_SET\") }}]", context), is("[]"));
    }

    @Test
    public void includeSeesVariables()
        throws Exception
    {
        TemplateContext context = TemplateContext.of(ImmutableMap.of("n", 3))
            .withPartials(ImmutableMap.of("shared/n.sql", "select {{ n }};"));
        assertThat(engine.render("t", "{% include \"shared/n.sql\" %}", context), is("select 3;"));
    }

    @Test
    public void installSnapshotUsesResolver()
        throws Exception
    {
        TemplateContext context = TemplateContext.of(ImmutableMap.of())
            .withSnapshotResolver(name -> "-- snapshot " + name);
        assertThat(engine.render("t", "{{ install_snapshot(\"004\") }}", context), is("-- snapshot 004"));
    }

    @Test
    public void installSnapshotIsUnavailableWithoutResolver()
        throws Exception
    {
        exception.expect(TemplateRenderException.class);
        engine.render("t", "{{ install_snapshot(\"004\") }}", TemplateContext.of(ImmutableMap.of()));
    }

    @Test
    public void syntaxErrorFails()
        throws Exception
    {
        exception.expect(TemplateRenderException.class);
        engine.render("t", "{% if %}", TemplateContext.of(ImmutableMap.of()));
    }
}
