package io.tern.core.migrate;

import com.google.common.collect.ImmutableMap;
import com.google.common.io.Resources;
import io.tern.core.template.TemplateContext;
import io.tern.core.template.TemplateEngine;
import io.tern.core.template.TemplateRenderException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Generates a SQL script that, run with psql against a database, prints the
 * migrations that the database still needs.
 *
 * Every migration of the generated output runs in a transaction, and it can
 * only migrate forward to the latest version.
 */
public class GengenScriptGenerator
{
    private final TemplateEngine templateEngine;
    private final String ternVersion;

    public GengenScriptGenerator(TemplateEngine templateEngine, String ternVersion)
    {
        this.templateEngine = templateEngine;
        this.ternVersion = ternVersion;
    }

    public String generate(String versionTable, List<SqlMigration> migrations)
        throws TemplateRenderException
    {
        Map<String, Object> data = ImmutableMap.of(
                "version", ternVersion,
                "version_table", versionTable,
                "migrations", migrations);
        return templateEngine.render("gengen", loadTemplate(), TemplateContext.of(data));
    }

    private static String loadTemplate()
    {
        try {
            return Resources.toString(Resources.getResource(GengenScriptGenerator.class, "gengen.sql"), UTF_8);
        }
        catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
