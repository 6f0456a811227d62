package io.tern.core.code;

import com.google.common.collect.ImmutableMap;
import io.tern.core.migrate.MigrationDiscoveryException;
import io.tern.core.migrate.MigrationSource;
import io.tern.core.template.JinjaTemplateEngine;
import io.tern.core.template.TemplateContext;
import io.tern.core.template.TemplateEngine;
import io.tern.core.template.TemplateRenderException;

import java.io.IOException;
import java.util.Map;

/**
 * A directory of SQL that is installed as a whole, without versions.
 *
 * {@code install.sql} is the entry point. Other {@code .sql} files of the
 * directory tree can be included from it by their relative path.
 */
public class CodePackage
{
    public static final String INSTALL_FILE = "install.sql";

    private final String installSql;
    private final Map<String, String> partials;
    private final TemplateEngine templateEngine;

    private CodePackage(String installSql, Map<String, String> partials, TemplateEngine templateEngine)
    {
        this.installSql = installSql;
        this.partials = partials;
        this.templateEngine = templateEngine;
    }

    public static CodePackage load(MigrationSource source)
        throws MigrationDiscoveryException
    {
        return load(source, new JinjaTemplateEngine());
    }

    public static CodePackage load(MigrationSource source, TemplateEngine templateEngine)
        throws MigrationDiscoveryException
    {
        try {
            if (!source.isFile(INSTALL_FILE)) {
                throw new MigrationDiscoveryException("install.sql not found");
            }

            String installSql = source.read(INSTALL_FILE);
            ImmutableMap.Builder<String, String> partials = ImmutableMap.builder();
            for (String path : source.walk()) {
                if (!path.equals(INSTALL_FILE) && path.endsWith(".sql")) {
                    partials.put(path, source.read(path));
                }
            }
            return new CodePackage(installSql, partials.build(), templateEngine);
        }
        catch (IOException ex) {
            throw new MigrationDiscoveryException("Unable to load code package " + source + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Renders the package to the SQL that installs it.
     */
    public String eval(Map<String, ?> data)
        throws TemplateRenderException
    {
        TemplateContext context = TemplateContext.of(data).withPartials(partials);
        return templateEngine.render(INSTALL_FILE, installSql, context);
    }

    public Map<String, String> getPartials()
    {
        return partials;
    }
}
