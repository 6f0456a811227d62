package io.tern.core.template;

import com.hubspot.jinjava.Jinjava;
import com.hubspot.jinjava.JinjavaConfig;
import com.hubspot.jinjava.interpret.InterpretException;
import com.hubspot.jinjava.interpret.RenderResult;
import com.hubspot.jinjava.interpret.TemplateError;
import com.hubspot.jinjava.lib.fn.ELFunctionDefinition;
import com.hubspot.jinjava.loader.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link TemplateEngine} backed by Jinjava.
 *
 * Partials are included with {@code {% include "path/to/file.sql" %}} and
 * see the same variables as the including template. Referencing an undefined
 * variable is an error.
 */
public class JinjaTemplateEngine
        implements TemplateEngine
{
    private static final Logger logger = LoggerFactory.getLogger(JinjaTemplateEngine.class);

    @Override
    public String render(String name, String template, TemplateContext context)
        throws TemplateRenderException
    {
        Jinjava jinjava = newJinjava(context);

        Map<String, Object> bindings = new HashMap<>(context.getData());
        bindings.put(TemplateFunctions.CONTEXT_KEY, context);

        RenderResult result;
        try {
            result = jinjava.renderForResult(template, bindings);
        }
        catch (InterpretException ex) {
            throw new TemplateRenderException(name, ex.getMessage(), ex);
        }

        List<TemplateError> fatal = result.getErrors().stream()
            .filter(error -> error.getSeverity() == TemplateError.ErrorType.FATAL)
            .collect(Collectors.toList());
        if (!fatal.isEmpty()) {
            String message = fatal.stream()
                .map(error -> String.format(Locale.ENGLISH, "line %d: %s", error.getLineno(), error.getMessage()))
                .collect(Collectors.joining("; "));
            throw new TemplateRenderException(name, message);
        }

        String rendered = result.getOutput();
        logger.debug("rendered {}:\n---\n{}\n---", name, rendered);
        return rendered;
    }

    private Jinjava newJinjava(TemplateContext context)
    {
        Jinjava jinjava = new Jinjava(
                JinjavaConfig.newBuilder()
                .withLocale(Locale.ENGLISH)
                .withCharset(StandardCharsets.UTF_8)
                .withFailOnUnknownTokens(true)
                .build());

        Map<String, String> partials = context.getPartials();
        jinjava.setResourceLocator((name, encoding, interpreter) -> {
            String partial = partials.get(name);
            if (partial == null) {
                throw new ResourceNotFoundException("Couldn't find shared template: " + name);
            }
            return partial;
        });

        jinjava.getGlobalContext().registerFunction(new ELFunctionDefinition("", "env",
                    TemplateFunctions.class, "env", String.class));
        jinjava.getGlobalContext().registerFunction(new ELFunctionDefinition("", "install_snapshot",
                    TemplateFunctions.class, "install_snapshot", String.class));

        return jinjava;
    }
}
