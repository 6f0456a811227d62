package io.tern.core.template;

import com.google.common.base.Optional;
import com.hubspot.jinjava.interpret.InterpretException;
import com.hubspot.jinjava.interpret.JinjavaInterpreter;

import java.util.Map;

/**
 * Functions callable from templates rendered by {@link JinjaTemplateEngine}.
 */
public class TemplateFunctions
{
    static final String CONTEXT_KEY = "__tern_template_context";

    private TemplateFunctions()
    { }

    /**
     * Value of an environment variable, or an empty string if it is not set.
     */
    public static String env(String name)
    {
        Map<String, String> env = currentContext().getEnv();
        String value = env.get(name);
        return value == null ? "" : value;
    }

    /**
     * SQL of the code package snapshot stored at {@code snapshots/<name>}.
     */
    public static String install_snapshot(String name)
    {
        Optional<SnapshotResolver> resolver = currentContext().getSnapshotResolver();
        if (!resolver.isPresent()) {
            throw new InterpretException("install_snapshot is not available in this template");
        }
        try {
            return resolver.get().resolve(name);
        }
        catch (Exception ex) {
            throw new InterpretException("install_snapshot(\"" + name + "\") failed: " + ex.getMessage(), ex);
        }
    }

    private static TemplateContext currentContext()
    {
        JinjavaInterpreter interpreter = JinjavaInterpreter.getCurrent();
        if (interpreter == null) {
            throw new IllegalStateException("template function called outside of rendering");
        }
        Object context = interpreter.getContext().get(CONTEXT_KEY);
        if (!(context instanceof TemplateContext)) {
            throw new IllegalStateException("template context is not bound");
        }
        return (TemplateContext) context;
    }
}
