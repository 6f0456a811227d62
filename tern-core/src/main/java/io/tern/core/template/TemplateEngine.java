package io.tern.core.template;

/**
 * Renders migration bodies and code packages.
 */
public interface TemplateEngine
{
    /**
     * @param name identifies the template in error messages
     */
    String render(String name, String template, TemplateContext context)
        throws TemplateRenderException;
}
