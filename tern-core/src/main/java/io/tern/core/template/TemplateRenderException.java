package io.tern.core.template;

import io.tern.core.TernException;

public class TemplateRenderException extends TernException
{
    private final String templateName;

    public TemplateRenderException(String templateName, String message)
    {
        super(templateName + ": " + message);
        this.templateName = templateName;
    }

    public TemplateRenderException(String templateName, String message, Throwable cause)
    {
        super(templateName + ": " + message, cause);
        this.templateName = templateName;
    }

    public String getTemplateName()
    {
        return templateName;
    }
}
