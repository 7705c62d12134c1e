package com.eainde.compliance.query;

import java.util.Collection;

/**
 * Thrown when a template name is not registered.
 */
public class UnknownTemplateException extends QueryException {

    private final String templateName;

    public UnknownTemplateException(String templateName, Collection<String> available) {
        super("No query template registered with name: " + templateName + ". Available: " + available);
        this.templateName = templateName;
    }

    public String getTemplateName() { return templateName; }
}
