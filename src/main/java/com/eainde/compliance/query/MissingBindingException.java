package com.eainde.compliance.query;

/**
 * Thrown when a template is run without one of its declared bindings.
 */
public class MissingBindingException extends QueryException {

    private final String templateName;
    private final String bindingName;

    public MissingBindingException(String templateName, String bindingName) {
        super("Template '" + templateName + "' requires binding '" + bindingName + "'");
        this.templateName = templateName;
        this.bindingName = bindingName;
    }

    public String getTemplateName() { return templateName; }
    public String getBindingName() { return bindingName; }
}
