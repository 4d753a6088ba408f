package com.nexuscontrol.policy;

public class TemplateNotFoundException extends RuntimeException {

    public TemplateNotFoundException(String name) {
        super("TEMPLATE_NOT_FOUND: Template '" + name + "' does not exist");
    }
}
