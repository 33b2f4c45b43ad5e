package com.shlawgathon.faceguard.backend.service;

import java.util.Map;

/**
 * {@code {key}} placeholder substitution for rule and contact message templates.
 */
final class MessageTemplates {

    private MessageTemplates() {
    }

    static String render(String template, Map<String, Object> values) {
        if (template == null) {
            return null;
        }
        String rendered = template;
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            String placeholder = "{" + entry.getKey() + "}";
            if (rendered.contains(placeholder)) {
                rendered = rendered.replace(placeholder, String.valueOf(entry.getValue()));
            }
        }
        return rendered;
    }
}
