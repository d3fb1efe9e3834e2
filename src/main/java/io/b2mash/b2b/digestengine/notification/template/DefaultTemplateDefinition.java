package io.b2mash.b2b.digestengine.notification.template;

/** One entry of {@code classpath:email-templates/defaults.json}. */
public record DefaultTemplateDefinition(
    String id, String name, String subject, String body, String category) {}
