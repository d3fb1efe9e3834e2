package io.b2mash.b2b.digestengine.notification.template;

public record EmailTemplateDraft(
    String name, String subject, String body, TemplateCategory category) {}
