package io.b2mash.b2b.digestengine.notification.template;

import java.util.List;
import java.util.Objects;

/**
 * A reusable subject/body pair. The variable list is derived from the patterns and cannot be set
 * independently. Instances are immutable; edits produce a new instance with the same identity.
 */
public final class EmailTemplate {

  private final String id;
  private final String name;
  private final String subject;
  private final String body;
  private final List<String> variables;
  private final TemplateCategory category;
  private final boolean isDefault;

  public EmailTemplate(
      String id,
      String name,
      String subject,
      String body,
      TemplateCategory category,
      boolean isDefault) {
    this.id = Objects.requireNonNull(id, "id");
    this.name = Objects.requireNonNull(name, "name");
    this.subject = Objects.requireNonNull(subject, "subject");
    this.body = Objects.requireNonNull(body, "body");
    this.category = Objects.requireNonNull(category, "category");
    this.isDefault = isDefault;
    this.variables = TemplateRenderer.extractVariables(subject, body);
  }

  EmailTemplate withContent(String name, String subject, String body, TemplateCategory category) {
    return new EmailTemplate(id, name, subject, body, category, isDefault);
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getSubject() {
    return subject;
  }

  public String getBody() {
    return body;
  }

  public List<String> getVariables() {
    return variables;
  }

  public TemplateCategory getCategory() {
    return category;
  }

  public boolean isDefault() {
    return isDefault;
  }
}
