package io.b2mash.b2b.digestengine.notification.template;

import io.b2mash.b2b.digestengine.exception.InvalidConfigurationException;
import io.b2mash.b2b.digestengine.exception.InvalidStateException;
import io.b2mash.b2b.digestengine.exception.ResourceNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import tools.jackson.databind.ObjectMapper;

/**
 * Stores email templates. Default templates are read from {@code
 * classpath:email-templates/defaults.json} at startup, may be edited, and can never be deleted.
 */
@Service
public class EmailTemplateService {

  private static final Logger log = LoggerFactory.getLogger(EmailTemplateService.class);

  static final String DEFAULTS_LOCATION = "email-templates/defaults.json";

  /** Built-in template that wraps a generated digest when a schedule names none. */
  public static final String SCHEDULED_DIGEST_TEMPLATE_ID = "scheduled-digest";

  private final Map<String, EmailTemplate> templates = new LinkedHashMap<>();
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  public EmailTemplateService(ObjectMapper objectMapper) {
    for (var definition : loadDefaults(objectMapper)) {
      var template =
          new EmailTemplate(
              definition.id(),
              definition.name(),
              definition.subject(),
              definition.body(),
              TemplateCategory.fromWireName(definition.category()),
              true);
      templates.put(template.getId(), template);
    }
    log.info("Seeded {} default email templates", templates.size());
  }

  public List<EmailTemplate> list() {
    lock.readLock().lock();
    try {
      return List.copyOf(templates.values());
    } finally {
      lock.readLock().unlock();
    }
  }

  public EmailTemplate get(String id) {
    return find(id).orElseThrow(() -> new ResourceNotFoundException("EmailTemplate", id));
  }

  public Optional<EmailTemplate> find(String id) {
    if (id == null) {
      return Optional.empty();
    }
    lock.readLock().lock();
    try {
      return Optional.ofNullable(templates.get(id));
    } finally {
      lock.readLock().unlock();
    }
  }

  public EmailTemplate create(EmailTemplateDraft draft) {
    validate(draft);
    var template =
        new EmailTemplate(
            UUID.randomUUID().toString(),
            draft.name().trim(),
            draft.subject(),
            draft.body(),
            draft.category(),
            false);
    lock.writeLock().lock();
    try {
      templates.put(template.getId(), template);
    } finally {
      lock.writeLock().unlock();
    }
    log.info(
        "Created email template {} with variables {}", template.getId(), template.getVariables());
    return template;
  }

  public EmailTemplate update(String id, EmailTemplateDraft draft) {
    validate(draft);
    lock.writeLock().lock();
    try {
      var existing = templates.get(id);
      if (existing == null) {
        throw new ResourceNotFoundException("EmailTemplate", id);
      }
      var updated =
          existing.withContent(
              draft.name().trim(), draft.subject(), draft.body(), draft.category());
      templates.put(id, updated);
      return updated;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public void delete(String id) {
    lock.writeLock().lock();
    try {
      var existing = templates.get(id);
      if (existing == null) {
        throw new ResourceNotFoundException("EmailTemplate", id);
      }
      if (existing.isDefault()) {
        throw new InvalidStateException(
            "Cannot delete default template", "Template " + id + " is a default template.");
      }
      templates.remove(id);
    } finally {
      lock.writeLock().unlock();
    }
    log.info("Deleted email template {}", id);
  }

  private static void validate(EmailTemplateDraft draft) {
    var violations = new ArrayList<String>();
    if (draft.name() == null || draft.name().isBlank()) {
      violations.add("name is required");
    }
    if (draft.subject() == null || draft.subject().isBlank()) {
      violations.add("subject is required");
    }
    if (draft.body() == null || draft.body().isBlank()) {
      violations.add("body is required");
    }
    if (draft.category() == null) {
      violations.add("category is required");
    }
    if (!violations.isEmpty()) {
      throw new InvalidConfigurationException("Invalid email template", violations);
    }
  }

  private static List<DefaultTemplateDefinition> loadDefaults(ObjectMapper objectMapper) {
    var resource = new ClassPathResource(DEFAULTS_LOCATION);
    try (InputStream in = resource.getInputStream()) {
      return List.of(objectMapper.readValue(in, DefaultTemplateDefinition[].class));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read default templates: " + DEFAULTS_LOCATION, e);
    }
  }
}
