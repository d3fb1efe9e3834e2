package io.b2mash.b2b.digestengine.notification.template;

import io.b2mash.b2b.digestengine.notification.ResourceSummary;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Substitutes {@code {NAME}} tokens in a subject and body. Each token occurrence is replaced once
 * and substituted text is never scanned again, so a value that itself contains braces is emitted
 * as-is. Tokens without a value stay verbatim and are reported.
 */
@Component
public class TemplateRenderer {

  private static final Logger log = LoggerFactory.getLogger(TemplateRenderer.class);

  static final Pattern TOKEN = Pattern.compile("\\{([A-Za-z0-9_]+)}");

  private final int listItemLimit;

  public TemplateRenderer(
      @Value("${digest-engine.templates.list-item-limit:5}") int listItemLimit) {
    if (listItemLimit < 1) {
      throw new IllegalArgumentException("list-item-limit must be at least 1");
    }
    this.listItemLimit = listItemLimit;
  }

  public RenderedTemplate render(String subject, String body, Map<String, ?> variables) {
    var unresolved = new LinkedHashSet<String>();
    String renderedSubject = substitute(subject, variables, unresolved);
    String renderedBody = substitute(body, variables, unresolved);
    if (!unresolved.isEmpty()) {
      log.warn("Template rendered with unresolved variables {}", unresolved);
    }
    return new RenderedTemplate(renderedSubject, renderedBody, unresolved);
  }

  /** Distinct token names in order of first appearance. */
  public static List<String> extractVariables(String... texts) {
    var names = new LinkedHashSet<String>();
    for (String text : texts) {
      if (text == null) {
        continue;
      }
      Matcher matcher = TOKEN.matcher(text);
      while (matcher.find()) {
        names.add(matcher.group(1));
      }
    }
    return List.copyOf(names);
  }

  private String substitute(String text, Map<String, ?> variables, Set<String> unresolved) {
    if (text == null || text.isEmpty()) {
      return text == null ? "" : text;
    }
    Matcher matcher = TOKEN.matcher(text);
    var out = new StringBuilder(text.length());
    while (matcher.find()) {
      String name = matcher.group(1);
      Object value = variables.get(name);
      String replacement;
      if (value == null) {
        unresolved.add(name);
        replacement = matcher.group();
      } else {
        replacement = format(value);
      }
      matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  private String format(Object value) {
    if (value instanceof Collection<?> items) {
      return formatList(items);
    }
    return formatItem(value);
  }

  /** "1. item" lines, truncated to the configured limit with a "+K more" line. */
  private String formatList(Collection<?> items) {
    var lines = new ArrayList<String>();
    int index = 0;
    for (Object item : items) {
      if (index == listItemLimit) {
        break;
      }
      index++;
      lines.add(index + ". " + formatItem(item));
    }
    int remaining = items.size() - index;
    if (remaining > 0) {
      lines.add("+" + remaining + " more");
    }
    return String.join("\n", lines);
  }

  private static String formatItem(Object item) {
    if (item instanceof ResourceSummary resource) {
      return resource.displayText();
    }
    return String.valueOf(item);
  }
}
