package io.b2mash.b2b.digestengine.notification.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.digestengine.notification.ResourceSummary;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TemplateRendererTest {

  private final TemplateRenderer renderer = new TemplateRenderer(5);

  @Test
  void render_substitutesEveryOccurrence() {
    var rendered =
        renderer.render(
            "New on {PLATFORM_NAME}",
            "{RESOURCE_COUNT} resources from {PLATFORM_NAME}, synced {SYNC_TIME}",
            Map.of(
                "PLATFORM_NAME", "Coursera",
                "RESOURCE_COUNT", 3,
                "SYNC_TIME", "2024-01-10 09:00 UTC"));

    assertThat(rendered.subject()).isEqualTo("New on Coursera");
    assertThat(rendered.body()).isEqualTo("3 resources from Coursera, synced 2024-01-10 09:00 UTC");
    assertThat(rendered.isFullyResolved()).isTrue();
  }

  @Test
  void render_leavesUnknownTokensVerbatimAndReportsThem() {
    var rendered =
        renderer.render(
            "{PLATFORM_NAME} digest",
            "Topics: {POPULAR_TOPICS}\nAgain: {POPULAR_TOPICS} and {MISSING}",
            Map.of("PLATFORM_NAME", "LinkedIn Learning"));

    assertThat(rendered.subject()).isEqualTo("LinkedIn Learning digest");
    assertThat(rendered.body())
        .isEqualTo("Topics: {POPULAR_TOPICS}\nAgain: {POPULAR_TOPICS} and {MISSING}");
    assertThat(rendered.unresolved()).containsExactly("POPULAR_TOPICS", "MISSING");
    assertThat(rendered.isFullyResolved()).isFalse();
  }

  @Test
  void render_nullValueCountsAsUnresolved() {
    var variables = new HashMap<String, Object>();
    variables.put("ERROR_MESSAGE", null);

    var rendered = renderer.render("s", "Error: {ERROR_MESSAGE}", variables);

    assertThat(rendered.body()).isEqualTo("Error: {ERROR_MESSAGE}");
    assertThat(rendered.unresolved()).containsExactly("ERROR_MESSAGE");
  }

  @Test
  void render_substitutedTextIsNotScannedAgain() {
    var rendered =
        renderer.render(
            "{A}", "{A} then {B}", Map.of("A", "{B}", "B", "$1 and \\ backslash"));

    assertThat(rendered.subject()).isEqualTo("{B}");
    assertThat(rendered.body()).isEqualTo("{B} then $1 and \\ backslash");
    assertThat(rendered.isFullyResolved()).isTrue();
  }

  @Test
  void render_emptyValueIsResolved() {
    var rendered =
        renderer.render("{NAME}", "[{DESCRIPTION}]", Map.of("NAME", "x", "DESCRIPTION", ""));

    assertThat(rendered.body()).isEqualTo("[]");
    assertThat(rendered.isFullyResolved()).isTrue();
  }

  @Test
  void render_ignoresMalformedTokens() {
    var rendered =
        renderer.render("{ NAME }", "{NAME-X} {} {{NAME}}", Map.of("NAME", "ok"));

    assertThat(rendered.subject()).isEqualTo("{ NAME }");
    assertThat(rendered.body()).isEqualTo("{NAME-X} {} {ok}");
  }

  @Test
  void render_listValuesBecomeNumberedLinesWithOverflowCount() {
    var resources =
        List.of(
            new ResourceSummary("GDPR Basics", "Course"),
            new ResourceSummary("HIPAA Refresher", "Video"),
            new ResourceSummary("SOX Controls", ""),
            new ResourceSummary("ISO 27001", "Course"),
            new ResourceSummary("CCPA Update", "Article"),
            new ResourceSummary("PCI DSS v4", "Course"),
            new ResourceSummary("AI Act Primer", "Course"));

    var rendered = renderer.render("s", "{RESOURCE_LIST}", Map.of("RESOURCE_LIST", resources));

    assertThat(rendered.body())
        .isEqualTo(
            String.join(
                "\n",
                "1. GDPR Basics (Course)",
                "2. HIPAA Refresher (Video)",
                "3. SOX Controls",
                "4. ISO 27001 (Course)",
                "5. CCPA Update (Article)",
                "+2 more"));
  }

  @Test
  void render_shortListHasNoOverflowLine() {
    var rendered =
        new TemplateRenderer(3).render("s", "{ITEMS}", Map.of("ITEMS", List.of("a", "b", "c")));

    assertThat(rendered.body()).isEqualTo("1. a\n2. b\n3. c");
  }

  @Test
  void render_nullPatternsRenderEmpty() {
    var rendered = renderer.render(null, null, Map.of());

    assertThat(rendered.subject()).isEmpty();
    assertThat(rendered.body()).isEmpty();
  }

  @Test
  void extractVariables_distinctInOrderOfAppearance() {
    var variables =
        TemplateRenderer.extractVariables(
            "New Learning Resources Available - {PLATFORM_NAME}",
            "{RESOURCE_COUNT} from {PLATFORM_NAME}:\n{RESOURCE_LIST}");

    assertThat(variables).containsExactly("PLATFORM_NAME", "RESOURCE_COUNT", "RESOURCE_LIST");
  }

  @Test
  void constructor_rejectsNonPositiveListLimit() {
    assertThatThrownBy(() -> new TemplateRenderer(0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
