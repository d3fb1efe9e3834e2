package io.b2mash.b2b.digestengine.notification.template;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/email-templates")
public class EmailTemplateController {

  private final EmailTemplateService templateService;

  public EmailTemplateController(EmailTemplateService templateService) {
    this.templateService = templateService;
  }

  @GetMapping
  public ResponseEntity<List<TemplateResponse>> listTemplates() {
    return ResponseEntity.ok(templateService.list().stream().map(TemplateResponse::from).toList());
  }

  @GetMapping("/{id}")
  public ResponseEntity<TemplateResponse> getTemplate(@PathVariable String id) {
    return ResponseEntity.ok(TemplateResponse.from(templateService.get(id)));
  }

  @PostMapping
  public ResponseEntity<TemplateResponse> createTemplate(
      @Valid @RequestBody TemplateRequest request) {
    var template = templateService.create(request.toDraft());
    return ResponseEntity.created(URI.create("/api/email-templates/" + template.getId()))
        .body(TemplateResponse.from(template));
  }

  @PutMapping("/{id}")
  public ResponseEntity<TemplateResponse> updateTemplate(
      @PathVariable String id, @Valid @RequestBody TemplateRequest request) {
    return ResponseEntity.ok(TemplateResponse.from(templateService.update(id, request.toDraft())));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteTemplate(@PathVariable String id) {
    templateService.delete(id);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record TemplateRequest(
      @NotBlank @Size(max = 200) String name,
      @NotBlank @Size(max = 500) String subject,
      @NotBlank String body,
      @NotNull String category) {

    EmailTemplateDraft toDraft() {
      return new EmailTemplateDraft(name, subject, body, TemplateCategory.fromWireName(category));
    }
  }

  public record TemplateResponse(
      String id,
      String name,
      String subject,
      String body,
      List<String> variables,
      String category,
      boolean isDefault) {

    public static TemplateResponse from(EmailTemplate template) {
      return new TemplateResponse(
          template.getId(),
          template.getName(),
          template.getSubject(),
          template.getBody(),
          template.getVariables(),
          template.getCategory().wireName(),
          template.isDefault());
    }
  }
}
