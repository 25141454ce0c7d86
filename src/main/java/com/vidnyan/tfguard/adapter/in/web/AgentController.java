package com.vidnyan.tfguard.adapter.in.web;

import com.vidnyan.tfguard.application.port.in.AgentUseCase;
import com.vidnyan.tfguard.domain.session.AgentSession;
import com.vidnyan.tfguard.domain.session.ApplyResult;
import com.vidnyan.tfguard.domain.session.TemplateVersion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for stored templates, their history and agent sessions.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AgentController {

    private final AgentUseCase agentUseCase;

    @PutMapping("/templates/{templateId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void saveTemplate(@PathVariable String templateId, @RequestBody TemplateContent body) {
        agentUseCase.saveTemplate(templateId, body.content());
    }

    @GetMapping("/templates/{templateId}")
    public TemplateContent getTemplate(@PathVariable String templateId) {
        return new TemplateContent(agentUseCase.getTemplateContent(templateId));
    }

    @GetMapping("/templates/{templateId}/versions")
    public List<TemplateVersion> versions(@PathVariable String templateId) {
        return agentUseCase.getTemplateVersions(templateId);
    }

    @PostMapping("/templates/{templateId}/versions/{version}/restore")
    public TemplateVersion restore(@PathVariable String templateId, @PathVariable int version) {
        return agentUseCase.restoreTemplateVersion(templateId, version);
    }

    @PostMapping("/agent/sessions")
    @ResponseStatus(HttpStatus.CREATED)
    public AgentSession plan(@RequestBody PlanRequest request) {
        log.info("Planning changes for template {}", request.templateId());
        return agentUseCase.analyzeAndPlan(request.templateId(), request.provider());
    }

    @GetMapping("/agent/sessions/{sessionId}")
    public AgentSession session(@PathVariable String sessionId) {
        return agentUseCase.getSession(sessionId);
    }

    @GetMapping("/agent/sessions")
    public List<AgentSession> sessions(@RequestParam String templateId) {
        return agentUseCase.listSessions(templateId);
    }

    @PostMapping("/agent/sessions/{sessionId}/apply")
    public ApplyResult apply(@PathVariable String sessionId, @RequestBody ApplyRequest request) {
        List<String> ids = request.changeIds() != null ? request.changeIds() : List.of();
        return agentUseCase.applyChanges(sessionId, ids);
    }

    @PostMapping("/agent/sessions/{sessionId}/cancel")
    public AgentSession cancel(@PathVariable String sessionId) {
        return agentUseCase.cancelSession(sessionId);
    }

    public record TemplateContent(String content) {}

    public record PlanRequest(
        String templateId,
        String provider
    ) {}

    public record ApplyRequest(List<String> changeIds) {}
}
