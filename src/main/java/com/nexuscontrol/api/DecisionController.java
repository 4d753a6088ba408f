package com.nexuscontrol.api;

import com.nexuscontrol.contract.Actor;
import com.nexuscontrol.contract.ContractViolationException;
import com.nexuscontrol.contract.EventEnvelope;
import com.nexuscontrol.control.AuditRecord;
import com.nexuscontrol.control.ConflictMode;
import com.nexuscontrol.control.CreateDecisionCommand;
import com.nexuscontrol.control.DecisionImportService;
import com.nexuscontrol.control.DecisionService;
import com.nexuscontrol.control.ImportResult;
import com.nexuscontrol.dispatch.RunResponse;
import com.nexuscontrol.integrity.EventIntegrityVerifier.IntegrityReport;
import com.nexuscontrol.policy.PolicyReader;
import com.nexuscontrol.projection.DecisionLifecycle;
import com.nexuscontrol.projection.DecisionView;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decision lifecycle over HTTP.
 *
 * Every mutating request carries {@code actor: {type, id}}.
 */
@RestController
@RequestMapping("/v1/decisions")
public class DecisionController {

    private final DecisionService decisionService;
    private final DecisionImportService importService;

    public DecisionController(DecisionService decisionService, DecisionImportService importService) {
        this.decisionService = decisionService;
        this.importService = importService;
    }

    /**
     * Expected request body:
     * {
     *   "goal": "rotate credentials",
     *   "plan": "...",                   // optional
     *   "mode": "dry_run" | "apply",     // optional, defaults to dry_run
     *   "comment": "...",                // optional
     *   "template_name": "prod-change",  // optional
     *   "policy": { "min_approvals": 2, ... },  // optional; overrides when a template is named
     *   "actor": { "type": "human", "id": "alice" }
     * }
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public DecisionView create(@RequestBody Map<String, Object> body) {
        Map<String, Object> policy = RequestFields.optionalObject(body, "policy");
        return decisionService.create(new CreateDecisionCommand(
            RequestFields.optionalString(body, "decision_id"),
            RequestFields.requireString(body, "goal"),
            RequestFields.optionalString(body, "plan"),
            RequestFields.optionalMode(body, "mode"),
            RequestFields.optionalString(body, "comment"),
            RequestFields.optionalString(body, "template_name"),
            PolicyReader.overridesFromMap(policy),
            RequestFields.actor(body)
        ));
    }

    @GetMapping
    public List<DecisionView.Summary> list(@RequestParam(defaultValue = "50") int limit,
                                           @RequestParam(defaultValue = "0") int offset) {
        return decisionService.list(Math.min(limit, 1000), offset);
    }

    @GetMapping("/{decisionId}")
    public DecisionView get(@PathVariable String decisionId,
                            @RequestParam(name = "timeline_limit",
                                defaultValue = "" + DecisionLifecycle.DEFAULT_TIMELINE_LIMIT) int timelineLimit) {
        return decisionService.status(decisionId, timelineLimit);
    }

    @GetMapping("/{decisionId}/events")
    public List<EventEnvelope> events(@PathVariable String decisionId) {
        return decisionService.events(decisionId);
    }

    /**
     * Either {@code policy: {...}} or {@code template_name} with optional
     * {@code overrides: {...}}.
     */
    @PostMapping("/{decisionId}/policy")
    public DecisionView attachPolicy(@PathVariable String decisionId, @RequestBody Map<String, Object> body) {
        Actor actor = RequestFields.actor(body);
        String templateName = RequestFields.optionalString(body, "template_name");
        if (templateName != null) {
            return decisionService.attachTemplate(decisionId, templateName,
                PolicyReader.overridesFromMap(RequestFields.optionalObject(body, "overrides")), actor);
        }
        Map<String, Object> policy = RequestFields.optionalObject(body, "policy");
        if (policy == null) {
            throw new ContractViolationException("policy or template_name is required");
        }
        return decisionService.attachPolicy(decisionId, PolicyReader.fromMap(policy), actor);
    }

    @PostMapping("/{decisionId}/approvals")
    public DecisionView approve(@PathVariable String decisionId, @RequestBody Map<String, Object> body) {
        return decisionService.approve(
            decisionId,
            RequestFields.actor(body),
            RequestFields.optionalString(body, "comment"),
            RequestFields.optionalInstant(body, "expires_at")
        );
    }

    @PostMapping("/{decisionId}/revocations")
    public DecisionView revoke(@PathVariable String decisionId, @RequestBody Map<String, Object> body) {
        return decisionService.revoke(
            decisionId,
            RequestFields.actor(body),
            RequestFields.optionalString(body, "reason"),
            RequestFields.optionalString(body, "comment")
        );
    }

    /**
     * Body is the run request ({@code goal}, {@code mode}, {@code plan},
     * {@code adapter_id}, {@code max_steps}) plus {@code actor}. A failed
     * adapter call is still a 200: the failure is recorded and reported in
     * the response.
     */
    @PostMapping("/{decisionId}/executions")
    public RunResponse execute(@PathVariable String decisionId, @RequestBody Map<String, Object> body) {
        Actor actor = RequestFields.actor(body);
        Map<String, Object> request = new LinkedHashMap<>(body);
        request.remove("actor");
        return decisionService.execute(decisionId, request, actor);
    }

    @GetMapping("/{decisionId}/audit")
    public AuditRecord audit(@PathVariable String decisionId) {
        return decisionService.exportAudit(decisionId);
    }

    @GetMapping("/{decisionId}/integrity")
    public IntegrityReport integrity(@PathVariable String decisionId) {
        return decisionService.verifyIntegrity(decisionId);
    }

    /**
     * Accepts the body of {@code GET /{decisionId}/audit} unchanged.
     */
    @PostMapping("/import")
    @ResponseStatus(HttpStatus.CREATED)
    public ImportResult importRecord(@RequestBody Map<String, Object> body,
                                     @RequestParam(name = "conflict_mode",
                                         defaultValue = "reject_on_conflict") String conflictMode,
                                     @RequestParam(name = "verify_digest", defaultValue = "true") boolean verifyDigest) {
        return importService.importRecord(body, ConflictMode.fromValue(conflictMode), verifyDigest);
    }
}
