package com.nexuscontrol.api;

import com.nexuscontrol.control.TemplateService;
import com.nexuscontrol.policy.PolicyReader;
import com.nexuscontrol.policy.Template;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/templates")
public class TemplateController {

    private final TemplateService templateService;

    public TemplateController(TemplateService templateService) {
        this.templateService = templateService;
    }

    /**
     * Expected request body:
     * {
     *   "name": "prod-change",
     *   "description": "...",
     *   "policy": { "min_approvals": 2, "allowed_modes": ["dry_run", "apply"], ... },
     *   "actor": { "type": "human", "id": "alice" }
     * }
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> create(@RequestBody Map<String, Object> body) {
        Template template = templateService.create(
            RequestFields.requireString(body, "name"),
            RequestFields.optionalString(body, "description"),
            PolicyReader.fromMap(RequestFields.optionalObject(body, "policy")),
            RequestFields.actor(body)
        );
        return render(template);
    }

    @GetMapping
    public List<Map<String, Object>> list(@RequestParam(defaultValue = "50") int limit,
                                          @RequestParam(defaultValue = "0") int offset,
                                          @RequestParam(required = false) String label) {
        return templateService.list(Math.min(limit, 1000), offset, label).stream()
            .map(TemplateController::render)
            .toList();
    }

    @GetMapping("/{name}")
    public Map<String, Object> get(@PathVariable String name) {
        return render(templateService.get(name));
    }

    private static Map<String, Object> render(Template template) {
        Map<String, Object> view = template.toMap();
        view.put("digest", template.digest());
        return view;
    }
}
