package com.nexuscontrol.control;

import com.nexuscontrol.contract.Actor;
import com.nexuscontrol.contract.ContractViolationException;
import com.nexuscontrol.contract.EventEnvelope;
import com.nexuscontrol.policy.Policy;
import com.nexuscontrol.policy.PolicyOverrides;
import com.nexuscontrol.policy.Template;
import com.nexuscontrol.policy.TemplateNotFoundException;
import com.nexuscontrol.policy.TemplatedPolicy;
import com.nexuscontrol.store.EventLogService;
import com.nexuscontrol.store.TemplateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Service
public class TemplateService {

    private static final Logger log = LoggerFactory.getLogger(TemplateService.class);

    private final TemplateStore templateStore;
    private final EventLogService eventLog;
    private final Clock clock;

    public TemplateService(TemplateStore templateStore, EventLogService eventLog, Clock clock) {
        this.templateStore = templateStore;
        this.eventLog = eventLog;
        this.clock = clock;
    }

    /**
     * @throws IllegalStateException     if the name is taken; templates are immutable
     * @throws IllegalArgumentException  if the policy fields are invalid
     */
    public Template create(String name, String description, Policy policy, Actor actor) {
        if (actor == null) {
            throw new ContractViolationException("actor is required");
        }
        Template template = new Template(name, description, policy, clock.instant(), actor);
        EventEnvelope event = templateStore.save(template);
        eventLog.publishCommitted(event);
        log.info("Template created name={} digest={} by={}", name, template.digest(), actor.displayName());
        return template;
    }

    public Template get(String name) {
        return templateStore.find(name).orElseThrow(() -> new TemplateNotFoundException(name));
    }

    public boolean exists(String name) {
        return templateStore.exists(name);
    }

    public List<Template> list(int limit, int offset, String label) {
        return templateStore.list(limit, offset, label);
    }

    public List<EventEnvelope> events(String name) {
        get(name);
        return templateStore.events(name);
    }

    public TemplatedPolicy instantiate(String name, PolicyOverrides overrides) {
        return TemplatedPolicy.instantiate(get(name), overrides);
    }
}
