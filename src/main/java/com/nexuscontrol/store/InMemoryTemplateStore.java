package com.nexuscontrol.store;

import com.nexuscontrol.contract.EventEnvelope;
import com.nexuscontrol.contract.EventPayload;
import com.nexuscontrol.integrity.ContentDigest;
import com.nexuscontrol.policy.Policy;
import com.nexuscontrol.policy.Template;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryTemplateStore implements TemplateStore {

    private final ConcurrentHashMap<String, StoredTemplate> templates = new ConcurrentHashMap<>();

    @Override
    public EventEnvelope save(Template template) {
        Policy policy = template.policy();
        EventPayload.TemplateCreated payload = new EventPayload.TemplateCreated(
            template.name(),
            template.description(),
            policy.minApprovals(),
            policy.allowedModes(),
            policy.requireAdapterCapabilities(),
            policy.maxSteps(),
            policy.labels(),
            template.digest()
        );
        EventEnvelope event = new EventEnvelope(
            STREAM_PREFIX + template.name(),
            0L,
            payload.eventType(),
            template.createdAt(),
            template.createdBy(),
            payload,
            ContentDigest.ofEvent(payload.eventType(), payload)
        );
        StoredTemplate previous = templates.putIfAbsent(template.name(), new StoredTemplate(template, event));
        if (previous != null) {
            throw new IllegalStateException("Template '" + template.name() + "' already exists");
        }
        return event;
    }

    @Override
    public Optional<Template> find(String name) {
        StoredTemplate stored = name == null ? null : templates.get(name);
        return stored == null ? Optional.empty() : Optional.of(stored.template());
    }

    @Override
    public boolean exists(String name) {
        return name != null && templates.containsKey(name);
    }

    @Override
    public List<Template> list(int limit, int offset, String label) {
        if (limit <= 0 || offset < 0) {
            return Collections.emptyList();
        }
        return templates.values().stream()
            .map(StoredTemplate::template)
            .filter(t -> label == null || t.policy().labels().contains(label))
            .sorted(Comparator.comparing(Template::name))
            .skip(offset)
            .limit(limit)
            .toList();
    }

    @Override
    public List<EventEnvelope> events(String name) {
        StoredTemplate stored = name == null ? null : templates.get(name);
        return stored == null ? List.of() : List.of(stored.event());
    }

    private record StoredTemplate(Template template, EventEnvelope event) {}
}
