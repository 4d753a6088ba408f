package com.nexuscontrol.store;

import com.nexuscontrol.contract.EventEnvelope;
import com.nexuscontrol.policy.Template;

import java.util.List;
import java.util.Optional;

/**
 * Storage for policy templates. Each template lives in its own stream,
 * {@code template:<name>}, holding a single TEMPLATE_CREATED event.
 */
public interface TemplateStore {

    String STREAM_PREFIX = "template:";

    /**
     * @return the committed TEMPLATE_CREATED event
     * @throws IllegalStateException if a template with that name exists
     */
    EventEnvelope save(Template template);

    Optional<Template> find(String name);

    boolean exists(String name);

    /**
     * Sorted by name.
     *
     * @param label when non-null, only templates carrying this label
     */
    List<Template> list(int limit, int offset, String label);

    List<EventEnvelope> events(String name);
}
