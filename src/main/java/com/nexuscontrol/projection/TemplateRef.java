package com.nexuscontrol.projection;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/** Template provenance of the decision's current policy. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TemplateRef(
    String name,
    String digest,
    Map<String, Object> snapshot,
    Map<String, Object> overridesApplied
) {}
