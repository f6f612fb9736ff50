package com.opsdash.coordination.model;

import java.util.Map;

public record Integration(
    String id,
    String name,
    String type,
    Map<String, Object> config,
    boolean enabled
) {}
