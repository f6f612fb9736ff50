package com.opsdash.coordination.model;

import com.opsdash.coordination.enums.ConflictStrategyType;
import java.util.Map;

public record ConflictResolutionStrategy(
    ConflictStrategyType type,
    Map<String, Object> config
) {

  public ConflictResolutionStrategy {
    type = type == null ? ConflictStrategyType.PRIORITY : type;
    config = config == null ? Map.of() : Map.copyOf(config);
  }

  public static ConflictResolutionStrategy of(ConflictStrategyType type) {
    return new ConflictResolutionStrategy(type, Map.of());
  }
}
