package com.opsdash.coordination.model;

import java.util.List;
import java.util.Map;

public record ActionResult(
    boolean success,
    String message,
    Map<String, Object> data,
    List<String> errors
) {

  public static ActionResult cancelled(String reason) {
    return new ActionResult(false, "Action cancelled: " + reason, null, List.of(reason));
  }
}
