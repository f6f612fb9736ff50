package com.opsdash.coordination.conflict;

import com.opsdash.coordination.model.AgentAction;
import com.opsdash.coordination.model.PolicyRule;

/** Receives actions that a conflict could not settle automatically. */
@FunctionalInterface
public interface ConflictEscalator {

  void escalate(AgentAction action, PolicyRule escalationPolicy);
}
