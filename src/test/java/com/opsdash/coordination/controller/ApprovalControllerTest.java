package com.opsdash.coordination.controller;

import com.opsdash.coordination.enums.RiskLevel;
import com.opsdash.coordination.exception.NotFoundException;
import com.opsdash.coordination.model.AgentAction;
import com.opsdash.coordination.model.HighRiskAction;
import com.opsdash.coordination.orchestrator.AgentOrchestrator;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ApprovalController.class)
class ApprovalControllerTest {

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private AgentOrchestrator orchestrator;

  @Test
  void listsPendingApprovals() throws Exception {
    AgentAction action = new AgentAction("act-1", "tf-1", "apply-plan", "Apply plan", List.of("prod-db"),
        RiskLevel.HIGH, "minimal", null, null, null);
    given(orchestrator.getPendingApprovals()).willReturn(List.of(
        HighRiskAction.pending(action, "High Risk Actions Require Approval", Instant.parse("2026-03-01T10:00:00Z"))));

    mockMvc.perform(get("/api/v1/approvals/pending"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].action.id").value("act-1"))
        .andExpect(jsonPath("$[0].action.riskLevel").value("high"))
        .andExpect(jsonPath("$[0].policyName").value("High Risk Actions Require Approval"));
  }

  @Test
  void approveReturnsDecision() throws Exception {
    mockMvc.perform(
            post("/api/v1/approvals/act-1/approve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"actor\":\"alice\",\"reason\":\"change window\"}")
        )
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.actionId").value("act-1"))
        .andExpect(jsonPath("$.approved").value(true))
        .andExpect(jsonPath("$.decidedBy").value("alice"));

    verify(orchestrator).approveAction("act-1", "alice", "change window");
  }

  @Test
  void rejectOfUnknownActionReturns404() throws Exception {
    willThrow(NotFoundException.pendingApproval("ghost"))
        .given(orchestrator).rejectAction(any(), anyString(), any());

    mockMvc.perform(
            post("/api/v1/approvals/ghost/reject")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"actor\":\"bob\"}")
        )
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("not_found"));
  }

  @Test
  void decisionWithoutActorReturns400() throws Exception {
    mockMvc.perform(
            post("/api/v1/approvals/act-1/approve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\":\"ok\"}")
        )
        .andExpect(status().isBadRequest());

    verify(orchestrator, never()).approveAction(any(), any(), any());
  }
}
