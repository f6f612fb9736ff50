package com.opsdash.coordination.repository;

import com.opsdash.coordination.enums.ConditionGroupOperator;
import com.opsdash.coordination.enums.PolicyEffect;
import com.opsdash.coordination.model.ConditionGroupDto;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.List;

@Entity
@Table(name = "policy_rules")
public class PolicyRuleEntity {

  @Id
  @Column(name = "id", nullable = false, updatable = false, length = 128)
  private String id;

  @Column(name = "name")
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "effect", nullable = false, length = 24)
  private PolicyEffect effect;

  @Column(name = "priority", nullable = false)
  private int priority;

  @Column(name = "enabled", nullable = false)
  private boolean enabled;

  @Enumerated(EnumType.STRING)
  @Column(name = "group_operator", nullable = false, length = 8)
  private ConditionGroupOperator groupOperator;

  @Column(name = "conditions_json", nullable = false, length = 16000)
  @Convert(converter = ConditionGroupsJsonConverter.class)
  private List<ConditionGroupDto> conditionGroups;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  public PolicyRuleEntity() {}

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public PolicyEffect getEffect() {
    return effect;
  }

  public void setEffect(PolicyEffect effect) {
    this.effect = effect;
  }

  public int getPriority() {
    return priority;
  }

  public void setPriority(int priority) {
    this.priority = priority;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public ConditionGroupOperator getGroupOperator() {
    return groupOperator;
  }

  public void setGroupOperator(ConditionGroupOperator groupOperator) {
    this.groupOperator = groupOperator;
  }

  public List<ConditionGroupDto> getConditionGroups() {
    return conditionGroups;
  }

  public void setConditionGroups(List<ConditionGroupDto> conditionGroups) {
    this.conditionGroups = conditionGroups;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }
}
