package com.opsdash.coordination.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsdash.coordination.approval.ApprovalRegistry;
import com.opsdash.coordination.bus.EventBus;
import com.opsdash.coordination.bus.EventBusSettings;
import com.opsdash.coordination.bus.transport.BusTransport;
import com.opsdash.coordination.bus.transport.InMemoryBusTransport;
import com.opsdash.coordination.bus.transport.RedisBusTransport;
import com.opsdash.coordination.conflict.ConflictResolver;
import com.opsdash.coordination.enums.ConflictStrategyType;
import com.opsdash.coordination.model.ConflictResolutionStrategy;
import com.opsdash.coordination.notification.NotificationService;
import com.opsdash.coordination.orchestrator.AgentOrchestrator;
import com.opsdash.coordination.orchestrator.EventRoutingTable;
import com.opsdash.coordination.orchestrator.OrchestratorSettings;
import com.opsdash.coordination.ruleengine.DefaultPolicies;
import com.opsdash.coordination.ruleengine.PolicyEngine;
import com.opsdash.coordination.ruleengine.evaluator.PolicyRuleEvaluator;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class CoordinationConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnProperty(name = "coordination.bus.transport", havingValue = "redis", matchIfMissing = true)
  public BusTransport redisBusTransport(RedisConnectionFactory connectionFactory, StringRedisTemplate redis) {
    return new RedisBusTransport(connectionFactory, redis);
  }

  @Bean
  @ConditionalOnProperty(name = "coordination.bus.transport", havingValue = "memory")
  public BusTransport inMemoryBusTransport(Clock clock) {
    return new InMemoryBusTransport(clock);
  }

  @Bean
  public EventBusSettings eventBusSettings(
      @Value("${coordination.bus.retry-attempts:3}") int retryAttempts,
      @Value("${coordination.bus.retry-delay-ms:1000}") long retryDelayMs,
      @Value("${coordination.bus.persistence-enabled:true}") boolean persistenceEnabled,
      @Value("${coordination.bus.retention-days:30}") int retentionDays,
      @Value("${coordination.bus.dispatch-threads:4}") int dispatchThreads) {
    return new EventBusSettings(retryAttempts, Duration.ofMillis(retryDelayMs), persistenceEnabled,
        Duration.ofDays(retentionDays), dispatchThreads);
  }

  @Bean(destroyMethod = "shutdown")
  public EventBus eventBus(BusTransport transport,
                           ObjectMapper objectMapper,
                           NotificationService notificationService,
                           EventBusSettings settings,
                           Clock clock) {
    return new EventBus(transport, objectMapper, notificationService, settings, clock);
  }

  @Bean
  public PolicyEngine policyEngine() {
    return new PolicyEngine(new PolicyRuleEvaluator(), DefaultPolicies.all());
  }

  @Bean
  public OrchestratorSettings orchestratorSettings(
      @Value("${coordination.orchestrator.action-timeout-ms:300000}") long actionTimeoutMs,
      @Value("${coordination.orchestrator.auto-approval-enabled:false}") boolean autoApprovalEnabled,
      @Value("${coordination.orchestrator.conflict-strategy:priority}") String conflictStrategy,
      @Value("${coordination.orchestrator.heartbeat-stale-ms:120000}") long heartbeatStaleMs) {
    return new OrchestratorSettings(
        Duration.ofMillis(actionTimeoutMs),
        autoApprovalEnabled,
        ConflictResolutionStrategy.of(ConflictStrategyType.from(conflictStrategy)),
        Duration.ofMillis(heartbeatStaleMs));
  }

  @Bean(destroyMethod = "shutdown")
  public ApprovalRegistry approvalRegistry(OrchestratorSettings settings,
                                           Clock clock,
                                           NotificationService notificationService) {
    return new ApprovalRegistry(settings.actionTimeout(), clock, notificationService);
  }

  @Bean(initMethod = "start", destroyMethod = "stop")
  public AgentOrchestrator agentOrchestrator(EventBus eventBus,
                                             PolicyEngine policyEngine,
                                             ApprovalRegistry approvalRegistry,
                                             NotificationService notificationService,
                                             ObjectMapper objectMapper,
                                             OrchestratorSettings settings,
                                             Clock clock) {
    return new AgentOrchestrator(eventBus, policyEngine, approvalRegistry, new ConflictResolver(),
        new EventRoutingTable(), notificationService, objectMapper, settings, clock);
  }
}
