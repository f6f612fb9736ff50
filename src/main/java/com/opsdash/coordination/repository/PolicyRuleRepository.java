package com.opsdash.coordination.repository;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PolicyRuleRepository extends JpaRepository<PolicyRuleEntity, String> {

  List<PolicyRuleEntity> findAllByOrderByCreatedAtAsc();
}
