package com.procflow.backend.modules.lifecycle.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.procflow.backend.modules.lifecycle.domain.LifecycleEvent;

public interface LifecycleEventRepository extends JpaRepository<LifecycleEvent, UUID> {

    List<LifecycleEvent> findByTenantIdAndEntityNameAndEntityIdOrderByOccurredAtDescIdDesc(
            UUID tenantId,
            String entityName,
            String entityId);
}
