package com.chicu.signalbot.repository;

import com.chicu.signalbot.journal.LifecycleEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LifecycleEventRepository extends JpaRepository<LifecycleEvent, Long> {

    List<LifecycleEvent> findByEntityTypeAndEntityIdOrderByOccurredAtAscIdAsc(
            LifecycleEvent.EntityType entityType, Long entityId);
}
