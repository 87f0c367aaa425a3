package com.chicu.signalbot.journal;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Запись аудита: один переход статуса ордера или сделки.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "bot_lifecycle_events",
        indexes = {
                @Index(name = "ix_lifecycle_entity", columnList = "entity_type,entity_id"),
                @Index(name = "ix_lifecycle_occurred_at", columnList = "occurred_at")
        }
)
public class LifecycleEvent {

    public enum EntityType { ORDER, TRADE }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, length = 8)
    private EntityType entityType;

    @Column(name = "entity_id", nullable = false)
    private Long entityId;

    @Column(name = "symbol", length = 32)
    private String symbol;

    /** null для создания записи. */
    @Column(name = "from_status", length = 16)
    private String fromStatus;

    @Column(name = "to_status", nullable = false, length = 16)
    private String toStatus;

    @Column(name = "reason", length = 128)
    private String reason;

    @Column(name = "price")
    private Double price;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;
}
