package com.chicu.signalbot.domain;

import com.chicu.signalbot.common.UserNote;
import com.chicu.signalbot.common.enums.ExecutionMode;
import com.chicu.signalbot.common.enums.OrderStatus;
import com.chicu.signalbot.common.enums.TradeSide;
import com.chicu.signalbot.common.time.Timeframe;
import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;

/**
 * Лимитный ордер на вход по сигналу.
 *
 * PENDING → FILLED | CANCELED | EXPIRED, терминальные статусы не меняются.
 * Переходы делаются на копии ({@code toBuilder()}), исходный объект не трогаем.
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "bot_orders",
        indexes = {
                @Index(name = "ix_bot_orders_status", columnList = "status"),
                @Index(name = "ix_bot_orders_symbol_status", columnList = "symbol,status"),
                @Index(name = "ix_bot_orders_created_at", columnList = "created_at")
        }
)
public class OrderEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "signal_id", length = 64)
    private String signalId;

    @Column(name = "symbol", nullable = false, length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "timeframe", length = 8)
    private Timeframe timeframe;

    @Enumerated(EnumType.STRING)
    @Column(name = "side", nullable = false, length = 8)
    private TradeSide side;

    // ==========================
    // УРОВНИ
    // ==========================
    @Column(name = "entry_price", nullable = false)
    private double entry;

    @Column(name = "stop_price", nullable = false)
    private double stop;

    @Column(name = "take_price", nullable = false)
    private double take;

    /** Размер позиции в единицах базового актива. */
    @Column(name = "position_size", nullable = false)
    private double size;

    // ==========================
    // СТАТУС
    // ==========================
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "mode", nullable = false, length = 16)
    private ExecutionMode mode;

    /** human / bot_strict / bot_explore */
    @Column(name = "executor", nullable = false, length = 16)
    private String executor;

    @Column(name = "status_reason", length = 128)
    private String statusReason;

    /** Комментарий к ручной отмене. */
    @Column(name = "note", length = UserNote.MAX_LENGTH)
    private String note;

    @Column(name = "status_changed_at")
    private Instant statusChangedAt;

    // ==========================
    // ВРЕМЯ
    // ==========================
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "filled_at")
    private Instant filledAt;

    @Column(name = "fill_price")
    private Double fillPrice;

    @Version
    private Long version;

    public boolean isPending() {
        return status == OrderStatus.PENDING;
    }

    /** Истёк ли TTL: прошедшее время строго больше TTL. */
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public Duration ttl() {
        return Duration.between(createdAt, expiresAt);
    }
}
