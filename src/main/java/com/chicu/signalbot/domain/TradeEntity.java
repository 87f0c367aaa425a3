package com.chicu.signalbot.domain;

import com.chicu.signalbot.common.UserNote;
import com.chicu.signalbot.common.enums.ExecutionMode;
import com.chicu.signalbot.common.enums.TradeSide;
import com.chicu.signalbot.common.enums.TradeStatus;
import com.chicu.signalbot.common.time.Timeframe;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Открытая или закрытая позиция, появляется при исполнении ордера.
 * OPEN → CLOSED ровно один раз.
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "bot_trades",
        indexes = {
                @Index(name = "ix_bot_trades_status", columnList = "status"),
                @Index(name = "ix_bot_trades_symbol_status", columnList = "symbol,status"),
                @Index(name = "ux_bot_trades_order", columnList = "order_id", unique = true)
        }
)
public class TradeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Ордер-источник. Уникален: у ордера не больше одной сделки. */
    @Column(name = "order_id", unique = true)
    private Long orderId;

    @Column(name = "symbol", nullable = false, length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "timeframe", length = 8)
    private Timeframe timeframe;

    @Enumerated(EnumType.STRING)
    @Column(name = "side", nullable = false, length = 8)
    private TradeSide side;

    @Column(name = "entry_price", nullable = false)
    private double entry;

    @Column(name = "stop_price", nullable = false)
    private double stop;

    @Column(name = "take_price", nullable = false)
    private double take;

    @Column(name = "position_size", nullable = false)
    private double size;

    @Enumerated(EnumType.STRING)
    @Column(name = "mode", nullable = false, length = 16)
    private ExecutionMode mode;

    @Column(name = "executor", nullable = false, length = 16)
    private String executor;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private TradeStatus status;

    // ==========================
    // ВЫХОД
    // ==========================
    @Column(name = "exit_price")
    private Double exit;

    /** stop / take / ttl / manual */
    @Column(name = "close_reason", length = 16)
    private String closeReason;

    /** Комментарий к ручному закрытию. */
    @Column(name = "close_note", length = UserNote.MAX_LENGTH)
    private String closeNote;

    @Column(name = "realized_r")
    private Double realizedR;

    @Column(name = "pnl")
    private Double pnl;

    // ==========================
    // ВРЕМЯ
    // ==========================
    @Column(name = "opened_at", nullable = false)
    private Instant openedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Version
    private Long version;

    public boolean isOpen() {
        return status == TradeStatus.OPEN;
    }

    /** Риск на единицу |entry − stop|. */
    public double riskPerUnit() {
        return Math.abs(entry - stop);
    }
}
