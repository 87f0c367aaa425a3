package com.chicu.signalbot.journal;

import com.chicu.signalbot.domain.OrderEntity;
import com.chicu.signalbot.domain.TradeEntity;
import com.chicu.signalbot.repository.LifecycleEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Аудит переходов ордеров и сделок.
 *
 * Сам переход к моменту записи уже сохранён в ордере/сделке (status_reason, status_changed_at),
 * поэтому сбой записи журнала логируется и не откатывает переход.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LifecycleJournal {

    private final LifecycleEventRepository repository;

    public void orderTransition(OrderEntity order, String from, String reason, Double price, Instant at) {
        record(LifecycleEvent.builder()
                .entityType(LifecycleEvent.EntityType.ORDER)
                .entityId(order.getId())
                .symbol(order.getSymbol())
                .fromStatus(from)
                .toStatus(order.getStatus().name())
                .reason(reason)
                .price(price)
                .occurredAt(at)
                .build());
    }

    public void tradeTransition(TradeEntity trade, String from, String reason, Double price, Instant at) {
        record(LifecycleEvent.builder()
                .entityType(LifecycleEvent.EntityType.TRADE)
                .entityId(trade.getId())
                .symbol(trade.getSymbol())
                .fromStatus(from)
                .toStatus(trade.getStatus().name())
                .reason(reason)
                .price(price)
                .occurredAt(at)
                .build());
    }

    public List<LifecycleEvent> history(LifecycleEvent.EntityType type, Long id) {
        return repository.findByEntityTypeAndEntityIdOrderByOccurredAtAscIdAsc(type, id);
    }

    private void record(LifecycleEvent event) {
        try {
            repository.save(event);
        } catch (DataAccessException e) {
            log.warn("⚠️ [JOURNAL] {} #{} {}→{} not recorded: {}",
                    event.getEntityType(), event.getEntityId(),
                    event.getFromStatus(), event.getToStatus(), e.getMessage());
        }
    }
}
