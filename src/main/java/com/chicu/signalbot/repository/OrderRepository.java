package com.chicu.signalbot.repository;

import com.chicu.signalbot.common.enums.ExecutionMode;
import com.chicu.signalbot.common.enums.OrderStatus;
import com.chicu.signalbot.common.enums.TradeSide;
import com.chicu.signalbot.common.time.Timeframe;
import com.chicu.signalbot.domain.OrderEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OrderRepository extends JpaRepository<OrderEntity, Long> {

    List<OrderEntity> findByStatusOrderByCreatedAtAsc(OrderStatus status);

    long countByStatus(OrderStatus status);

    boolean existsBySymbolAndTimeframeAndSideAndStatus(String symbol, Timeframe timeframe,
                                                       TradeSide side, OrderStatus status);

    /**
     * Поиск с необязательными фильтрами (null — без фильтра), новые сверху.
     */
    @Query("""
            select o from OrderEntity o
            where (:status is null or o.status = :status)
              and (:symbol is null or o.symbol = :symbol)
              and (:mode is null or o.mode = :mode)
            order by o.createdAt desc, o.id desc
            """)
    List<OrderEntity> search(@Param("status") OrderStatus status,
                             @Param("symbol") String symbol,
                             @Param("mode") ExecutionMode mode,
                             Pageable pageable);
}
