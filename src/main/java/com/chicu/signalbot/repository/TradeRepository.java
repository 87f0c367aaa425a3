package com.chicu.signalbot.repository;

import com.chicu.signalbot.common.enums.ExecutionMode;
import com.chicu.signalbot.common.enums.TradeStatus;
import com.chicu.signalbot.domain.TradeEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TradeRepository extends JpaRepository<TradeEntity, Long> {

    List<TradeEntity> findByStatusOrderByOpenedAtAsc(TradeStatus status);

    long countByStatus(TradeStatus status);

    Optional<TradeEntity> findByOrderId(Long orderId);

    @Query("""
            select t from TradeEntity t
            where (:status is null or t.status = :status)
              and (:symbol is null or t.symbol = :symbol)
              and (:mode is null or t.mode = :mode)
            order by t.openedAt desc, t.id desc
            """)
    List<TradeEntity> search(@Param("status") TradeStatus status,
                             @Param("symbol") String symbol,
                             @Param("mode") ExecutionMode mode,
                             Pageable pageable);
}
