package kr.jemi.zseat.catalog.infrastructure.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface EventSeatOverrideJpaRepository extends JpaRepository<EventSeatOverrideJpaEntity, Long> {

    List<EventSeatOverrideJpaEntity> findByEventIdAndChartId(long eventId, long chartId);
}
