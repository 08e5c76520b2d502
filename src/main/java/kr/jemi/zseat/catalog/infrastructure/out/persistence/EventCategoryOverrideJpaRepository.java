package kr.jemi.zseat.catalog.infrastructure.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface EventCategoryOverrideJpaRepository extends JpaRepository<EventCategoryOverrideJpaEntity, Long> {

    List<EventCategoryOverrideJpaEntity> findByEventIdAndChartId(long eventId, long chartId);
}
