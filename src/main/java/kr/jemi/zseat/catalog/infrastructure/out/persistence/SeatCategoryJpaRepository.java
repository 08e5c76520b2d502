package kr.jemi.zseat.catalog.infrastructure.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SeatCategoryJpaRepository extends JpaRepository<SeatCategoryJpaEntity, Long> {

    List<SeatCategoryJpaEntity> findByChartId(long chartId);
}
