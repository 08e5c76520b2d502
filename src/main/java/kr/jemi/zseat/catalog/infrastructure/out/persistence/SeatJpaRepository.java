package kr.jemi.zseat.catalog.infrastructure.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface SeatJpaRepository extends JpaRepository<SeatJpaEntity, Long> {

    List<SeatJpaEntity> findByChartId(long chartId);

    List<SeatJpaEntity> findByIdIn(Collection<Long> ids);
}
