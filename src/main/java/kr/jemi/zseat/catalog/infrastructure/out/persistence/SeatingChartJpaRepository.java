package kr.jemi.zseat.catalog.infrastructure.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SeatingChartJpaRepository extends JpaRepository<SeatingChartJpaEntity, Long> {
}
