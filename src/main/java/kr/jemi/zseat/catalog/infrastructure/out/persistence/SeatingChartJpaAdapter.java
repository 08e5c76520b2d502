package kr.jemi.zseat.catalog.infrastructure.out.persistence;

import kr.jemi.zseat.catalog.application.port.out.SeatingChartPort;
import kr.jemi.zseat.catalog.domain.EventOverrides;
import kr.jemi.zseat.catalog.domain.SeatingChart;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Component
public class SeatingChartJpaAdapter implements SeatingChartPort {

    private final SeatingChartJpaRepository chartRepository;
    private final SeatJpaRepository seatRepository;
    private final SeatCategoryJpaRepository categoryRepository;
    private final EventSeatOverrideJpaRepository seatOverrideRepository;
    private final EventCategoryOverrideJpaRepository categoryOverrideRepository;

    public SeatingChartJpaAdapter(SeatingChartJpaRepository chartRepository,
                                  SeatJpaRepository seatRepository,
                                  SeatCategoryJpaRepository categoryRepository,
                                  EventSeatOverrideJpaRepository seatOverrideRepository,
                                  EventCategoryOverrideJpaRepository categoryOverrideRepository) {
        this.chartRepository = chartRepository;
        this.seatRepository = seatRepository;
        this.categoryRepository = categoryRepository;
        this.seatOverrideRepository = seatOverrideRepository;
        this.categoryOverrideRepository = categoryOverrideRepository;
    }

    @Override
    @Transactional(readOnly = true)
    @Cacheable(value = "seatingCharts", key = "#chartId")
    public Optional<SeatingChart> findChart(long chartId) {
        return chartRepository.findById(chartId)
                .map(chart -> new SeatingChart(
                        chart.getId(),
                        chart.getVenueId(),
                        chart.getEventId(),
                        chart.getName(),
                        chart.isActive(),
                        seatRepository.findByChartId(chartId).stream().map(SeatJpaEntity::toDomain).toList(),
                        categoryRepository.findByChartId(chartId).stream().map(SeatCategoryJpaEntity::toDomain).toList()
                ));
    }

    @Override
    @Transactional(readOnly = true)
    public EventOverrides findOverrides(long eventId, long chartId) {
        Map<Long, BigDecimal> seatPrices = new HashMap<>();
        Map<Long, Boolean> seatAvailability = new HashMap<>();
        for (EventSeatOverrideJpaEntity override : seatOverrideRepository.findByEventIdAndChartId(eventId, chartId)) {
            if (override.getPriceOverride() != null) {
                seatPrices.put(override.getSeatId(), override.getPriceOverride());
            }
            if (override.getAvailable() != null) {
                seatAvailability.put(override.getSeatId(), override.getAvailable());
            }
        }
        Map<Long, BigDecimal> multipliers = categoryOverrideRepository.findByEventIdAndChartId(eventId, chartId)
                .stream()
                .collect(Collectors.toMap(
                        EventCategoryOverrideJpaEntity::getCategoryId,
                        EventCategoryOverrideJpaEntity::getPriceMultiplier));
        return new EventOverrides(eventId, chartId, seatPrices, seatAvailability, multipliers);
    }

    @Override
    public Map<Long, Long> findChartIds(Collection<Long> seatIds) {
        if (seatIds.isEmpty()) {
            return Map.of();
        }
        List<SeatJpaEntity> seats = seatRepository.findByIdIn(seatIds);
        return seats.stream().collect(Collectors.toMap(SeatJpaEntity::getId, SeatJpaEntity::getChartId));
    }
}
