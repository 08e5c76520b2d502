package kr.jemi.zseat.catalog.application.service;

import kr.jemi.zseat.catalog.api.CatalogSeat;
import kr.jemi.zseat.catalog.api.SeatCatalogFacade;
import kr.jemi.zseat.catalog.application.port.in.GetSeatingChartUseCase;
import kr.jemi.zseat.catalog.application.port.out.SeatingChartPort;
import kr.jemi.zseat.catalog.domain.EventOverrides;
import kr.jemi.zseat.catalog.domain.EventSeat;
import kr.jemi.zseat.catalog.domain.EventSeating;
import kr.jemi.zseat.catalog.domain.Seat;
import kr.jemi.zseat.catalog.domain.SeatCategory;
import kr.jemi.zseat.catalog.domain.SeatingChart;
import kr.jemi.zseat.catalog.domain.exception.ChartNotFoundException;
import kr.jemi.zseat.catalog.domain.exception.SeatNotFoundException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

@Service
public class SeatCatalogService implements GetSeatingChartUseCase, SeatCatalogFacade {

    private final SeatingChartPort seatingChartPort;

    public SeatCatalogService(SeatingChartPort seatingChartPort) {
        this.seatingChartPort = seatingChartPort;
    }

    @Override
    public SeatingChart getChart(long chartId) {
        return seatingChartPort.findChart(chartId)
                .orElseThrow(() -> new ChartNotFoundException(chartId));
    }

    @Override
    public List<SeatCategory> getCategories(long chartId) {
        return getChart(chartId).categoriesInOrder();
    }

    @Override
    public List<EventSeat> getEventSeats(long eventId, long chartId) {
        SeatingChart chart = getChart(chartId);
        return EventSeating.merge(chart, seatingChartPort.findOverrides(eventId, chartId));
    }

    @Override
    public List<CatalogSeat> listEventSeats(long eventId, long chartId) {
        return getEventSeats(eventId, chartId).stream()
                .map(SeatCatalogService::toCatalogSeat)
                .toList();
    }

    @Override
    public List<CatalogSeat> findEventSeats(long eventId, Collection<Long> seatIds) {
        TreeSet<Long> requested = new TreeSet<>(seatIds);
        Map<Long, Long> chartIds = seatingChartPort.findChartIds(requested);
        List<Long> missing = requested.stream()
                .filter(seatId -> !chartIds.containsKey(seatId))
                .toList();
        if (!missing.isEmpty()) {
            throw new SeatNotFoundException(missing);
        }

        Map<Long, List<Long>> seatIdsByChart = requested.stream()
                .collect(Collectors.groupingBy(chartIds::get, TreeMap::new, Collectors.toList()));

        List<CatalogSeat> result = new ArrayList<>();
        seatIdsByChart.forEach((chartId, ids) -> {
            SeatingChart chart = getChart(chartId);
            EventOverrides overrides = seatingChartPort.findOverrides(eventId, chartId);
            for (Long seatId : ids) {
                Seat seat = chart.seat(seatId).orElseThrow(() -> new SeatNotFoundException(List.of(seatId)));
                result.add(toCatalogSeat(EventSeating.apply(chart, overrides, seat)));
            }
        });
        result.sort(Comparator.comparingLong(CatalogSeat::seatId));
        return result;
    }

    private static CatalogSeat toCatalogSeat(EventSeat eventSeat) {
        Seat seat = eventSeat.seat();
        return new CatalogSeat(
                seat.id(),
                seat.chartId(),
                seat.categoryId(),
                eventSeat.categoryName(),
                eventSeat.categoryColor(),
                seat.section(),
                seat.rowLabel(),
                seat.seatNumber(),
                seat.label(),
                eventSeat.price(),
                eventSeat.available(),
                seat.accessible(),
                seat.premium()
        );
    }
}
