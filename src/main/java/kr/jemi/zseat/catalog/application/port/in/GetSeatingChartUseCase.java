package kr.jemi.zseat.catalog.application.port.in;

import kr.jemi.zseat.catalog.domain.EventSeat;
import kr.jemi.zseat.catalog.domain.SeatCategory;
import kr.jemi.zseat.catalog.domain.SeatingChart;

import java.util.List;

public interface GetSeatingChartUseCase {

    SeatingChart getChart(long chartId);

    List<SeatCategory> getCategories(long chartId);

    List<EventSeat> getEventSeats(long eventId, long chartId);
}
