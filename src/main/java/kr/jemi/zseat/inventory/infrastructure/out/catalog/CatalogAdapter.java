package kr.jemi.zseat.inventory.infrastructure.out.catalog;

import kr.jemi.zseat.catalog.api.CatalogSeat;
import kr.jemi.zseat.catalog.api.SeatCatalogFacade;
import kr.jemi.zseat.inventory.application.port.out.CatalogPort;
import kr.jemi.zseat.inventory.domain.PricedSeat;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Component
public class CatalogAdapter implements CatalogPort {

    private final SeatCatalogFacade seatCatalogFacade;

    public CatalogAdapter(SeatCatalogFacade seatCatalogFacade) {
        this.seatCatalogFacade = seatCatalogFacade;
    }

    @Override
    public List<PricedSeat> getEventSeats(long eventId, long chartId) {
        return seatCatalogFacade.listEventSeats(eventId, chartId).stream()
                .map(CatalogAdapter::toPricedSeat)
                .toList();
    }

    @Override
    public List<PricedSeat> findSeats(long eventId, Collection<Long> seatIds) {
        return seatCatalogFacade.findEventSeats(eventId, seatIds).stream()
                .map(CatalogAdapter::toPricedSeat)
                .toList();
    }

    private static PricedSeat toPricedSeat(CatalogSeat seat) {
        return new PricedSeat(
                seat.seatId(),
                seat.chartId(),
                seat.section(),
                seat.rowLabel(),
                seat.seatNumber(),
                seat.label(),
                seat.categoryName(),
                seat.categoryColor(),
                seat.price(),
                seat.available()
        );
    }
}
