package kr.jemi.zseat.inventory.domain;

import kr.jemi.zseat.inventory.domain.exception.InsufficientAvailabilityException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 좌석 현황에서 조건에 맞는 최적 좌석을 고른다. 상태를 바꾸지 않는다.
 *
 * <p>붙어 앉기를 원하면 같은 구역/열에서 좌석 번호가 연속된 구간을 찾는다.
 * 구간 비교는 총액이 낮은 순, 첫 좌석 ID가 작은 순이다.
 * 그런 구간이 없으면 가장 싼 좌석부터 수량만큼 고르며, 가격이 같으면 좌석 ID가 작은 것을 먼저 고른다.
 */
public final class BestAvailableSeatSelector {

    private static final Comparator<SeatView> CHEAPEST_FIRST =
            Comparator.comparing(SeatView::price).thenComparingLong(SeatView::seatId);

    private BestAvailableSeatSelector() {}

    public static List<SeatView> select(List<SeatView> seats, SelectionCriteria criteria) {
        List<SeatView> candidates = seats.stream()
                .filter(criteria::accepts)
                .toList();
        if (candidates.size() < criteria.quantity()) {
            throw new InsufficientAvailabilityException(criteria.quantity(), candidates.size());
        }

        if (criteria.preferTogether()) {
            Optional<Window> best = bestWindow(candidates, criteria.quantity());
            if (best.isPresent()) {
                return best.get().seats();
            }
        }

        return candidates.stream()
                .sorted(CHEAPEST_FIRST)
                .limit(criteria.quantity())
                .sorted(Comparator.comparingLong(SeatView::seatId))
                .toList();
    }

    private static Optional<Window> bestWindow(List<SeatView> candidates, int quantity) {
        Map<RowKey, List<SeatView>> rows = candidates.stream()
                .collect(Collectors.groupingBy(RowKey::of, LinkedHashMap::new, Collectors.toList()));

        List<Window> windows = new ArrayList<>();
        rows.values().forEach(rowSeats -> {
            List<SeatView> sorted = rowSeats.stream()
                    .sorted(Comparator.comparingInt((SeatView v) -> v.seat().seatNumber())
                            .thenComparingLong(SeatView::seatId))
                    .toList();
            for (int start = 0; start + quantity <= sorted.size(); start++) {
                List<SeatView> slice = sorted.subList(start, start + quantity);
                if (isConsecutive(slice)) {
                    windows.add(Window.of(slice));
                }
            }
        });

        return windows.stream().min(Window.ORDER);
    }

    private static boolean isConsecutive(List<SeatView> slice) {
        for (int i = 1; i < slice.size(); i++) {
            if (slice.get(i).seat().seatNumber() != slice.get(i - 1).seat().seatNumber() + 1) {
                return false;
            }
        }
        return true;
    }

    private record RowKey(String section, String rowLabel) {

        static RowKey of(SeatView view) {
            return new RowKey(view.seat().section(), view.seat().rowLabel());
        }
    }

    private record Window(List<SeatView> seats, BigDecimal totalPrice, long firstSeatId) {

        /**
         * 총 가격이 낮은 순, 같으면 첫 좌석 ID가 작은 순. 열 중앙에 가까운 좌석을 우선하는 기준은 일부러 두지 않았다.
         */
        static final Comparator<Window> ORDER = Comparator.comparing(Window::totalPrice)
                .thenComparingLong(Window::firstSeatId);

        static Window of(List<SeatView> seats) {
            BigDecimal total = seats.stream().map(SeatView::price).reduce(BigDecimal.ZERO, BigDecimal::add);
            long firstSeatId = seats.stream().mapToLong(SeatView::seatId).min().orElseThrow();
            return new Window(List.copyOf(seats), total, firstSeatId);
        }
    }
}
