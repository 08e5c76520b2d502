package kr.jemi.zseat.catalog.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zseat.common.validation.SelfValidating;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 좌석과 카테고리를 ID 색인 컬렉션으로 따로 보관하는 배치도 스냅샷.
 */
public class SeatingChart implements SelfValidating {

    private final long id;
    private final long venueId;
    private final Long eventId;
    @NotBlank
    private final String name;
    private final boolean active;
    @NotNull
    private final Map<Long, Seat> seats;
    @NotNull
    private final Map<Long, SeatCategory> categories;

    public SeatingChart(long id, long venueId, Long eventId, String name, boolean active,
                        Collection<Seat> seats, Collection<SeatCategory> categories) {
        this.id = id;
        this.venueId = venueId;
        this.eventId = eventId;
        this.name = name;
        this.active = active;
        this.seats = seats == null ? null
                : seats.stream().collect(Collectors.toUnmodifiableMap(Seat::id, Function.identity()));
        this.categories = categories == null ? null
                : categories.stream().collect(Collectors.toUnmodifiableMap(SeatCategory::id, Function.identity()));
        validateSelf();
        validateMembership();
    }

    private void validateMembership() {
        for (Seat seat : seats.values()) {
            if (seat.chartId() != id) {
                throw new IllegalArgumentException("다른 배치도의 좌석입니다: seatId=" + seat.id());
            }
            if (seat.categoryId() != null && !categories.containsKey(seat.categoryId())) {
                throw new IllegalArgumentException("배치도에 없는 카테고리입니다: categoryId=" + seat.categoryId());
            }
        }
    }

    public Optional<Seat> seat(long seatId) {
        return Optional.ofNullable(seats.get(seatId));
    }

    public Optional<SeatCategory> category(Long categoryId) {
        return categoryId == null ? Optional.empty() : Optional.ofNullable(categories.get(categoryId));
    }

    public List<Seat> seats() {
        return seats.values().stream()
                .sorted(Comparator.comparing(Seat::id))
                .toList();
    }

    public List<SeatCategory> categoriesInOrder() {
        return categories.values().stream()
                .sorted(Comparator.comparingInt(SeatCategory::sortOrder).thenComparing(SeatCategory::id))
                .toList();
    }

    public long getId() {
        return id;
    }

    public long getVenueId() {
        return venueId;
    }

    public Long getEventId() {
        return eventId;
    }

    public String getName() {
        return name;
    }

    public boolean isActive() {
        return active;
    }
}
