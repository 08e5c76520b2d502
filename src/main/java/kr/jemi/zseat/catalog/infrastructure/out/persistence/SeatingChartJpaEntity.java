package kr.jemi.zseat.catalog.infrastructure.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

@Entity
@Table(name = "seating_charts", indexes = @Index(name = "idx_seating_charts_event_id", columnList = "event_id"))
public class SeatingChartJpaEntity {

    @Id
    private Long id;

    @Column(name = "venue_id", nullable = false)
    private long venueId;

    @Column(name = "event_id")
    private Long eventId;

    @Column(nullable = false)
    private String name;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    protected SeatingChartJpaEntity() {}

    public SeatingChartJpaEntity(Long id, long venueId, Long eventId, String name, boolean active) {
        this.id = id;
        this.venueId = venueId;
        this.eventId = eventId;
        this.name = name;
        this.active = active;
    }

    public Long getId() { return id; }
    public long getVenueId() { return venueId; }
    public Long getEventId() { return eventId; }
    public String getName() { return name; }
    public boolean isActive() { return active; }
}
