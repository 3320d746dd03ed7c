package com.cricverse.booking.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

/**
 * A scheduled match at a stadium, replicated from the event catalogue via Kafka.
 * Ids are assigned upstream, so persistence relies on {@link Persistable#isNew()}.
 */
@Entity
@Table(name = "events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Event implements Persistable<Long> {

    @Id
    private Long id;

    @Column(nullable = false)
    private Long stadiumId;

    @Column(nullable = false, length = 150)
    private String name;

    @Column(nullable = false)
    private LocalDateTime startsAt;

    @Transient
    private boolean isNew = true;

    public Event(Long id, Long stadiumId, String name, LocalDateTime startsAt) {
        this.id = id;
        this.stadiumId = stadiumId;
        this.name = name;
        this.startsAt = startsAt;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PostLoad
    @PrePersist
    void markNotNew() {
        this.isNew = false;
    }

    public void updateFrom(String name, LocalDateTime startsAt) {
        this.name = name;
        this.startsAt = startsAt;
    }
}
