package com.cricverse.booking.domain;

import com.cricverse.common.domain.BaseTimeEntity;
import com.cricverse.common.exception.BusinessException;
import com.cricverse.common.response.ErrorCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Admission to one seat at one event. Only VALID tickets admit entry.
 */
@Entity
@Table(name = "tickets")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Ticket extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long bookingId;

    @Column(nullable = false)
    private Long eventId;

    @Column(nullable = false)
    private Long seatId;

    @Column(nullable = false)
    private Long customerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TicketStatus status;

    @Column(nullable = false, length = 20)
    private String accessGate;

    private LocalDateTime usedAt;

    @Builder
    private Ticket(Long bookingId, Long eventId, Long seatId, Long customerId, String accessGate) {
        this.bookingId = bookingId;
        this.eventId = eventId;
        this.seatId = seatId;
        this.customerId = customerId;
        this.accessGate = accessGate;
        this.status = TicketStatus.VALID;
    }

    public void markUsed(LocalDateTime now) {
        requireValid("use");
        this.status = TicketStatus.USED;
        this.usedAt = now;
    }

    public void cancel() {
        requireValid("cancel");
        this.status = TicketStatus.CANCELLED;
    }

    /**
     * Retires this ticket and returns the replacement issued to the recipient.
     */
    public Ticket transferTo(Long recipientId) {
        requireValid("transfer");
        this.status = TicketStatus.TRANSFERRED;
        return Ticket.builder()
                .bookingId(bookingId)
                .eventId(eventId)
                .seatId(seatId)
                .customerId(recipientId)
                .accessGate(accessGate)
                .build();
    }

    public boolean isOwnedBy(Long customerId) {
        return this.customerId.equals(customerId);
    }

    private void requireValid(String action) {
        if (this.status != TicketStatus.VALID) {
            throw new BusinessException(ErrorCode.INVALID_TICKET_STATE,
                    "Cannot " + action + " ticket " + id + ": current status=" + status);
        }
    }
}
