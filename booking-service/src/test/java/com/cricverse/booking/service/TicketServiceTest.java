package com.cricverse.booking.service;

import com.cricverse.booking.TestFixtures;
import com.cricverse.booking.config.BookingProperties;
import com.cricverse.booking.domain.Ticket;
import com.cricverse.booking.domain.TicketStatus;
import com.cricverse.booking.event.producer.BookingEventProducer;
import com.cricverse.booking.jooq.SeatAvailabilityJooqRepository;
import com.cricverse.booking.repository.CustomerRepository;
import com.cricverse.booking.repository.TicketLocation;
import com.cricverse.booking.repository.TicketRepository;
import com.cricverse.common.exception.BusinessException;
import com.cricverse.common.response.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TicketServiceTest {

    private static final Long HOLDER = 7L;
    private static final Long RECIPIENT = 8L;
    private static final Long EVENT_ID = 3L;
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 20, 18, 45);

    @Mock private TicketRepository ticketRepository;
    @Mock private CustomerRepository customerRepository;
    @Mock private SeatAvailabilityJooqRepository seatLedger;
    @Mock private BookingEventProducer bookingEventProducer;

    private TicketService ticketService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        ticketService = new TicketService(ticketRepository, customerRepository, seatLedger,
                bookingEventProducer, new BookingProperties(), clock);
    }

    @Test
    void cancelTicket_locksSeatBeforeTicketAndFreesSeat() {
        Ticket ticket = TestFixtures.createTicket(500L, 11L, EVENT_ID, 101L, HOLDER);
        givenLocation(ticket);
        when(ticketRepository.findByIdForUpdate(500L)).thenReturn(Optional.of(ticket));
        when(seatLedger.freeBooked(EVENT_ID, List.of(101L), 11L, NOW)).thenReturn(1);

        Ticket cancelled = ticketService.cancelTicket(500L, HOLDER);

        assertThat(cancelled.getStatus()).isEqualTo(TicketStatus.CANCELLED);
        InOrder order = inOrder(seatLedger, ticketRepository, bookingEventProducer);
        order.verify(seatLedger).lockForUpdate(EVENT_ID, List.of(101L));
        order.verify(ticketRepository).findByIdForUpdate(500L);
        order.verify(seatLedger).freeBooked(EVENT_ID, List.of(101L), 11L, NOW);
        order.verify(bookingEventProducer).publishTicketCancelled(ticket);
    }

    @Test
    void cancelTicket_notHolder_forbidden() {
        Ticket ticket = TestFixtures.createTicket(500L, 11L, EVENT_ID, 101L, HOLDER);
        givenLocation(ticket);
        when(ticketRepository.findByIdForUpdate(500L)).thenReturn(Optional.of(ticket));

        assertThatThrownBy(() -> ticketService.cancelTicket(500L, RECIPIENT))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.FORBIDDEN));
        assertThat(ticket.getStatus()).isEqualTo(TicketStatus.VALID);
        verify(seatLedger, never()).freeBooked(any(), anyList(), any(), any());
    }

    @Test
    void cancelTicket_usedTicket_rejected() {
        Ticket ticket = TestFixtures.createTicket(500L, 11L, EVENT_ID, 101L, HOLDER);
        ticket.markUsed(NOW.minusMinutes(5));
        givenLocation(ticket);
        when(ticketRepository.findByIdForUpdate(500L)).thenReturn(Optional.of(ticket));

        assertThatThrownBy(() -> ticketService.cancelTicket(500L, HOLDER))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_TICKET_STATE));
    }

    @Test
    void cancelTicket_seatNotBooked_rejected() {
        Ticket ticket = TestFixtures.createTicket(500L, 11L, EVENT_ID, 101L, HOLDER);
        givenLocation(ticket);
        when(ticketRepository.findByIdForUpdate(500L)).thenReturn(Optional.of(ticket));
        when(seatLedger.freeBooked(EVENT_ID, List.of(101L), 11L, NOW)).thenReturn(0);

        assertThatThrownBy(() -> ticketService.cancelTicket(500L, HOLDER))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("is not booked");
        verify(bookingEventProducer, never()).publishTicketCancelled(any());
    }

    @Test
    void cancelTicket_unknown_throwsNotFound() {
        when(ticketRepository.findLocationById(999L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> ticketService.cancelTicket(999L, HOLDER))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.TICKET_NOT_FOUND));
    }

    @Test
    void transferTicket_retiresOldTicketAndIssuesReplacement() {
        Ticket ticket = TestFixtures.createTicket(500L, 11L, EVENT_ID, 101L, HOLDER);
        when(customerRepository.existsById(RECIPIENT)).thenReturn(true);
        when(ticketRepository.findByIdForUpdate(500L)).thenReturn(Optional.of(ticket));
        when(ticketRepository.save(any(Ticket.class))).thenAnswer(inv -> {
            Ticket saved = inv.getArgument(0);
            TestFixtures.setEntityId(saved, 501L);
            return saved;
        });

        Ticket replacement = ticketService.transferTicket(500L, HOLDER, RECIPIENT);

        assertThat(ticket.getStatus()).isEqualTo(TicketStatus.TRANSFERRED);
        assertThat(replacement.getId()).isEqualTo(501L);
        assertThat(replacement.getCustomerId()).isEqualTo(RECIPIENT);
        assertThat(replacement.getSeatId()).isEqualTo(101L);
        assertThat(replacement.getStatus()).isEqualTo(TicketStatus.VALID);

        InOrder order = inOrder(ticketRepository, bookingEventProducer);
        order.verify(ticketRepository).flush();
        order.verify(ticketRepository).save(replacement);
        order.verify(bookingEventProducer).publishTicketTransferred(ticket, replacement);
        verify(seatLedger, never()).freeBooked(any(), anyList(), any(), any());
    }

    @Test
    void transferTicket_toSelf_rejected() {
        assertThatThrownBy(() -> ticketService.transferTicket(500L, HOLDER, HOLDER))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_INPUT));
    }

    @Test
    void transferTicket_unknownRecipient_rejected() {
        when(customerRepository.existsById(RECIPIENT)).thenReturn(false);

        assertThatThrownBy(() -> ticketService.transferTicket(500L, HOLDER, RECIPIENT))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.CUSTOMER_NOT_FOUND));
        verify(ticketRepository, never()).findByIdForUpdate(any());
    }

    @Test
    void admit_marksTicketUsedOnce() {
        Ticket ticket = TestFixtures.createTicket(500L, 11L, EVENT_ID, 101L, HOLDER);
        when(ticketRepository.findByIdForUpdate(500L)).thenReturn(Optional.of(ticket));

        Ticket admitted = ticketService.admit(500L);

        assertThat(admitted.getStatus()).isEqualTo(TicketStatus.USED);
        assertThat(admitted.getUsedAt()).isEqualTo(NOW);
        assertThatThrownBy(() -> ticketService.admit(500L))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("current status=USED");
    }

    @Test
    void getTicket_otherCustomer_forbidden() {
        Ticket ticket = TestFixtures.createTicket(500L, 11L, EVENT_ID, 101L, HOLDER);
        when(ticketRepository.findById(500L)).thenReturn(Optional.of(ticket));

        assertThatThrownBy(() -> ticketService.getTicket(500L, RECIPIENT))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.FORBIDDEN));
    }

    private void givenLocation(Ticket ticket) {
        when(ticketRepository.findLocationById(ticket.getId())).thenReturn(Optional.of(
                new TicketLocation(ticket.getId(), ticket.getEventId(), ticket.getSeatId(), ticket.getBookingId())));
    }
}
