package com.cricverse.common.config;

import com.cricverse.common.event.Topics;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaAdmin;

/**
 * Auto-creates Kafka topics and their dead-letter topics.
 * Only activates when spring.kafka.bootstrap-servers is configured.
 */
@AutoConfiguration
@ConditionalOnClass(KafkaAdmin.class)
@ConditionalOnProperty(name = "spring.kafka.bootstrap-servers")
public class KafkaTopicConfig {

    private static final short REPLICATION_FACTOR = 1;

    // -- Booking topics: 8 partitions (keyed by event id, seat-level concurrency) --

    @Bean
    public NewTopic bookingReservedTopic() {
        return buildTopic(Topics.BOOKING_RESERVED, Topics.PARTITIONS_BOOKING);
    }

    @Bean
    public NewTopic bookingReservedDlt() {
        return buildDlt(Topics.BOOKING_RESERVED, Topics.PARTITIONS_BOOKING);
    }

    @Bean
    public NewTopic bookingConfirmedTopic() {
        return buildTopic(Topics.BOOKING_CONFIRMED, Topics.PARTITIONS_BOOKING);
    }

    @Bean
    public NewTopic bookingConfirmedDlt() {
        return buildDlt(Topics.BOOKING_CONFIRMED, Topics.PARTITIONS_BOOKING);
    }

    @Bean
    public NewTopic bookingReleasedTopic() {
        return buildTopic(Topics.BOOKING_RELEASED, Topics.PARTITIONS_BOOKING);
    }

    @Bean
    public NewTopic bookingReleasedDlt() {
        return buildDlt(Topics.BOOKING_RELEASED, Topics.PARTITIONS_BOOKING);
    }

    // -- Seat topics: 8 partitions (same key as booking) --

    @Bean
    public NewTopic seatStatusChangedTopic() {
        return buildTopic(Topics.SEAT_STATUS_CHANGED, Topics.PARTITIONS_SEAT);
    }

    @Bean
    public NewTopic seatStatusChangedDlt() {
        return buildDlt(Topics.SEAT_STATUS_CHANGED, Topics.PARTITIONS_SEAT);
    }

    // -- Ticket topics: 6 partitions --

    @Bean
    public NewTopic ticketIssuedTopic() {
        return buildTopic(Topics.TICKET_ISSUED, Topics.PARTITIONS_TICKET);
    }

    @Bean
    public NewTopic ticketIssuedDlt() {
        return buildDlt(Topics.TICKET_ISSUED, Topics.PARTITIONS_TICKET);
    }

    @Bean
    public NewTopic ticketCancelledTopic() {
        return buildTopic(Topics.TICKET_CANCELLED, Topics.PARTITIONS_TICKET);
    }

    @Bean
    public NewTopic ticketCancelledDlt() {
        return buildDlt(Topics.TICKET_CANCELLED, Topics.PARTITIONS_TICKET);
    }

    @Bean
    public NewTopic ticketTransferredTopic() {
        return buildTopic(Topics.TICKET_TRANSFERRED, Topics.PARTITIONS_TICKET);
    }

    @Bean
    public NewTopic ticketTransferredDlt() {
        return buildDlt(Topics.TICKET_TRANSFERRED, Topics.PARTITIONS_TICKET);
    }

    // -- Payment topics: 6 partitions (inbound webhook bridge) --

    @Bean
    public NewTopic paymentCompletedTopic() {
        return buildTopic(Topics.PAYMENT_COMPLETED, Topics.PARTITIONS_PAYMENT);
    }

    @Bean
    public NewTopic paymentCompletedDlt() {
        return buildDlt(Topics.PAYMENT_COMPLETED, Topics.PARTITIONS_PAYMENT);
    }

    @Bean
    public NewTopic paymentFailedTopic() {
        return buildTopic(Topics.PAYMENT_FAILED, Topics.PARTITIONS_PAYMENT);
    }

    @Bean
    public NewTopic paymentFailedDlt() {
        return buildDlt(Topics.PAYMENT_FAILED, Topics.PARTITIONS_PAYMENT);
    }

    // -- Event catalogue topics: 3 partitions (low frequency) --

    @Bean
    public NewTopic eventScheduledTopic() {
        return buildTopic(Topics.EVENT_SCHEDULED, Topics.PARTITIONS_EVENT);
    }

    @Bean
    public NewTopic eventScheduledDlt() {
        return buildDlt(Topics.EVENT_SCHEDULED, Topics.PARTITIONS_EVENT);
    }

    private NewTopic buildTopic(String name, int partitions) {
        return TopicBuilder.name(name)
                .partitions(partitions)
                .replicas(REPLICATION_FACTOR)
                .build();
    }

    private NewTopic buildDlt(String name, int partitions) {
        return TopicBuilder.name(Topics.dlt(name))
                .partitions(partitions)
                .replicas(REPLICATION_FACTOR)
                .build();
    }
}
