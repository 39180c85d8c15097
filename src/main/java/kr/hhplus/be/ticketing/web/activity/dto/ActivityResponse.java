package kr.hhplus.be.ticketing.web.activity.dto;

import kr.hhplus.be.ticketing.application.event.TicketingActivity;
import kr.hhplus.be.ticketing.domain.common.Address;

import java.time.Instant;

public record ActivityResponse(
        String type,
        String subject,
        String actor,
        String counterparty,
        Long amount,
        Long fee,
        Long ticketId,
        String detail,
        Instant occurredAt
) {
    public static ActivityResponse from(TicketingActivity activity) {
        return new ActivityResponse(
                activity.type().name(),
                activity.subject().value(),
                valueOf(activity.actor()),
                valueOf(activity.counterparty()),
                activity.amount(),
                activity.fee(),
                activity.ticketId(),
                activity.detail(),
                activity.occurredAt()
        );
    }

    private static String valueOf(Address address) {
        return address != null ? address.value() : null;
    }
}
