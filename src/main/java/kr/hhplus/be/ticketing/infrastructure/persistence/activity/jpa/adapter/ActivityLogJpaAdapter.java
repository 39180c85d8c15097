package kr.hhplus.be.ticketing.infrastructure.persistence.activity.jpa.adapter;

import kr.hhplus.be.ticketing.application.event.TicketingActivity;
import kr.hhplus.be.ticketing.application.port.out.ActivityLogPort;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.infrastructure.persistence.activity.jpa.entity.TicketingActivityJpaEntity;
import kr.hhplus.be.ticketing.infrastructure.persistence.activity.jpa.repository.TicketingActivityJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class ActivityLogJpaAdapter implements ActivityLogPort {

    private final TicketingActivityJpaRepository repository;

    @Override
    public void save(TicketingActivity activity) {
        repository.save(new TicketingActivityJpaEntity(
                activity.type(),
                activity.subject().value(),
                valueOf(activity.actor()),
                valueOf(activity.counterparty()),
                activity.amount(),
                activity.fee(),
                activity.ticketId(),
                activity.detail(),
                activity.occurredAt()
        ));
    }

    @Override
    public List<TicketingActivity> findRecentBySubject(Address subject, int limit) {
        return repository.findBySubjectOrderByIdDesc(subject.value(), PageRequest.of(0, limit)).stream()
                .map(this::toActivity)
                .toList();
    }

    private TicketingActivity toActivity(TicketingActivityJpaEntity entity) {
        return TicketingActivity.builder()
                .type(entity.getType())
                .subject(Address.of(entity.getSubject()))
                .actor(addressOf(entity.getActor()))
                .counterparty(addressOf(entity.getCounterparty()))
                .amount(entity.getAmount())
                .fee(entity.getFee())
                .ticketId(entity.getTicketId())
                .detail(entity.getDetail())
                .occurredAt(entity.getOccurredAt())
                .build();
    }

    private static String valueOf(Address address) {
        return address != null ? address.value() : null;
    }

    private static Address addressOf(String value) {
        return value != null ? Address.of(value) : null;
    }
}
