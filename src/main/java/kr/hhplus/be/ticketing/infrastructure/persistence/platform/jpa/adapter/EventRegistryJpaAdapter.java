package kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.adapter;

import kr.hhplus.be.ticketing.application.port.out.EventRegistryPort;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.platform.EventRegistrationStatus;
import kr.hhplus.be.ticketing.domain.platform.RegisteredEvent;
import kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.entity.RegisteredEventJpaEntity;
import kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.repository.RegisteredEventJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 레지스트리의 활성/지난 이벤트 목록
 * - 이벤트 하나는 한 행이며 status 로 어느 목록에 속하는지 구분한다 (두 목록 동시 소속 불가)
 */
@Component
@RequiredArgsConstructor
public class EventRegistryJpaAdapter implements EventRegistryPort {

    private final RegisteredEventJpaRepository repository;

    @Override
    public Optional<RegisteredEvent> find(Address event) {
        return repository.findById(event.value()).map(this::toDomain);
    }

    @Override
    public List<Address> findByStatus(EventRegistrationStatus status) {
        return repository.findByStatusOrderByRegisteredAtAsc(status).stream()
                .map(entity -> Address.of(entity.getEvent()))
                .toList();
    }

    @Override
    public List<RegisteredEvent> findByOrganization(Address organization) {
        return repository.findByOrganizationOrderByRegisteredAtAsc(organization.value()).stream()
                .map(this::toDomain)
                .toList();
    }

    @Override
    public void save(RegisteredEvent event) {
        RegisteredEventJpaEntity entity = repository.findById(event.getEvent().value())
                .orElseGet(() -> new RegisteredEventJpaEntity(
                        event.getEvent().value(),
                        event.getOrganization().value(),
                        event.getStatus(),
                        event.getRegisteredAt(),
                        event.getClosedAt()
                ));
        entity.updateStatus(event.getStatus(), event.getClosedAt());
        repository.save(entity);
    }

    private RegisteredEvent toDomain(RegisteredEventJpaEntity entity) {
        return RegisteredEvent.restore(
                Address.of(entity.getEvent()),
                Address.of(entity.getOrganization()),
                entity.getStatus(),
                entity.getRegisteredAt(),
                entity.getClosedAt()
        );
    }
}
