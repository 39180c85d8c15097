package kr.hhplus.be.ticketing.application.port.out;

import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.platform.EventRegistrationStatus;
import kr.hhplus.be.ticketing.domain.platform.RegisteredEvent;

import java.util.List;
import java.util.Optional;

public interface EventRegistryPort {

    Optional<RegisteredEvent> find(Address event);

    List<Address> findByStatus(EventRegistrationStatus status);

    List<RegisteredEvent> findByOrganization(Address organization);

    void save(RegisteredEvent event);
}
