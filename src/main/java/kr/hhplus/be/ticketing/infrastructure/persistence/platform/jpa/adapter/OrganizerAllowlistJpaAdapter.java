package kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.adapter;

import kr.hhplus.be.ticketing.application.port.out.OrganizerAllowlistPort;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.entity.OrganizerAllowlistJpaEntity;
import kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.repository.OrganizerAllowlistJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class OrganizerAllowlistJpaAdapter implements OrganizerAllowlistPort {

    private final OrganizerAllowlistJpaRepository repository;

    @Override
    public boolean isAllowed(Address organizer) {
        return repository.existsByOrganizerAndAllowedTrue(organizer.value());
    }

    @Override
    public void setAllowed(Address organizer, boolean allowed) {
        OrganizerAllowlistJpaEntity entity = repository.findById(organizer.value())
                .orElseGet(() -> new OrganizerAllowlistJpaEntity(organizer.value(), allowed));
        entity.setAllowed(allowed);
        repository.save(entity);
    }
}
