package kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.adapter;

import kr.hhplus.be.ticketing.application.port.out.OrganizationOwnershipPort;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.platform.OrganizationOwnership;
import kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.entity.OrganizationOwnershipJpaEntity;
import kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.repository.OrganizationOwnershipJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class OrganizationOwnershipJpaAdapter implements OrganizationOwnershipPort {

    private final OrganizationOwnershipJpaRepository repository;

    @Override
    public Optional<OrganizationOwnership> findByOwner(Address owner) {
        return repository.findByOwner(owner.value()).map(this::toDomain);
    }

    @Override
    public Optional<OrganizationOwnership> findByOrganization(Address organization) {
        return repository.findById(organization.value()).map(this::toDomain);
    }

    @Override
    public boolean isOrganization(Address address) {
        return repository.existsById(address.value());
    }

    @Override
    public void save(OrganizationOwnership ownership) {
        OrganizationOwnershipJpaEntity entity = repository.findById(ownership.organization().value())
                .orElseGet(() -> new OrganizationOwnershipJpaEntity(
                        ownership.organization().value(),
                        ownership.owner().value()
                ));
        entity.setOwner(ownership.owner().value());
        repository.save(entity);
    }

    private OrganizationOwnership toDomain(OrganizationOwnershipJpaEntity entity) {
        return new OrganizationOwnership(Address.of(entity.getOwner()), Address.of(entity.getOrganization()));
    }
}
