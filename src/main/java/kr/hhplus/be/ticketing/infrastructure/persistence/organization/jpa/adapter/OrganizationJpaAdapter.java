package kr.hhplus.be.ticketing.infrastructure.persistence.organization.jpa.adapter;

import kr.hhplus.be.ticketing.application.port.out.OrganizationPort;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.organization.Organization;
import kr.hhplus.be.ticketing.infrastructure.persistence.organization.jpa.entity.OrganizationJpaEntity;
import kr.hhplus.be.ticketing.infrastructure.persistence.organization.jpa.repository.OrganizationJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class OrganizationJpaAdapter implements OrganizationPort {

    private final OrganizationJpaRepository repository;

    @Override
    public Optional<Organization> find(Address address) {
        return repository.findById(address.value()).map(this::toDomain);
    }

    @Override
    public Optional<Organization> findForUpdate(Address address) {
        return repository.findForUpdate(address.value()).map(this::toDomain);
    }

    @Override
    public void save(Organization organization) {
        OrganizationJpaEntity entity = repository.findById(organization.getAddress().value())
                .orElseGet(() -> new OrganizationJpaEntity(
                        organization.getAddress().value(),
                        organization.getPlatform().value(),
                        organization.getOwner().value(),
                        organization.getBannerUri(),
                        organization.isPaused(),
                        organization.getCreatedAt()
                ));

        entity.apply(organization.getOwner().value(), organization.getBannerUri(), organization.isPaused());
        repository.save(entity);
    }

    private Organization toDomain(OrganizationJpaEntity entity) {
        return Organization.restore(
                Address.of(entity.getAddress()),
                Address.of(entity.getPlatform()),
                Address.of(entity.getOwner()),
                entity.getBannerUri(),
                entity.isPaused(),
                entity.getCreatedAt(),
                entity.getVersion()
        );
    }
}
