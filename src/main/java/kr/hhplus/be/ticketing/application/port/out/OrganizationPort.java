package kr.hhplus.be.ticketing.application.port.out;

import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.organization.Organization;

import java.util.Optional;

public interface OrganizationPort {

    Optional<Organization> find(Address address);

    Optional<Organization> findForUpdate(Address address);

    void save(Organization organization);
}
