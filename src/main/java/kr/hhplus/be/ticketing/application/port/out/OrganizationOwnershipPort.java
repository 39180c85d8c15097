package kr.hhplus.be.ticketing.application.port.out;

import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.platform.OrganizationOwnership;

import java.util.Optional;

/**
 * 레지스트리의 소유자 ↔ 조직 양방향 매핑
 * - 한 행이 한 쌍을 나타내며 owner, organization 각각 유일하다
 */
public interface OrganizationOwnershipPort {

    Optional<OrganizationOwnership> findByOwner(Address owner);

    Optional<OrganizationOwnership> findByOrganization(Address organization);

    boolean isOrganization(Address address);

    void save(OrganizationOwnership ownership);
}
