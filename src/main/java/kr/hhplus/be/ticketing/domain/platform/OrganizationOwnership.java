package kr.hhplus.be.ticketing.domain.platform;

import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.common.exception.ValidationException;

/**
 * 레지스트리가 관리하는 소유자 ↔ 조직 매핑의 한 쌍
 * - 소유자당 조직 하나, 조직당 소유자 하나
 */
public record OrganizationOwnership(Address owner, Address organization) {

    public OrganizationOwnership {
        if (owner == null || owner.isZero()) throw ValidationException.zeroAddress("owner");
        if (organization == null || organization.isZero()) throw ValidationException.zeroAddress("organization");
    }

    public OrganizationOwnership withOwner(Address newOwner) {
        return new OrganizationOwnership(newOwner, organization);
    }
}
