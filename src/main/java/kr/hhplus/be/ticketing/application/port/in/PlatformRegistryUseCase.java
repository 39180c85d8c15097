package kr.hhplus.be.ticketing.application.port.in;

import kr.hhplus.be.ticketing.domain.common.Address;

import java.util.List;
import java.util.Optional;

public interface PlatformRegistryUseCase {

    record PlatformInfo(Address address, Address owner, int feeBps, Address paymentToken, boolean paused) {}

    // === 조직 ===
    Address createOrganization(Address caller);
    void transferOrganizationOwnership(Address caller, Address newOwner);

    // === 조직 전용 (호출자 = 등록된 조직 주소) ===
    void registerEvent(Address caller, Address event);
    void markEventAsClosed(Address caller, Address event);

    // === 관리자 전용 ===
    void setOrganizerStatus(Address caller, Address organizer, boolean allowed);
    void setOrganizationStatus(Address caller, Address organization, boolean active);
    void updatePlatformFee(Address caller, int feeBps);
    void updatePaymentToken(Address caller, Address token);
    void pause(Address caller);
    void unpause(Address caller);
    long withdrawPlatformFees(Address caller, Address token);

    // === 조회 ===
    PlatformInfo getPlatform();
    boolean isOrganization(Address address);
    boolean isAllowedOrganizer(Address address);
    Optional<Address> organizationOf(Address owner);
    Optional<Address> ownerOf(Address organization);
    List<Address> activeEvents();
    List<Address> pastEvents();
}
