package kr.hhplus.be.ticketing.web.platform;

import kr.hhplus.be.ticketing.application.port.in.PlatformRegistryUseCase;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.web.common.CallerHeader;
import kr.hhplus.be.ticketing.web.common.dto.AddressRequest;
import kr.hhplus.be.ticketing.web.common.dto.AmountResponse;
import kr.hhplus.be.ticketing.web.platform.dto.*;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/platform")
@RequiredArgsConstructor
@Validated
public class PlatformController {

    private final PlatformRegistryUseCase platformRegistryUseCase;

    // ===== 조직 =====

    @PostMapping("/organizations")
    public ResponseEntity<OrganizationLookupResponse> createOrganization(
            @RequestHeader(CallerHeader.NAME) String caller) {

        Address owner = Address.of(caller);
        Address organization = platformRegistryUseCase.createOrganization(owner);
        return ResponseEntity.status(201)
                .body(new OrganizationLookupResponse(owner.value(), organization.value(), true));
    }

    @PostMapping("/organizations/ownership-transfer")
    public ResponseEntity<Void> transferOrganizationOwnership(
            @RequestHeader(CallerHeader.NAME) String caller,
            @RequestBody @Validated AddressRequest request) {

        platformRegistryUseCase.transferOrganizationOwnership(Address.of(caller), Address.of(request.address()));
        return ResponseEntity.noContent().build();
    }

    // 이벤트 등록/종료 처리는 조직 API(/api/organizations/{org}/events)를 통해서만 일어난다

    // ===== 관리자 =====

    @PutMapping("/organizers/{organizer}")
    public ResponseEntity<Void> setOrganizerStatus(
            @RequestHeader(CallerHeader.NAME) String caller,
            @PathVariable String organizer,
            @RequestBody @Validated StatusRequest request) {

        platformRegistryUseCase.setOrganizerStatus(Address.of(caller), Address.of(organizer), request.enabled());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/organizations/{organization}/status")
    public ResponseEntity<Void> setOrganizationStatus(
            @RequestHeader(CallerHeader.NAME) String caller,
            @PathVariable String organization,
            @RequestBody @Validated StatusRequest request) {

        platformRegistryUseCase.setOrganizationStatus(Address.of(caller), Address.of(organization), request.enabled());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/fee")
    public ResponseEntity<Void> updatePlatformFee(
            @RequestHeader(CallerHeader.NAME) String caller,
            @RequestBody @Validated FeeRequest request) {

        platformRegistryUseCase.updatePlatformFee(Address.of(caller), request.feeBps());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/payment-token")
    public ResponseEntity<Void> updatePaymentToken(
            @RequestHeader(CallerHeader.NAME) String caller,
            @RequestBody @Validated AddressRequest request) {

        platformRegistryUseCase.updatePaymentToken(Address.of(caller), Address.of(request.address()));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/pause")
    public ResponseEntity<Void> pause(@RequestHeader(CallerHeader.NAME) String caller) {
        platformRegistryUseCase.pause(Address.of(caller));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/unpause")
    public ResponseEntity<Void> unpause(@RequestHeader(CallerHeader.NAME) String caller) {
        platformRegistryUseCase.unpause(Address.of(caller));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/withdrawals")
    public ResponseEntity<AmountResponse> withdrawPlatformFees(
            @RequestHeader(CallerHeader.NAME) String caller,
            @RequestBody @Validated AddressRequest request) {

        long amount = platformRegistryUseCase.withdrawPlatformFees(Address.of(caller), Address.of(request.address()));
        return ResponseEntity.ok(new AmountResponse(Address.of(request.address()).value(), amount));
    }

    // ===== 조회 =====

    @GetMapping
    public ResponseEntity<PlatformResponse> getPlatform() {
        return ResponseEntity.ok(PlatformResponse.from(platformRegistryUseCase.getPlatform()));
    }

    @GetMapping("/owners/{owner}/organization")
    public ResponseEntity<OrganizationLookupResponse> organizationOf(@PathVariable String owner) {
        Address ownerAddress = Address.of(owner);
        return ResponseEntity.ok(platformRegistryUseCase.organizationOf(ownerAddress)
                .map(org -> new OrganizationLookupResponse(ownerAddress.value(), org.value(), true))
                .orElse(new OrganizationLookupResponse(ownerAddress.value(), null, false)));
    }

    @GetMapping("/organizations/{organization}/owner")
    public ResponseEntity<OrganizationLookupResponse> ownerOf(@PathVariable String organization) {
        Address orgAddress = Address.of(organization);
        return ResponseEntity.ok(platformRegistryUseCase.ownerOf(orgAddress)
                .map(owner -> new OrganizationLookupResponse(owner.value(), orgAddress.value(), true))
                .orElse(new OrganizationLookupResponse(null, orgAddress.value(),
                        platformRegistryUseCase.isOrganization(orgAddress))));
    }

    @GetMapping("/organizers/{organizer}")
    public ResponseEntity<Map<String, Boolean>> isAllowedOrganizer(@PathVariable String organizer) {
        return ResponseEntity.ok(Map.of("allowed", platformRegistryUseCase.isAllowedOrganizer(Address.of(organizer))));
    }

    @GetMapping("/events/active")
    public ResponseEntity<List<String>> activeEvents() {
        return ResponseEntity.ok(platformRegistryUseCase.activeEvents().stream().map(Address::value).toList());
    }

    @GetMapping("/events/past")
    public ResponseEntity<List<String>> pastEvents() {
        return ResponseEntity.ok(platformRegistryUseCase.pastEvents().stream().map(Address::value).toList());
    }
}
