package kr.hhplus.be.ticketing.web.organization;

import kr.hhplus.be.ticketing.application.port.in.OrganizationUseCase;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.web.common.CallerHeader;
import kr.hhplus.be.ticketing.web.common.dto.AddressRequest;
import kr.hhplus.be.ticketing.web.common.dto.AmountResponse;
import kr.hhplus.be.ticketing.web.organization.dto.*;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/organizations/{organization}")
@RequiredArgsConstructor
@Validated
public class OrganizationController {

    private final OrganizationUseCase organizationUseCase;

    @GetMapping
    public ResponseEntity<OrganizationResponse> getOrganization(@PathVariable String organization) {
        Address address = Address.of(organization);
        return ResponseEntity.ok(OrganizationResponse.from(
                organizationUseCase.getOrganization(address),
                organizationUseCase.eventsOf(address)
        ));
    }

    @GetMapping("/events")
    public ResponseEntity<List<String>> eventsOf(@PathVariable String organization) {
        return ResponseEntity.ok(organizationUseCase.eventsOf(Address.of(organization)).stream()
                .map(Address::value)
                .toList());
    }

    @PutMapping("/banner")
    public ResponseEntity<Void> updateBanner(
            @RequestHeader(CallerHeader.NAME) String caller,
            @PathVariable String organization,
            @RequestBody @Validated BannerRequest request) {

        organizationUseCase.updateBanner(Address.of(caller), Address.of(organization), request.uri());
        return ResponseEntity.noContent().build();
    }

    // 이벤트 생성 API (팩토리 생성 + 레지스트리 등록)
    @PostMapping("/events")
    public ResponseEntity<CreateEventResponse> createEvent(
            @RequestHeader(CallerHeader.NAME) String caller,
            @PathVariable String organization,
            @RequestBody @Validated CreateEventRequest request) {

        var command = new OrganizationUseCase.CreateEventCommand(
                Address.of(caller),
                Address.of(organization),
                request.uri(),
                request.ticketPrice(),
                request.deadline(),
                request.maxSupply()
        );

        Address event = organizationUseCase.createEvent(command);
        return ResponseEntity.status(201).body(new CreateEventResponse(command.organization().value(), event.value()));
    }

    // 이벤트 마감 API (시리즈 마감 + 레지스트리 이동)
    @PostMapping("/events/{event}/close")
    public ResponseEntity<Void> closeEvent(
            @RequestHeader(CallerHeader.NAME) String caller,
            @PathVariable String organization,
            @PathVariable String event) {

        organizationUseCase.closeEvent(Address.of(caller), Address.of(organization), Address.of(event));
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/events/{event}/price")
    public ResponseEntity<Void> setTicketPrice(
            @RequestHeader(CallerHeader.NAME) String caller,
            @PathVariable String organization,
            @PathVariable String event,
            @RequestBody @Validated PriceRequest request) {

        organizationUseCase.setTicketPrice(Address.of(caller), Address.of(organization), Address.of(event), request.price());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/events/{event}/deadline")
    public ResponseEntity<Void> setDeadline(
            @RequestHeader(CallerHeader.NAME) String caller,
            @PathVariable String organization,
            @PathVariable String event,
            @RequestBody @Validated DeadlineRequest request) {

        organizationUseCase.setDeadline(Address.of(caller), Address.of(organization), Address.of(event), request.deadline());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/withdrawals")
    public ResponseEntity<AmountResponse> withdrawTokens(
            @RequestHeader(CallerHeader.NAME) String caller,
            @PathVariable String organization,
            @RequestBody @Validated AddressRequest request) {

        Address token = Address.of(request.address());
        long amount = organizationUseCase.withdrawTokens(Address.of(caller), Address.of(organization), token);
        return ResponseEntity.ok(new AmountResponse(token.value(), amount));
    }
}
