package kr.hhplus.be.ticketing.web.event;

import kr.hhplus.be.ticketing.application.port.in.TicketSeriesUseCase;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.web.common.CallerHeader;
import kr.hhplus.be.ticketing.web.common.dto.AddressRequest;
import kr.hhplus.be.ticketing.web.event.dto.*;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/events/{event}")
@RequiredArgsConstructor
@Validated
public class EventController {

    private final TicketSeriesUseCase ticketSeriesUseCase;

    @GetMapping
    public ResponseEntity<SeriesResponse> getSeries(@PathVariable String event) {
        return ResponseEntity.ok(SeriesResponse.from(ticketSeriesUseCase.getSeries(Address.of(event))));
    }

    // 티켓 발행(구매) API
    @PostMapping("/tickets")
    public ResponseEntity<MintResponse> mint(
            @RequestHeader(CallerHeader.NAME) String caller,
            @PathVariable String event) {

        Address eventAddress = Address.of(event);
        var result = ticketSeriesUseCase.mint(Address.of(caller), eventAddress);
        return ResponseEntity.status(201)
                .body(new MintResponse(eventAddress.value(), result.ticketId(), result.fee(), result.remainder()));
    }

    // 재판매 API (구매자 결제 후 소유권 이전)
    @PostMapping("/tickets/{ticketId}/resell")
    public ResponseEntity<Void> resell(
            @RequestHeader(CallerHeader.NAME) String caller,
            @PathVariable String event,
            @PathVariable long ticketId,
            @RequestBody @Validated ResellRequest request) {

        ticketSeriesUseCase.resell(new TicketSeriesUseCase.ResellCommand(
                Address.of(caller),
                Address.of(event),
                ticketId,
                Address.of(request.to()),
                request.price()
        ));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/tickets/{ticketId}/transfer")
    public ResponseEntity<Void> transferTicket(
            @RequestHeader(CallerHeader.NAME) String caller,
            @PathVariable String event,
            @PathVariable long ticketId,
            @RequestBody @Validated AddressRequest request) {

        ticketSeriesUseCase.transferTicket(new TicketSeriesUseCase.TransferCommand(
                Address.of(caller),
                Address.of(event),
                ticketId,
                Address.of(request.address())
        ));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/tickets/{ticketId}")
    public ResponseEntity<TicketResponse> getTicket(
            @PathVariable String event,
            @PathVariable long ticketId) {

        Address eventAddress = Address.of(event);
        return ResponseEntity.ok(new TicketResponse(
                eventAddress.value(),
                ticketId,
                ticketSeriesUseCase.ownerOf(eventAddress, ticketId).value(),
                ticketSeriesUseCase.tokenUri(eventAddress, ticketId),
                ticketSeriesUseCase.validateTicket(eventAddress, ticketId)
        ));
    }

    @GetMapping("/tickets/{ticketId}/validity")
    public ResponseEntity<Boolean> validateTicket(
            @PathVariable String event,
            @PathVariable long ticketId) {

        return ResponseEntity.ok(ticketSeriesUseCase.validateTicket(Address.of(event), ticketId));
    }

    @GetMapping("/holders/{holder}")
    public ResponseEntity<HolderResponse> holdings(
            @PathVariable String event,
            @PathVariable String holder) {

        Address eventAddress = Address.of(event);
        Address holderAddress = Address.of(holder);
        return ResponseEntity.ok(new HolderResponse(
                eventAddress.value(),
                holderAddress.value(),
                ticketSeriesUseCase.balanceOf(eventAddress, holderAddress),
                ticketSeriesUseCase.ticketsOf(eventAddress, holderAddress)
        ));
    }
}
