package kr.hhplus.be.ticketing.application.port.in;

import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.series.SeriesState;

import java.time.Instant;
import java.util.List;

public interface TicketSeriesUseCase {

    record ResellCommand(Address caller, Address event, long ticketId, Address to, long price) {}

    record TransferCommand(Address caller, Address event, long ticketId, Address to) {}

    record MintResult(long ticketId, long fee, long remainder) {}

    record SeriesInfo(
            Address address,
            Address organization,
            Address platform,
            String templateId,
            String baseUri,
            long ticketPrice,
            Instant deadline,
            long maxSupply,
            long currentSupply,
            SeriesState state
    ) {}

    // === 구매자 / 보유자 ===
    MintResult mint(Address caller, Address event);
    void resell(ResellCommand command);
    void transferTicket(TransferCommand command);

    // === 조직 전용 (호출자 = 시리즈를 소유한 조직 주소) ===
    void updateTicketPrice(Address caller, Address event, long newPrice);
    void updateDeadline(Address caller, Address event, Instant newDeadline);
    void close(Address caller, Address event);

    // === 조회 ===
    SeriesInfo getSeries(Address event);
    boolean validateTicket(Address event, long ticketId);
    Address ownerOf(Address event, long ticketId);
    String tokenUri(Address event, long ticketId);
    long balanceOf(Address event, Address holder);
    List<Long> ticketsOf(Address event, Address holder);
}
