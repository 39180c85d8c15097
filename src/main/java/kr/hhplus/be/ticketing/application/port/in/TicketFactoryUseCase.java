package kr.hhplus.be.ticketing.application.port.in;

import kr.hhplus.be.ticketing.domain.common.Address;

import java.time.Instant;

public interface TicketFactoryUseCase {

    record CreateSeriesCommand(
            Address organization,
            String uri,
            long ticketPrice,
            Instant deadline,
            long maxSupply,
            Address platform
    ) {}

    record FactoryInfo(Address address, String templateId, String name, String symbol) {}

    Address createEvent(CreateSeriesCommand command);

    FactoryInfo getFactory();
}
