package kr.hhplus.be.ticketing.application.port.in;

import kr.hhplus.be.ticketing.domain.common.Address;

import java.time.Instant;
import java.util.List;

public interface OrganizationUseCase {

    record CreateEventCommand(
            Address caller,
            Address organization,
            String uri,
            long ticketPrice,
            Instant deadline,
            long maxSupply
    ) {}

    record OrganizationInfo(Address address, Address owner, Address platform, String bannerUri, boolean paused) {}

    void updateBanner(Address caller, Address organization, String uri);
    Address createEvent(CreateEventCommand command);
    void closeEvent(Address caller, Address organization, Address event);
    void setTicketPrice(Address caller, Address organization, Address event, long newPrice);
    void setDeadline(Address caller, Address organization, Address event, Instant newDeadline);
    long withdrawTokens(Address caller, Address organization, Address token);

    OrganizationInfo getOrganization(Address organization);
    List<Address> eventsOf(Address organization);
}
