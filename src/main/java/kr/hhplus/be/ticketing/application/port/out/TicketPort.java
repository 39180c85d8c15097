package kr.hhplus.be.ticketing.application.port.out;

import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.series.Ticket;

import java.util.List;
import java.util.Optional;

public interface TicketPort {

    Optional<Ticket> find(Address series, long ticketId);

    List<Long> findTicketIds(Address series, Address holder);

    long countByHolder(Address series, Address holder);

    void save(Ticket ticket);
}
