package kr.hhplus.be.ticketing.infrastructure.persistence.series.jpa.adapter;

import kr.hhplus.be.ticketing.application.port.out.TicketPort;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.series.Ticket;
import kr.hhplus.be.ticketing.infrastructure.persistence.series.jpa.entity.TicketJpaEntity;
import kr.hhplus.be.ticketing.infrastructure.persistence.series.jpa.repository.TicketJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class TicketJpaAdapter implements TicketPort {

    private final TicketJpaRepository repository;

    @Override
    public Optional<Ticket> find(Address series, long ticketId) {
        return repository.findBySeriesAndTicketId(series.value(), ticketId)
                .map(entity -> Ticket.restore(
                        Address.of(entity.getSeries()),
                        entity.getTicketId(),
                        Address.of(entity.getHolder())
                ));
    }

    @Override
    public List<Long> findTicketIds(Address series, Address holder) {
        return repository.findTicketIds(series.value(), holder.value());
    }

    @Override
    public long countByHolder(Address series, Address holder) {
        return repository.countBySeriesAndHolder(series.value(), holder.value());
    }

    @Override
    public void save(Ticket ticket) {
        TicketJpaEntity entity = repository.findBySeriesAndTicketId(ticket.getSeries().value(), ticket.getTicketId())
                .orElseGet(() -> new TicketJpaEntity(
                        ticket.getSeries().value(),
                        ticket.getTicketId(),
                        ticket.getHolder().value()
                ));
        entity.setHolder(ticket.getHolder().value());
        repository.save(entity);
    }
}
