package kr.hhplus.be.ticketing.application.port.out;

import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.series.TicketSeries;

import java.util.Optional;

public interface TicketSeriesPort {

    Optional<TicketSeries> find(Address address);

    // 발행량 갱신 시 행 잠금
    Optional<TicketSeries> findForUpdate(Address address);

    void save(TicketSeries series);
}
