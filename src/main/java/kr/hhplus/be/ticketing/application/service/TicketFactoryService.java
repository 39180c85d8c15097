package kr.hhplus.be.ticketing.application.service;

import kr.hhplus.be.ticketing.application.event.ActivityRecorder;
import kr.hhplus.be.ticketing.application.event.ActivityType;
import kr.hhplus.be.ticketing.application.event.TicketingActivity;
import kr.hhplus.be.ticketing.application.port.in.TicketFactoryUseCase;
import kr.hhplus.be.ticketing.application.port.out.TicketSeriesPort;
import kr.hhplus.be.ticketing.application.support.LedgerExecutor;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.factory.TicketFactory;
import kr.hhplus.be.ticketing.domain.series.TicketSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * 팩토리 애플리케이션 서비스
 * - 템플릿 복제 + 1회 초기화 결과를 저장한다
 * - 레지스트리 등록은 호출한 조직 쪽 작업에 포함된다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketFactoryService implements TicketFactoryUseCase {

    private final TicketFactory ticketFactory;
    private final TicketSeriesPort ticketSeriesPort;
    private final ActivityRecorder activityRecorder;
    private final LedgerExecutor ledger;
    private final Clock clock;

    @Override
    public Address createEvent(CreateSeriesCommand command) {
        return ledger.execute(() -> {
            Instant now = Instant.now(clock);
            TicketSeries series = ticketFactory.createEvent(
                    command.organization(),
                    command.uri(),
                    command.ticketPrice(),
                    command.deadline(),
                    command.maxSupply(),
                    command.platform(),
                    now
            );
            ticketSeriesPort.save(series);

            activityRecorder.record(TicketingActivity.builder()
                    .type(ActivityType.EVENT_CREATED)
                    .subject(series.getAddress())
                    .actor(command.organization())
                    .counterparty(ticketFactory.getAddress())
                    .amount(series.getTicketPrice())
                    .detail(String.format("maxSupply=%d, deadline=%s, template=%s",
                            series.getMaxSupply(), series.getDeadline(),
                            ticketFactory.getTemplate().getTemplateId()))
                    .occurredAt(now)
                    .build());

            log.info("이벤트 시리즈 생성 - event: {}, organization: {}, price: {}, maxSupply: {}",
                    series.getAddress(), command.organization(), series.getTicketPrice(), series.getMaxSupply());
            return series.getAddress();
        });
    }

    @Override
    public FactoryInfo getFactory() {
        return new FactoryInfo(
                ticketFactory.getAddress(),
                ticketFactory.getTemplate().getTemplateId(),
                ticketFactory.getTemplate().getName(),
                ticketFactory.getTemplate().getSymbol()
        );
    }
}
