package kr.hhplus.be.ticketing.application.service;

import kr.hhplus.be.ticketing.application.event.ActivityRecorder;
import kr.hhplus.be.ticketing.application.event.ActivityType;
import kr.hhplus.be.ticketing.application.event.TicketingActivity;
import kr.hhplus.be.ticketing.application.port.in.TicketSeriesUseCase;
import kr.hhplus.be.ticketing.application.port.out.PaymentTokenPort;
import kr.hhplus.be.ticketing.application.port.out.PlatformPort;
import kr.hhplus.be.ticketing.application.port.out.TicketPort;
import kr.hhplus.be.ticketing.application.port.out.TicketSeriesPort;
import kr.hhplus.be.ticketing.application.support.LedgerExecutor;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.common.FeeSplit;
import kr.hhplus.be.ticketing.domain.common.exception.PaymentException;
import kr.hhplus.be.ticketing.domain.common.exception.StateException;
import kr.hhplus.be.ticketing.domain.common.exception.ValidationException;
import kr.hhplus.be.ticketing.domain.platform.Platform;
import kr.hhplus.be.ticketing.domain.series.Ticket;
import kr.hhplus.be.ticketing.domain.series.TicketSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 티켓 시리즈 애플리케이션 서비스
 * - 발행(mint), 재판매(resell), 양도, 조직 전용 설정 변경
 *
 * [결제 흐름]
 * - 허용량 확인 → 수수료 이체(구매자 → 플랫폼) → 잔액 이체(구매자 → 수령자) → 소유권 기록
 * - 이체 중 하나라도 실패하면 PaymentException 으로 트랜잭션 전체가 롤백된다
 * - 소유권 기록 직전에 마감 여부/마감시각을 다시 확인한다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketSeriesService implements TicketSeriesUseCase {

    private final TicketSeriesPort ticketSeriesPort;
    private final TicketPort ticketPort;
    private final PlatformPort platformPort;
    private final PaymentTokenPort paymentTokenPort;
    private final ActivityRecorder activityRecorder;
    private final LedgerExecutor ledger;
    private final Clock clock;

    // === 구매자 / 보유자 ===

    @Override
    public MintResult mint(Address caller, Address event) {
        return ledger.execute(() -> {
            requireNonZero(caller, "caller");
            Platform platform = loadPlatform();
            platform.requireNotPaused();

            TicketSeries series = loadSeriesForUpdate(event);
            series.requireMintable(Instant.now(clock));

            long price = series.getTicketPrice();
            FeeSplit split = platform.split(price);
            collectPayment(platform, series, caller, series.getOrganization(), split);

            Instant now = Instant.now(clock);
            Ticket ticket = series.issueTicket(caller, now);
            ticketSeriesPort.save(series);
            ticketPort.save(ticket);

            activityRecorder.record(TicketingActivity.builder()
                    .type(ActivityType.TICKET_MINTED)
                    .subject(event)
                    .actor(caller)
                    .counterparty(series.getOrganization())
                    .amount(price)
                    .fee(split.fee())
                    .ticketId(ticket.getTicketId())
                    .occurredAt(now)
                    .build());

            log.info("티켓 발행 - event: {}, ticketId: {}, holder: {}, price: {}, fee: {}",
                    event, ticket.getTicketId(), caller, price, split.fee());
            return new MintResult(ticket.getTicketId(), split.fee(), split.remainder());
        });
    }

    @Override
    public void resell(ResellCommand command) {
        ledger.run(() -> {
            Platform platform = loadPlatform();
            platform.requireNotPaused();

            TicketSeries series = loadSeriesForUpdate(command.event());
            series.requireTransferable(Instant.now(clock));

            Ticket ticket = loadTicket(command.event(), command.ticketId());
            ticket.requireHeldBy(command.caller());
            requireNonZero(command.to(), "to");
            if (command.price() <= 0) {
                throw ValidationException.nonPositivePrice(command.price());
            }

            FeeSplit split = platform.split(command.price());
            collectPayment(platform, series, command.to(), command.caller(), split);

            Instant now = Instant.now(clock);
            series.transferTicket(ticket, command.caller(), command.to(), now);
            ticketPort.save(ticket);

            activityRecorder.record(TicketingActivity.builder()
                    .type(ActivityType.TICKET_RESOLD)
                    .subject(command.event())
                    .actor(command.caller())
                    .counterparty(command.to())
                    .amount(command.price())
                    .fee(split.fee())
                    .ticketId(command.ticketId())
                    .occurredAt(now)
                    .build());

            log.info("티켓 재판매 - event: {}, ticketId: {}, {} -> {}, price: {}, fee: {}",
                    command.event(), command.ticketId(), command.caller(), command.to(),
                    command.price(), split.fee());
        });
    }

    @Override
    public void transferTicket(TransferCommand command) {
        ledger.run(() -> {
            loadPlatform().requireNotPaused();
            TicketSeries series = loadSeriesForUpdate(command.event());
            Ticket ticket = loadTicket(command.event(), command.ticketId());

            Instant now = Instant.now(clock);
            series.transferTicket(ticket, command.caller(), command.to(), now);
            ticketPort.save(ticket);

            activityRecorder.record(TicketingActivity.builder()
                    .type(ActivityType.TICKET_TRANSFERRED)
                    .subject(command.event())
                    .actor(command.caller())
                    .counterparty(command.to())
                    .ticketId(command.ticketId())
                    .occurredAt(now)
                    .build());

            log.info("티켓 양도 - event: {}, ticketId: {}, {} -> {}",
                    command.event(), command.ticketId(), command.caller(), command.to());
        });
    }

    // === 조직 전용 ===

    @Override
    public void updateTicketPrice(Address caller, Address event, long newPrice) {
        ledger.run(() -> {
            TicketSeries series = loadSeriesForUpdate(event);
            long previous = series.getTicketPrice();
            series.updateTicketPrice(caller, newPrice);
            ticketSeriesPort.save(series);

            activityRecorder.record(TicketingActivity.builder()
                    .type(ActivityType.TICKET_PRICE_UPDATED)
                    .subject(event)
                    .actor(caller)
                    .amount(newPrice)
                    .detail("previousPrice=" + previous)
                    .occurredAt(Instant.now(clock))
                    .build());

            log.info("티켓 가격 변경 - event: {}, {} -> {}", event, previous, newPrice);
        });
    }

    @Override
    public void updateDeadline(Address caller, Address event, Instant newDeadline) {
        ledger.run(() -> {
            TicketSeries series = loadSeriesForUpdate(event);
            Instant now = Instant.now(clock);
            series.updateDeadline(caller, newDeadline, now);
            ticketSeriesPort.save(series);

            activityRecorder.record(TicketingActivity.builder()
                    .type(ActivityType.DEADLINE_UPDATED)
                    .subject(event)
                    .actor(caller)
                    .detail("deadline=" + newDeadline)
                    .occurredAt(now)
                    .build());

            log.info("판매 마감시각 변경 - event: {}, deadline: {}", event, newDeadline);
        });
    }

    @Override
    public void close(Address caller, Address event) {
        ledger.run(() -> {
            TicketSeries series = loadSeriesForUpdate(event);
            series.close(caller);
            ticketSeriesPort.save(series);

            activityRecorder.record(TicketingActivity.builder()
                    .type(ActivityType.SERIES_CLOSED)
                    .subject(event)
                    .actor(caller)
                    .amount(series.getCurrentSupply())
                    .occurredAt(Instant.now(clock))
                    .build());

            log.info("이벤트 마감 - event: {}, 발행량: {} / {}", event, series.getCurrentSupply(), series.getMaxSupply());
        });
    }

    // === 조회 ===

    @Override
    @Transactional(readOnly = true)
    public SeriesInfo getSeries(Address event) {
        TicketSeries series = loadSeries(event);
        return new SeriesInfo(
                series.getAddress(),
                series.getOrganization(),
                series.getPlatform(),
                series.getTemplate().getTemplateId(),
                series.getBaseUri(),
                series.getTicketPrice(),
                series.getDeadline(),
                series.getMaxSupply(),
                series.getCurrentSupply(),
                series.getState()
        );
    }

    @Override
    @Transactional(readOnly = true)
    public boolean validateTicket(Address event, long ticketId) {
        return loadSeries(event).validateTicket(ticketId, Instant.now(clock));
    }

    @Override
    @Transactional(readOnly = true)
    public Address ownerOf(Address event, long ticketId) {
        return loadTicket(event, ticketId).getHolder();
    }

    @Override
    @Transactional(readOnly = true)
    public String tokenUri(Address event, long ticketId) {
        return loadSeries(event).tokenUri(ticketId);
    }

    @Override
    @Transactional(readOnly = true)
    public long balanceOf(Address event, Address holder) {
        return ticketPort.countByHolder(event, holder);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Long> ticketsOf(Address event, Address holder) {
        return ticketPort.findTicketIds(event, holder);
    }

    // === Private Helper Methods ===

    /**
     * 수수료 분할 결제. 두 이체 모두 payer 가 시리즈에 준 허용량에서 나간다
     */
    private void collectPayment(Platform platform, TicketSeries series, Address payer, Address beneficiary,
                                FeeSplit split) {
        Address token = platform.getPaymentToken();
        Address spender = series.getAddress();

        long allowance = paymentTokenPort.allowance(token, payer, spender);
        if (allowance < split.price()) {
            throw PaymentException.insufficientAllowance(payer, allowance, split.price());
        }

        // 수수료 먼저, 잔액 나중
        if (split.hasFee()
                && !paymentTokenPort.transferFrom(token, spender, payer, platform.getAddress(), split.fee())) {
            throw PaymentException.transferFailed(payer, platform.getAddress(), split.fee());
        }
        if (split.remainder() > 0
                && !paymentTokenPort.transferFrom(token, spender, payer, beneficiary, split.remainder())) {
            throw PaymentException.transferFailed(payer, beneficiary, split.remainder());
        }
    }

    private Platform loadPlatform() {
        return platformPort.find()
                .orElseThrow(() -> new StateException("플랫폼이 초기화되지 않았습니다"));
    }

    private TicketSeries loadSeries(Address event) {
        return ticketSeriesPort.find(event)
                .orElseThrow(() -> StateException.notFound("이벤트", event));
    }

    private TicketSeries loadSeriesForUpdate(Address event) {
        return ticketSeriesPort.findForUpdate(event)
                .orElseThrow(() -> StateException.notFound("이벤트", event));
    }

    private Ticket loadTicket(Address event, long ticketId) {
        return ticketPort.find(event, ticketId)
                .orElseThrow(() -> StateException.notFound("티켓", ticketId));
    }

    private static void requireNonZero(Address address, String field) {
        if (address == null || address.isZero()) {
            throw ValidationException.zeroAddress(field);
        }
    }
}
