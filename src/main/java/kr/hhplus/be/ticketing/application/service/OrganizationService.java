package kr.hhplus.be.ticketing.application.service;

import kr.hhplus.be.ticketing.application.event.ActivityRecorder;
import kr.hhplus.be.ticketing.application.event.ActivityType;
import kr.hhplus.be.ticketing.application.event.TicketingActivity;
import kr.hhplus.be.ticketing.application.port.in.OrganizationUseCase;
import kr.hhplus.be.ticketing.application.port.in.PlatformRegistryUseCase;
import kr.hhplus.be.ticketing.application.port.in.TicketFactoryUseCase;
import kr.hhplus.be.ticketing.application.port.in.TicketFactoryUseCase.CreateSeriesCommand;
import kr.hhplus.be.ticketing.application.port.in.TicketSeriesUseCase;
import kr.hhplus.be.ticketing.application.port.in.TicketSeriesUseCase.SeriesInfo;
import kr.hhplus.be.ticketing.application.port.out.EventRegistryPort;
import kr.hhplus.be.ticketing.application.port.out.OrganizationPort;
import kr.hhplus.be.ticketing.application.port.out.PaymentTokenPort;
import kr.hhplus.be.ticketing.application.port.out.PlatformPort;
import kr.hhplus.be.ticketing.application.support.LedgerExecutor;
import kr.hhplus.be.ticketing.application.support.ReentrancyGuard;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.common.exception.PaymentException;
import kr.hhplus.be.ticketing.domain.common.exception.StateException;
import kr.hhplus.be.ticketing.domain.common.exception.ValidationException;
import kr.hhplus.be.ticketing.domain.organization.Organization;
import kr.hhplus.be.ticketing.domain.platform.RegisteredEvent;
import kr.hhplus.be.ticketing.domain.series.SeriesState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 조직 애플리케이션 서비스
 *
 * [2단계 작업]
 * - createEvent: 팩토리 생성+초기화 → 레지스트리 등록
 * - closeEvent: 시리즈 마감 → 레지스트리 활성→지난 이동
 * - 두 단계는 같은 원장 락/트랜잭션 안에서 실행되어, 어느 한쪽이 실패하면 모두 롤백된다
 *
 * [활동 기록]
 * - 활동 기록은 컴포넌트(팩토리, 시리즈, 레지스트리)의 상태 전이마다 하나씩 남는다
 * - 따라서 createEvent 한 번은 EVENT_CREATED + EVENT_REGISTERED,
 *   closeEvent 한 번은 SERIES_CLOSED + EVENT_MARKED_CLOSED 두 건을 남긴다
 *
 * [가드 순서]
 * - 소유자 확인 → 플랫폼 전역 일시정지 → 조직 일시정지 → 입력값 검증
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrganizationService implements OrganizationUseCase {

    private final OrganizationPort organizationPort;
    private final PlatformPort platformPort;
    private final EventRegistryPort eventRegistryPort;
    private final PaymentTokenPort paymentTokenPort;
    private final TicketFactoryUseCase ticketFactoryUseCase;
    private final TicketSeriesUseCase ticketSeriesUseCase;
    private final PlatformRegistryUseCase platformRegistryUseCase;
    private final ActivityRecorder activityRecorder;
    private final LedgerExecutor ledger;
    private final ReentrancyGuard reentrancyGuard;
    private final Clock clock;

    @Override
    public void updateBanner(Address caller, Address organization, String uri) {
        ledger.run(() -> {
            Organization org = loadOperable(caller, organization);
            org.updateBanner(caller, uri);
            organizationPort.save(org);

            activityRecorder.record(TicketingActivity.builder()
                    .type(ActivityType.BANNER_UPDATED)
                    .subject(organization)
                    .actor(caller)
                    .detail(org.getBannerUri())
                    .occurredAt(Instant.now(clock))
                    .build());

            log.info("배너 변경 - organization: {}", organization);
        });
    }

    @Override
    public Address createEvent(CreateEventCommand command) {
        return ledger.execute(() -> {
            Organization org = loadOperable(command.caller(), command.organization());

            Instant now = Instant.now(clock);
            if (command.deadline() == null || !command.deadline().isAfter(now)) {
                throw ValidationException.deadlineNotInFuture(command.deadline(), now);
            }
            if (command.maxSupply() <= 0) {
                throw ValidationException.nonPositiveSupply(command.maxSupply());
            }
            if (command.ticketPrice() <= 0) {
                throw ValidationException.nonPositivePrice(command.ticketPrice());
            }

            // 1단계: 템플릿 복제 + 초기화
            Address event = ticketFactoryUseCase.createEvent(new CreateSeriesCommand(
                    org.getAddress(),
                    command.uri(),
                    command.ticketPrice(),
                    command.deadline(),
                    command.maxSupply(),
                    org.getPlatform()
            ));

            // 2단계: 레지스트리 등록 (실패 시 1단계도 함께 롤백)
            platformRegistryUseCase.registerEvent(org.getAddress(), event);

            log.info("이벤트 생성 완료 - organization: {}, event: {}", org.getAddress(), event);
            return event;
        });
    }

    @Override
    public void closeEvent(Address caller, Address organization, Address event) {
        ledger.run(() -> {
            Organization org = loadOperable(caller, organization);
            SeriesInfo series = requireOwnSeries(org, event);
            if (series.state() == SeriesState.CLOSED) {
                throw new StateException("이미 마감된 이벤트입니다: " + event);
            }

            // 1단계: 시리즈 마감, 2단계: 레지스트리 이동
            ticketSeriesUseCase.close(org.getAddress(), event);
            platformRegistryUseCase.markEventAsClosed(org.getAddress(), event);

            log.info("이벤트 마감 완료 - organization: {}, event: {}", org.getAddress(), event);
        });
    }

    @Override
    public void setTicketPrice(Address caller, Address organization, Address event, long newPrice) {
        ledger.run(() -> {
            Organization org = loadOperable(caller, organization);
            requireOwnSeries(org, event);
            if (newPrice <= 0) {
                throw ValidationException.nonPositivePrice(newPrice);
            }
            ticketSeriesUseCase.updateTicketPrice(org.getAddress(), event, newPrice);
        });
    }

    @Override
    public void setDeadline(Address caller, Address organization, Address event, Instant newDeadline) {
        ledger.run(() -> {
            Organization org = loadOperable(caller, organization);
            requireOwnSeries(org, event);
            Instant now = Instant.now(clock);
            if (newDeadline == null || !newDeadline.isAfter(now)) {
                throw ValidationException.deadlineNotInFuture(newDeadline, now);
            }
            ticketSeriesUseCase.updateDeadline(org.getAddress(), event, newDeadline);
        });
    }

    /**
     * 조직이 보유한 토큰 잔액 전부를 소유자에게 출금
     * - 잔액 조회 → 이체 구간은 재진입 가드로 보호한다
     */
    @Override
    public long withdrawTokens(Address caller, Address organization, Address token) {
        return ledger.execute(() -> reentrancyGuard.guard("withdraw:" + organization, () -> {
            Organization org = loadOrganization(organization);
            org.requireOwner(caller);
            if (token == null || token.isZero()) {
                throw ValidationException.zeroAddress("token");
            }

            long balance = paymentTokenPort.balanceOf(token, org.getAddress());
            if (balance <= 0) {
                throw PaymentException.nothingToWithdraw(token, org.getAddress());
            }
            if (!paymentTokenPort.transfer(token, org.getAddress(), org.getOwner(), balance)) {
                throw PaymentException.transferFailed(org.getAddress(), org.getOwner(), balance);
            }

            activityRecorder.record(TicketingActivity.builder()
                    .type(ActivityType.TOKENS_WITHDRAWN)
                    .subject(organization)
                    .actor(caller)
                    .counterparty(token)
                    .amount(balance)
                    .occurredAt(Instant.now(clock))
                    .build());

            log.info("조직 토큰 출금 - organization: {}, token: {}, amount: {}", organization, token, balance);
            return balance;
        }));
    }

    // === 조회 ===

    @Override
    @Transactional(readOnly = true)
    public OrganizationInfo getOrganization(Address organization) {
        Organization org = organizationPort.find(organization)
                .orElseThrow(() -> StateException.notFound("조직", organization));
        return new OrganizationInfo(
                org.getAddress(),
                org.getOwner(),
                org.getPlatform(),
                org.getBannerUri(),
                org.isPaused()
        );
    }

    @Override
    @Transactional(readOnly = true)
    public List<Address> eventsOf(Address organization) {
        return eventRegistryPort.findByOrganization(organization).stream()
                .map(RegisteredEvent::getEvent)
                .toList();
    }

    // === Private Helper Methods ===

    private Organization loadOrganization(Address organization) {
        return organizationPort.findForUpdate(organization)
                .orElseThrow(() -> StateException.notFound("조직", organization));
    }

    /**
     * 소유자 작업 공통 가드. 플랫폼 전역 일시정지와 조직 일시정지가 모두 풀려 있어야 한다
     */
    private Organization loadOperable(Address caller, Address organization) {
        Organization org = loadOrganization(organization);
        org.requireOwner(caller);
        platformPort.find()
                .orElseThrow(() -> new StateException("플랫폼이 초기화되지 않았습니다"))
                .requireNotPaused();
        org.requireNotPaused();
        return org;
    }

    private SeriesInfo requireOwnSeries(Organization org, Address event) {
        SeriesInfo series = ticketSeriesUseCase.getSeries(event);
        if (!org.getAddress().equals(series.organization())) {
            throw new StateException(
                    String.format("이 조직의 이벤트가 아닙니다. organization: %s, event: %s", org.getAddress(), event));
        }
        return series;
    }
}
