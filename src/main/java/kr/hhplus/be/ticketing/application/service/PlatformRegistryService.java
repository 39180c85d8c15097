package kr.hhplus.be.ticketing.application.service;

import kr.hhplus.be.ticketing.application.event.ActivityRecorder;
import kr.hhplus.be.ticketing.application.event.ActivityType;
import kr.hhplus.be.ticketing.application.event.TicketingActivity;
import kr.hhplus.be.ticketing.application.port.in.PlatformRegistryUseCase;
import kr.hhplus.be.ticketing.application.port.out.EventRegistryPort;
import kr.hhplus.be.ticketing.application.port.out.OrganizationOwnershipPort;
import kr.hhplus.be.ticketing.application.port.out.OrganizationPort;
import kr.hhplus.be.ticketing.application.port.out.OrganizerAllowlistPort;
import kr.hhplus.be.ticketing.application.port.out.PaymentTokenPort;
import kr.hhplus.be.ticketing.application.port.out.PlatformPort;
import kr.hhplus.be.ticketing.application.port.out.TicketSeriesPort;
import kr.hhplus.be.ticketing.application.support.LedgerExecutor;
import kr.hhplus.be.ticketing.application.support.ReentrancyGuard;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.common.exception.AuthorizationException;
import kr.hhplus.be.ticketing.domain.common.exception.PaymentException;
import kr.hhplus.be.ticketing.domain.common.exception.StateException;
import kr.hhplus.be.ticketing.domain.common.exception.ValidationException;
import kr.hhplus.be.ticketing.domain.organization.Organization;
import kr.hhplus.be.ticketing.domain.platform.EventRegistrationStatus;
import kr.hhplus.be.ticketing.domain.platform.OrganizationOwnership;
import kr.hhplus.be.ticketing.domain.platform.Platform;
import kr.hhplus.be.ticketing.domain.platform.RegisteredEvent;
import kr.hhplus.be.ticketing.domain.series.SeriesState;
import kr.hhplus.be.ticketing.domain.series.TicketSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 플랫폼 레지스트리 애플리케이션 서비스
 * - 조직 생성/소유권 이전, 이벤트 활성/지난 목록, 관리자 설정
 * - 조직 내부 상태(일시정지, 소유자)는 Organization 애그리게이트에 위임한다
 *
 * [실행 순서]
 * - 원장 락 → 트랜잭션 → 검증 → 변경 → 활동 기록 → 커밋 → 락 해제
 *
 * [이벤트 목록]
 * - registerEvent / markEventAsClosed 는 조직 서비스의 2단계 작업 중 두 번째 단계로만 호출된다
 * - 레지스트리 기록이 시리즈 상태와 어긋나지 않도록 시리즈를 다시 읽어 확인한다
 *   (등록: 호출 조직 소유의 OPEN 시리즈, 종료 처리: CLOSED 시리즈)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlatformRegistryService implements PlatformRegistryUseCase {

    private final PlatformPort platformPort;
    private final OrganizerAllowlistPort allowlistPort;
    private final OrganizationOwnershipPort ownershipPort;
    private final OrganizationPort organizationPort;
    private final EventRegistryPort eventRegistryPort;
    private final TicketSeriesPort ticketSeriesPort;
    private final PaymentTokenPort paymentTokenPort;
    private final ActivityRecorder activityRecorder;
    private final LedgerExecutor ledger;
    private final ReentrancyGuard reentrancyGuard;
    private final Clock clock;

    // === 조직 ===

    @Override
    public Address createOrganization(Address caller) {
        return ledger.execute(() -> {
            Platform platform = loadPlatform();
            platform.requireNotPaused();

            if (!allowlistPort.isAllowed(caller)) {
                throw AuthorizationException.notAllowedOrganizer(caller);
            }
            if (ownershipPort.findByOwner(caller).isPresent()) {
                throw new StateException("이미 조직을 소유하고 있습니다: " + caller);
            }

            Instant now = Instant.now(clock);
            Organization organization = Organization.create(Address.generate(), platform.getAddress(), caller, now);
            organizationPort.save(organization);
            ownershipPort.save(new OrganizationOwnership(caller, organization.getAddress()));

            activityRecorder.record(TicketingActivity.builder()
                    .type(ActivityType.ORGANIZATION_CREATED)
                    .subject(organization.getAddress())
                    .actor(caller)
                    .occurredAt(now)
                    .build());

            log.info("조직 생성 - organization: {}, owner: {}", organization.getAddress(), caller);
            return organization.getAddress();
        });
    }

    @Override
    public void transferOrganizationOwnership(Address caller, Address newOwner) {
        ledger.run(() -> {
            if (newOwner == null || newOwner.isZero()) {
                throw ValidationException.zeroAddress("newOwner");
            }
            OrganizationOwnership current = ownershipPort.findByOwner(caller)
                    .orElseThrow(() -> new StateException("소유한 조직이 없습니다: " + caller));
            if (ownershipPort.findByOwner(newOwner).isPresent()) {
                throw new StateException("새 소유자가 이미 조직을 소유하고 있습니다: " + newOwner);
            }

            Platform platform = loadPlatform();
            Organization organization = organizationPort.findForUpdate(current.organization())
                    .orElseThrow(() -> StateException.notFound("조직", current.organization()));

            // 매핑과 조직의 소유자 기록은 같은 트랜잭션에서 함께 바뀐다
            ownershipPort.save(current.withOwner(newOwner));
            organization.transferOwnership(platform.getAddress(), newOwner);
            organizationPort.save(organization);

            activityRecorder.record(TicketingActivity.builder()
                    .type(ActivityType.ORGANIZATION_OWNERSHIP_TRANSFERRED)
                    .subject(organization.getAddress())
                    .actor(caller)
                    .counterparty(newOwner)
                    .occurredAt(Instant.now(clock))
                    .build());

            log.info("조직 소유권 이전 - organization: {}, {} -> {}", organization.getAddress(), caller, newOwner);
        });
    }

    // === 조직 전용 ===

    @Override
    public void registerEvent(Address caller, Address event) {
        ledger.run(() -> {
            loadPlatform().requireNotPaused();
            requireOrganization(caller);
            if (event == null || event.isZero()) {
                throw ValidationException.zeroAddress("event");
            }
            if (eventRegistryPort.find(event).isPresent()) {
                throw new StateException("이미 등록된 이벤트입니다: " + event);
            }

            TicketSeries series = loadSeries(event);
            if (!series.getOrganization().equals(caller)) {
                throw new AuthorizationException(
                        String.format("이벤트를 발행한 조직이 아닙니다. 호출자: %s, 발행 조직: %s",
                                caller, series.getOrganization()));
            }
            if (series.getState() != SeriesState.OPEN) {
                throw new StateException(
                        String.format("판매중인 이벤트만 등록할 수 있습니다. event: %s, 상태: %s",
                                event, series.getState()));
            }

            Instant now = Instant.now(clock);
            eventRegistryPort.save(RegisteredEvent.register(event, caller, now));

            activityRecorder.record(TicketingActivity.builder()
                    .type(ActivityType.EVENT_REGISTERED)
                    .subject(event)
                    .actor(caller)
                    .occurredAt(now)
                    .build());

            log.info("이벤트 등록 - event: {}, organization: {}", event, caller);
        });
    }

    @Override
    public void markEventAsClosed(Address caller, Address event) {
        ledger.run(() -> {
            loadPlatform().requireNotPaused();
            requireOrganization(caller);

            RegisteredEvent registered = eventRegistryPort.find(event)
                    .filter(RegisteredEvent::isActive)
                    .orElseThrow(() -> new StateException("활성 이벤트가 아닙니다: " + event));
            if (!registered.getOrganization().equals(caller)) {
                throw new AuthorizationException(
                        String.format("이벤트를 등록한 조직이 아닙니다. 호출자: %s, 등록 조직: %s",
                                caller, registered.getOrganization()));
            }
            if (!loadSeries(event).isClosed()) {
                throw new StateException("마감되지 않은 이벤트는 종료 처리할 수 없습니다: " + event);
            }

            Instant now = Instant.now(clock);
            registered.markClosed(now);
            eventRegistryPort.save(registered);

            activityRecorder.record(TicketingActivity.builder()
                    .type(ActivityType.EVENT_MARKED_CLOSED)
                    .subject(event)
                    .actor(caller)
                    .occurredAt(now)
                    .build());

            log.info("이벤트 종료 처리 - event: {}, organization: {}", event, caller);
        });
    }

    // === 관리자 전용 ===

    @Override
    public void setOrganizerStatus(Address caller, Address organizer, boolean allowed) {
        ledger.run(() -> {
            loadPlatform().requireAdmin(caller);
            if (organizer == null || organizer.isZero()) {
                throw ValidationException.zeroAddress("organizer");
            }
            allowlistPort.setAllowed(organizer, allowed);

            activityRecorder.record(TicketingActivity.builder()
                    .type(ActivityType.ORGANIZER_STATUS_UPDATED)
                    .subject(organizer)
                    .actor(caller)
                    .detail("allowed=" + allowed)
                    .occurredAt(Instant.now(clock))
                    .build());

            log.info("주최자 허용 상태 변경 - organizer: {}, allowed: {}", organizer, allowed);
        });
    }

    /**
     * active=false 면 조직을 일시정지, true 면 해제한다.
     * 레지스트리는 조직 상태를 직접 갖지 않고 Organization 에 전달만 한다
     */
    @Override
    public void setOrganizationStatus(Address caller, Address organization, boolean active) {
        ledger.run(() -> {
            Platform platform = loadPlatform();
            platform.requireAdmin(caller);

            Organization target = organizationPort.findForUpdate(organization)
                    .filter(o -> ownershipPort.isOrganization(o.getAddress()))
                    .orElseThrow(() -> StateException.notFound("조직", organization));
            if (active) {
                target.unpause(platform.getAddress());
            } else {
                target.pause(platform.getAddress());
            }
            organizationPort.save(target);

            activityRecorder.record(TicketingActivity.builder()
                    .type(active ? ActivityType.ORGANIZATION_UNPAUSED : ActivityType.ORGANIZATION_PAUSED)
                    .subject(organization)
                    .actor(caller)
                    .occurredAt(Instant.now(clock))
                    .build());

            log.info("조직 상태 변경 - organization: {}, active: {}", organization, active);
        });
    }

    @Override
    public void updatePlatformFee(Address caller, int feeBps) {
        ledger.run(() -> {
            Platform platform = loadPlatformForUpdate();
            int previous = platform.getFeeBps();
            platform.updateFee(caller, feeBps);
            platformPort.save(platform);

            activityRecorder.record(TicketingActivity.builder()
                    .type(ActivityType.PLATFORM_FEE_UPDATED)
                    .subject(platform.getAddress())
                    .actor(caller)
                    .amount((long) feeBps)
                    .detail("previousFeeBps=" + previous)
                    .occurredAt(Instant.now(clock))
                    .build());

            log.info("플랫폼 수수료율 변경 - {} -> {} bps", previous, feeBps);
        });
    }

    @Override
    public void updatePaymentToken(Address caller, Address token) {
        ledger.run(() -> {
            Platform platform = loadPlatformForUpdate();
            platform.updatePaymentToken(caller, token);
            platformPort.save(platform);

            activityRecorder.record(TicketingActivity.builder()
                    .type(ActivityType.PAYMENT_TOKEN_UPDATED)
                    .subject(platform.getAddress())
                    .actor(caller)
                    .counterparty(token)
                    .occurredAt(Instant.now(clock))
                    .build());

            log.info("결제 토큰 변경 - token: {}", token);
        });
    }

    @Override
    public void pause(Address caller) {
        ledger.run(() -> {
            Platform platform = loadPlatformForUpdate();
            platform.pause(caller);
            platformPort.save(platform);
            recordPlatformActivity(ActivityType.PLATFORM_PAUSED, platform, caller);
            log.warn("플랫폼 일시정지 - by {}", caller);
        });
    }

    @Override
    public void unpause(Address caller) {
        ledger.run(() -> {
            Platform platform = loadPlatformForUpdate();
            platform.unpause(caller);
            platformPort.save(platform);
            recordPlatformActivity(ActivityType.PLATFORM_UNPAUSED, platform, caller);
            log.info("플랫폼 일시정지 해제 - by {}", caller);
        });
    }

    @Override
    public long withdrawPlatformFees(Address caller, Address token) {
        return ledger.execute(() -> {
            Platform platform = loadPlatform();
            return reentrancyGuard.guard("withdraw:" + platform.getAddress(), () -> {
                platform.requireAdmin(caller);
                if (token == null || token.isZero()) {
                    throw ValidationException.zeroAddress("token");
                }

                long balance = paymentTokenPort.balanceOf(token, platform.getAddress());
                if (balance <= 0) {
                    throw PaymentException.nothingToWithdraw(token, platform.getAddress());
                }
                if (!paymentTokenPort.transfer(token, platform.getAddress(), platform.getOwner(), balance)) {
                    throw PaymentException.transferFailed(platform.getAddress(), platform.getOwner(), balance);
                }

                activityRecorder.record(TicketingActivity.builder()
                        .type(ActivityType.PLATFORM_FEES_WITHDRAWN)
                        .subject(platform.getAddress())
                        .actor(caller)
                        .counterparty(token)
                        .amount(balance)
                        .occurredAt(Instant.now(clock))
                        .build());

                log.info("플랫폼 수수료 출금 - token: {}, amount: {}", token, balance);
                return balance;
            });
        });
    }

    // === 조회 ===

    @Override
    @Transactional(readOnly = true)
    public PlatformInfo getPlatform() {
        Platform platform = loadPlatform();
        return new PlatformInfo(
                platform.getAddress(),
                platform.getOwner(),
                platform.getFeeBps(),
                platform.getPaymentToken(),
                platform.isPaused()
        );
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isOrganization(Address address) {
        return ownershipPort.isOrganization(address);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isAllowedOrganizer(Address address) {
        return allowlistPort.isAllowed(address);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Address> organizationOf(Address owner) {
        return ownershipPort.findByOwner(owner).map(OrganizationOwnership::organization);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Address> ownerOf(Address organization) {
        return ownershipPort.findByOrganization(organization).map(OrganizationOwnership::owner);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Address> activeEvents() {
        return eventRegistryPort.findByStatus(EventRegistrationStatus.ACTIVE);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Address> pastEvents() {
        return eventRegistryPort.findByStatus(EventRegistrationStatus.PAST);
    }

    // === Private Helper Methods ===

    private void requireOrganization(Address caller) {
        if (caller == null || !ownershipPort.isOrganization(caller)) {
            throw AuthorizationException.notOrganization(caller);
        }
    }

    private TicketSeries loadSeries(Address event) {
        return ticketSeriesPort.find(event)
                .orElseThrow(() -> StateException.notFound("이벤트", event));
    }

    private Platform loadPlatform() {
        return platformPort.find()
                .orElseThrow(() -> new StateException("플랫폼이 초기화되지 않았습니다"));
    }

    private Platform loadPlatformForUpdate() {
        return platformPort.findForUpdate()
                .orElseThrow(() -> new StateException("플랫폼이 초기화되지 않았습니다"));
    }

    private void recordPlatformActivity(ActivityType type, Platform platform, Address caller) {
        activityRecorder.record(TicketingActivity.builder()
                .type(type)
                .subject(platform.getAddress())
                .actor(caller)
                .occurredAt(Instant.now(clock))
                .build());
    }
}
