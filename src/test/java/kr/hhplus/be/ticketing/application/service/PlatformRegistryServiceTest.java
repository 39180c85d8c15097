package kr.hhplus.be.ticketing.application.service;

import kr.hhplus.be.ticketing.application.event.ActivityRecorder;
import kr.hhplus.be.ticketing.application.event.ActivityType;
import kr.hhplus.be.ticketing.application.event.TicketingActivity;
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
import kr.hhplus.be.ticketing.domain.series.TicketSeriesTemplate;
import kr.hhplus.be.ticketing.support.LedgerStubs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static kr.hhplus.be.ticketing.support.TestAddresses.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PlatformRegistryServiceTest {

    private static final Address ORG = of(0x0a6);
    private static final Address EVENT = of(0xe1);
    private static final Instant NOW = Instant.parse("2030-01-01T00:00:00Z");

    @Mock
    private PlatformPort platformPort;

    @Mock
    private OrganizerAllowlistPort allowlistPort;

    @Mock
    private OrganizationOwnershipPort ownershipPort;

    @Mock
    private OrganizationPort organizationPort;

    @Mock
    private EventRegistryPort eventRegistryPort;

    @Mock
    private TicketSeriesPort ticketSeriesPort;

    @Mock
    private PaymentTokenPort paymentTokenPort;

    @Mock
    private ActivityRecorder activityRecorder;

    @Mock
    private LedgerExecutor ledger;

    private Platform platform;
    private PlatformRegistryService platformRegistryService;

    @BeforeEach
    void setUp() {
        LedgerStubs.passThrough(ledger);
        platform = Platform.create(PLATFORM, ADMIN, 500, TOKEN);
        lenient().when(platformPort.find()).thenReturn(Optional.of(platform));
        lenient().when(platformPort.findForUpdate()).thenReturn(Optional.of(platform));

        platformRegistryService = new PlatformRegistryService(
                platformPort,
                allowlistPort,
                ownershipPort,
                organizationPort,
                eventRegistryPort,
                ticketSeriesPort,
                paymentTokenPort,
                activityRecorder,
                ledger,
                new ReentrancyGuard(),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    private final TicketSeriesTemplate template = new TicketSeriesTemplate("ticket-series-v1", "Event Ticket", "TIX");

    private TicketSeries series(Address organization, SeriesState state) {
        return TicketSeries.restore(EVENT, template, state, organization, PLATFORM, "ipfs://event/",
                200, NOW.plus(Duration.ofDays(1)), 10, 0, 0L);
    }

    @Nested
    @DisplayName("조직 생성")
    class CreateOrganization {

        @Test
        @DisplayName("허용된 주최자는 조직을 만들고 양방향 매핑이 기록된다")
        void create() {
            // given
            when(allowlistPort.isAllowed(ALICE)).thenReturn(true);
            when(ownershipPort.findByOwner(ALICE)).thenReturn(Optional.empty());

            // when
            Address created = platformRegistryService.createOrganization(ALICE);

            // then
            ArgumentCaptor<Organization> organization = ArgumentCaptor.forClass(Organization.class);
            verify(organizationPort).save(organization.capture());
            assertThat(organization.getValue().getAddress()).isEqualTo(created);
            assertThat(organization.getValue().getOwner()).isEqualTo(ALICE);
            assertThat(organization.getValue().getPlatform()).isEqualTo(PLATFORM);
            verify(ownershipPort).save(new OrganizationOwnership(ALICE, created));
        }

        @Test
        @DisplayName("허용되지 않은 주최자는 AuthorizationException")
        void notAllowed() {
            when(allowlistPort.isAllowed(BOB)).thenReturn(false);

            assertThatThrownBy(() -> platformRegistryService.createOrganization(BOB))
                    .isInstanceOf(AuthorizationException.class);
            verify(organizationPort, never()).save(any());
        }

        @Test
        @DisplayName("이미 조직을 가진 주최자는 StateException")
        void alreadyOwns() {
            when(allowlistPort.isAllowed(ALICE)).thenReturn(true);
            when(ownershipPort.findByOwner(ALICE)).thenReturn(Optional.of(new OrganizationOwnership(ALICE, ORG)));

            assertThatThrownBy(() -> platformRegistryService.createOrganization(ALICE))
                    .isInstanceOf(StateException.class);
            verify(ownershipPort, never()).save(any());
        }

        @Test
        @DisplayName("플랫폼 일시정지 중에는 조직을 만들 수 없다")
        void paused() {
            platform.pause(ADMIN);

            assertThatThrownBy(() -> platformRegistryService.createOrganization(ALICE))
                    .isInstanceOf(StateException.class);
            verifyNoInteractions(allowlistPort);
        }
    }

    @Nested
    @DisplayName("소유권 이전")
    class TransferOwnership {

        @Test
        @DisplayName("매핑과 조직 소유자가 함께 바뀐다")
        void transfer() {
            Organization organization = Organization.create(ORG, PLATFORM, ALICE, NOW);
            when(ownershipPort.findByOwner(ALICE)).thenReturn(Optional.of(new OrganizationOwnership(ALICE, ORG)));
            when(ownershipPort.findByOwner(BOB)).thenReturn(Optional.empty());
            when(organizationPort.findForUpdate(ORG)).thenReturn(Optional.of(organization));

            platformRegistryService.transferOrganizationOwnership(ALICE, BOB);

            verify(ownershipPort).save(new OrganizationOwnership(BOB, ORG));
            assertThat(organization.getOwner()).isEqualTo(BOB);
            verify(organizationPort).save(organization);
        }

        @Test
        @DisplayName("새 소유자가 이미 조직을 가지고 있으면 아무것도 바뀌지 않는다")
        void newOwnerAlreadyOwns() {
            when(ownershipPort.findByOwner(ALICE)).thenReturn(Optional.of(new OrganizationOwnership(ALICE, ORG)));
            when(ownershipPort.findByOwner(BOB)).thenReturn(Optional.of(new OrganizationOwnership(BOB, of(0x0b7))));

            assertThatThrownBy(() -> platformRegistryService.transferOrganizationOwnership(ALICE, BOB))
                    .isInstanceOf(StateException.class);
            verify(ownershipPort, never()).save(any());
            verifyNoInteractions(organizationPort);
        }

        @Test
        @DisplayName("조직이 없는 호출자, 제로 주소 대상은 거부된다")
        void invalid() {
            assertThatThrownBy(() -> platformRegistryService.transferOrganizationOwnership(ALICE, Address.ZERO))
                    .isInstanceOf(ValidationException.class);

            when(ownershipPort.findByOwner(CAROL)).thenReturn(Optional.empty());
            assertThatThrownBy(() -> platformRegistryService.transferOrganizationOwnership(CAROL, BOB))
                    .isInstanceOf(StateException.class);
        }
    }

    @Nested
    @DisplayName("이벤트 목록")
    class EventLists {

        @Test
        @DisplayName("조직이 아닌 호출자는 이벤트를 등록할 수 없다")
        void register_notOrganization() {
            when(ownershipPort.isOrganization(ALICE)).thenReturn(false);

            assertThatThrownBy(() -> platformRegistryService.registerEvent(ALICE, EVENT))
                    .isInstanceOf(AuthorizationException.class);
            verify(eventRegistryPort, never()).save(any());
        }

        @Test
        @DisplayName("같은 이벤트를 두 번 등록할 수 없다")
        void register_duplicate() {
            when(ownershipPort.isOrganization(ORG)).thenReturn(true);
            when(eventRegistryPort.find(EVENT)).thenReturn(Optional.of(RegisteredEvent.register(EVENT, ORG, NOW)));

            assertThatThrownBy(() -> platformRegistryService.registerEvent(ORG, EVENT))
                    .isInstanceOf(StateException.class);
        }

        @Test
        @DisplayName("호출 조직이 발행한 판매중 시리즈는 활성 목록에 등록된다")
        void register() {
            when(ownershipPort.isOrganization(ORG)).thenReturn(true);
            when(eventRegistryPort.find(EVENT)).thenReturn(Optional.empty());
            when(ticketSeriesPort.find(EVENT)).thenReturn(Optional.of(series(ORG, SeriesState.OPEN)));

            platformRegistryService.registerEvent(ORG, EVENT);

            ArgumentCaptor<RegisteredEvent> registered = ArgumentCaptor.forClass(RegisteredEvent.class);
            verify(eventRegistryPort).save(registered.capture());
            assertThat(registered.getValue().getOrganization()).isEqualTo(ORG);
            assertThat(registered.getValue().isActive()).isTrue();
        }

        @Test
        @DisplayName("존재하지 않는 시리즈는 등록할 수 없다")
        void register_seriesMissing() {
            when(ownershipPort.isOrganization(ORG)).thenReturn(true);
            when(eventRegistryPort.find(EVENT)).thenReturn(Optional.empty());
            when(ticketSeriesPort.find(EVENT)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> platformRegistryService.registerEvent(ORG, EVENT))
                    .isInstanceOf(StateException.class);
            verify(eventRegistryPort, never()).save(any());
            verifyNoInteractions(activityRecorder);
        }

        @Test
        @DisplayName("다른 조직이 발행한 시리즈는 등록할 수 없다")
        void register_otherOrganizationsSeries() {
            Address other = of(0x0b7);
            when(ownershipPort.isOrganization(other)).thenReturn(true);
            when(eventRegistryPort.find(EVENT)).thenReturn(Optional.empty());
            when(ticketSeriesPort.find(EVENT)).thenReturn(Optional.of(series(ORG, SeriesState.OPEN)));

            assertThatThrownBy(() -> platformRegistryService.registerEvent(other, EVENT))
                    .isInstanceOf(AuthorizationException.class);
            verify(eventRegistryPort, never()).save(any());
        }

        @Test
        @DisplayName("마감된 시리즈는 활성 목록에 등록할 수 없다")
        void register_closedSeries() {
            when(ownershipPort.isOrganization(ORG)).thenReturn(true);
            when(eventRegistryPort.find(EVENT)).thenReturn(Optional.empty());
            when(ticketSeriesPort.find(EVENT)).thenReturn(Optional.of(series(ORG, SeriesState.CLOSED)));

            assertThatThrownBy(() -> platformRegistryService.registerEvent(ORG, EVENT))
                    .isInstanceOf(StateException.class);
            verify(eventRegistryPort, never()).save(any());
        }

        @Test
        @DisplayName("시리즈가 아직 판매중이면 종료 처리할 수 없다")
        void markClosed_seriesStillOpen() {
            RegisteredEvent registered = RegisteredEvent.register(EVENT, ORG, NOW);
            when(ownershipPort.isOrganization(ORG)).thenReturn(true);
            when(eventRegistryPort.find(EVENT)).thenReturn(Optional.of(registered));
            when(ticketSeriesPort.find(EVENT)).thenReturn(Optional.of(series(ORG, SeriesState.OPEN)));

            assertThatThrownBy(() -> platformRegistryService.markEventAsClosed(ORG, EVENT))
                    .isInstanceOf(StateException.class)
                    .hasMessageContaining("마감되지 않은");
            assertThat(registered.isActive()).isTrue();
            verify(eventRegistryPort, never()).save(any());
        }

        @Test
        @DisplayName("종료 처리하면 활성 → 지난 목록으로 이동한다")
        void markClosed() {
            RegisteredEvent registered = RegisteredEvent.register(EVENT, ORG, NOW);
            when(ownershipPort.isOrganization(ORG)).thenReturn(true);
            when(eventRegistryPort.find(EVENT)).thenReturn(Optional.of(registered));
            when(ticketSeriesPort.find(EVENT)).thenReturn(Optional.of(series(ORG, SeriesState.CLOSED)));

            platformRegistryService.markEventAsClosed(ORG, EVENT);

            assertThat(registered.getStatus()).isEqualTo(EventRegistrationStatus.PAST);
            verify(eventRegistryPort).save(registered);
        }

        @Test
        @DisplayName("다른 조직의 이벤트는 종료 처리할 수 없다")
        void markClosed_otherOrganization() {
            Address other = of(0x0b7);
            when(ownershipPort.isOrganization(other)).thenReturn(true);
            when(eventRegistryPort.find(EVENT)).thenReturn(Optional.of(RegisteredEvent.register(EVENT, ORG, NOW)));

            assertThatThrownBy(() -> platformRegistryService.markEventAsClosed(other, EVENT))
                    .isInstanceOf(AuthorizationException.class);
        }

        @Test
        @DisplayName("활성이 아닌 이벤트 종료 처리는 StateException")
        void markClosed_notActive() {
            RegisteredEvent past = RegisteredEvent.restore(EVENT, ORG, EventRegistrationStatus.PAST, NOW, NOW);
            when(ownershipPort.isOrganization(ORG)).thenReturn(true);
            when(eventRegistryPort.find(EVENT)).thenReturn(Optional.of(past));

            assertThatThrownBy(() -> platformRegistryService.markEventAsClosed(ORG, EVENT))
                    .isInstanceOf(StateException.class);
        }
    }

    @Nested
    @DisplayName("관리자 작업")
    class AdminOperations {

        @Test
        @DisplayName("관리자가 아니면 모든 관리 작업이 거부된다")
        void notAdmin() {
            assertThatThrownBy(() -> platformRegistryService.updatePlatformFee(ALICE, 100))
                    .isInstanceOf(AuthorizationException.class);
            assertThatThrownBy(() -> platformRegistryService.setOrganizerStatus(ALICE, BOB, true))
                    .isInstanceOf(AuthorizationException.class);
            assertThatThrownBy(() -> platformRegistryService.pause(ALICE))
                    .isInstanceOf(AuthorizationException.class);
            assertThatThrownBy(() -> platformRegistryService.withdrawPlatformFees(ALICE, TOKEN))
                    .isInstanceOf(AuthorizationException.class);
            verify(platformPort, never()).save(any());
        }

        @Test
        @DisplayName("수수료율 변경이 저장되고 활동이 기록된다")
        void updateFee() {
            platformRegistryService.updatePlatformFee(ADMIN, 250);

            assertThat(platform.getFeeBps()).isEqualTo(250);
            verify(platformPort).save(platform);
            ArgumentCaptor<TicketingActivity> activity = ArgumentCaptor.forClass(TicketingActivity.class);
            verify(activityRecorder).record(activity.capture());
            assertThat(activity.getValue().type()).isEqualTo(ActivityType.PLATFORM_FEE_UPDATED);
        }

        @Test
        @DisplayName("조직 일시정지는 Organization 에 위임된다")
        void setOrganizationStatus() {
            Organization organization = Organization.create(ORG, PLATFORM, ALICE, NOW);
            when(organizationPort.findForUpdate(ORG)).thenReturn(Optional.of(organization));
            when(ownershipPort.isOrganization(ORG)).thenReturn(true);

            platformRegistryService.setOrganizationStatus(ADMIN, ORG, false);

            assertThat(organization.isPaused()).isTrue();
            verify(organizationPort).save(organization);
        }

        @Test
        @DisplayName("수수료 출금은 플랫폼 잔액 전부를 관리자에게 보낸다")
        void withdraw() {
            when(paymentTokenPort.balanceOf(TOKEN, PLATFORM)).thenReturn(30L);
            when(paymentTokenPort.transfer(TOKEN, PLATFORM, ADMIN, 30L)).thenReturn(true);

            long withdrawn = platformRegistryService.withdrawPlatformFees(ADMIN, TOKEN);

            assertThat(withdrawn).isEqualTo(30);
        }

        @Test
        @DisplayName("잔액이 없으면 PaymentException")
        void withdraw_nothing() {
            when(paymentTokenPort.balanceOf(TOKEN, PLATFORM)).thenReturn(0L);

            assertThatThrownBy(() -> platformRegistryService.withdrawPlatformFees(ADMIN, TOKEN))
                    .isInstanceOf(PaymentException.class);
            verify(paymentTokenPort, never()).transfer(any(), any(), any(), anyLong());
        }

        @Test
        @DisplayName("이체가 false 를 반환하면 PaymentException")
        void withdraw_transferFails() {
            when(paymentTokenPort.balanceOf(TOKEN, PLATFORM)).thenReturn(30L);
            when(paymentTokenPort.transfer(TOKEN, PLATFORM, ADMIN, 30L)).thenReturn(false);

            assertThatThrownBy(() -> platformRegistryService.withdrawPlatformFees(ADMIN, TOKEN))
                    .isInstanceOf(PaymentException.class);
            verify(activityRecorder, never()).record(any());
        }
    }
}
