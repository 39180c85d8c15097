package kr.hhplus.be.ticketing.application.service;

import kr.hhplus.be.ticketing.application.event.ActivityRecorder;
import kr.hhplus.be.ticketing.application.port.in.OrganizationUseCase.CreateEventCommand;
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
import kr.hhplus.be.ticketing.domain.common.exception.AuthorizationException;
import kr.hhplus.be.ticketing.domain.common.exception.PaymentException;
import kr.hhplus.be.ticketing.domain.common.exception.StateException;
import kr.hhplus.be.ticketing.domain.common.exception.ValidationException;
import kr.hhplus.be.ticketing.domain.organization.Organization;
import kr.hhplus.be.ticketing.domain.platform.Platform;
import kr.hhplus.be.ticketing.domain.series.SeriesState;
import kr.hhplus.be.ticketing.support.LedgerStubs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static kr.hhplus.be.ticketing.support.TestAddresses.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrganizationServiceTest {

    private static final Address ORG = of(0x0a6);
    private static final Address EVENT = of(0xe1);
    private static final Instant NOW = Instant.parse("2030-01-01T00:00:00Z");
    private static final Instant DEADLINE = NOW.plusSeconds(86_400);

    @Mock
    private OrganizationPort organizationPort;

    @Mock
    private PlatformPort platformPort;

    @Mock
    private EventRegistryPort eventRegistryPort;

    @Mock
    private PaymentTokenPort paymentTokenPort;

    @Mock
    private TicketFactoryUseCase ticketFactoryUseCase;

    @Mock
    private TicketSeriesUseCase ticketSeriesUseCase;

    @Mock
    private PlatformRegistryUseCase platformRegistryUseCase;

    @Mock
    private ActivityRecorder activityRecorder;

    @Mock
    private LedgerExecutor ledger;

    private Platform platform;
    private Organization organization;
    private OrganizationService organizationService;

    @BeforeEach
    void setUp() {
        LedgerStubs.passThrough(ledger);
        platform = Platform.create(PLATFORM, ADMIN, 500, TOKEN);
        organization = Organization.create(ORG, PLATFORM, ALICE, NOW);
        lenient().when(platformPort.find()).thenReturn(Optional.of(platform));
        lenient().when(organizationPort.findForUpdate(ORG)).thenReturn(Optional.of(organization));

        organizationService = new OrganizationService(
                organizationPort,
                platformPort,
                eventRegistryPort,
                paymentTokenPort,
                ticketFactoryUseCase,
                ticketSeriesUseCase,
                platformRegistryUseCase,
                activityRecorder,
                ledger,
                new ReentrancyGuard(),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    private SeriesInfo series(Address organization, SeriesState state) {
        return new SeriesInfo(EVENT, organization, PLATFORM, "ticket-series-v1", "ipfs://e/",
                200, DEADLINE, 10, 0, state);
    }

    @Nested
    @DisplayName("이벤트 생성")
    class CreateEvent {

        @Test
        @DisplayName("팩토리 생성 후 레지스트리에 등록된다")
        void create() {
            // given
            CreateSeriesCommand expected = new CreateSeriesCommand(ORG, "ipfs://e/", 200, DEADLINE, 10, PLATFORM);
            when(ticketFactoryUseCase.createEvent(expected)).thenReturn(EVENT);

            // when
            Address event = organizationService.createEvent(
                    new CreateEventCommand(ALICE, ORG, "ipfs://e/", 200, DEADLINE, 10));

            // then
            assertThat(event).isEqualTo(EVENT);
            InOrder inOrder = inOrder(ticketFactoryUseCase, platformRegistryUseCase);
            inOrder.verify(ticketFactoryUseCase).createEvent(expected);
            inOrder.verify(platformRegistryUseCase).registerEvent(ORG, EVENT);
        }

        @Test
        @DisplayName("소유자가 아니면 AuthorizationException")
        void notOwner() {
            assertThatThrownBy(() -> organizationService.createEvent(
                    new CreateEventCommand(BOB, ORG, "", 200, DEADLINE, 10)))
                    .isInstanceOf(AuthorizationException.class);
            verifyNoInteractions(ticketFactoryUseCase, platformRegistryUseCase);
        }

        @Test
        @DisplayName("과거 마감시각, 0 발행량, 0 가격은 ValidationException")
        void invalid() {
            assertThatThrownBy(() -> organizationService.createEvent(
                    new CreateEventCommand(ALICE, ORG, "", 200, NOW, 10)))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> organizationService.createEvent(
                    new CreateEventCommand(ALICE, ORG, "", 200, DEADLINE, 0)))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> organizationService.createEvent(
                    new CreateEventCommand(ALICE, ORG, "", 0, DEADLINE, 10)))
                    .isInstanceOf(ValidationException.class);
            verifyNoInteractions(ticketFactoryUseCase);
        }

        @Test
        @DisplayName("조직이 일시정지되면 StateException")
        void organizationPaused() {
            organization.pause(PLATFORM);

            assertThatThrownBy(() -> organizationService.createEvent(
                    new CreateEventCommand(ALICE, ORG, "", 200, DEADLINE, 10)))
                    .isInstanceOf(StateException.class);
        }

        @Test
        @DisplayName("플랫폼 전역 일시정지 중에는 StateException")
        void platformPaused() {
            platform.pause(ADMIN);

            assertThatThrownBy(() -> organizationService.createEvent(
                    new CreateEventCommand(ALICE, ORG, "", 200, DEADLINE, 10)))
                    .isInstanceOf(StateException.class);
        }

        @Test
        @DisplayName("레지스트리 등록 실패는 그대로 전파된다")
        void registryFails() {
            when(ticketFactoryUseCase.createEvent(any())).thenReturn(EVENT);
            doThrow(new StateException("이미 등록된 이벤트입니다"))
                    .when(platformRegistryUseCase).registerEvent(ORG, EVENT);

            assertThatThrownBy(() -> organizationService.createEvent(
                    new CreateEventCommand(ALICE, ORG, "", 200, DEADLINE, 10)))
                    .isInstanceOf(StateException.class);
        }
    }

    @Nested
    @DisplayName("이벤트 마감")
    class CloseEvent {

        @Test
        @DisplayName("시리즈 마감 후 레지스트리에서 지난 이벤트로 이동한다")
        void close() {
            when(ticketSeriesUseCase.getSeries(EVENT)).thenReturn(series(ORG, SeriesState.OPEN));

            organizationService.closeEvent(ALICE, ORG, EVENT);

            InOrder inOrder = inOrder(ticketSeriesUseCase, platformRegistryUseCase);
            inOrder.verify(ticketSeriesUseCase).close(ORG, EVENT);
            inOrder.verify(platformRegistryUseCase).markEventAsClosed(ORG, EVENT);
        }

        @Test
        @DisplayName("이미 마감된 이벤트는 StateException")
        void alreadyClosed() {
            when(ticketSeriesUseCase.getSeries(EVENT)).thenReturn(series(ORG, SeriesState.CLOSED));

            assertThatThrownBy(() -> organizationService.closeEvent(ALICE, ORG, EVENT))
                    .isInstanceOf(StateException.class);
            verify(ticketSeriesUseCase, never()).close(any(), any());
        }

        @Test
        @DisplayName("다른 조직의 이벤트는 StateException")
        void otherOrganization() {
            when(ticketSeriesUseCase.getSeries(EVENT)).thenReturn(series(of(0x0b7), SeriesState.OPEN));

            assertThatThrownBy(() -> organizationService.closeEvent(ALICE, ORG, EVENT))
                    .isInstanceOf(StateException.class);
            assertThatThrownBy(() -> organizationService.setTicketPrice(ALICE, ORG, EVENT, 100))
                    .isInstanceOf(StateException.class);
            verifyNoInteractions(platformRegistryUseCase);
        }
    }

    @Test
    @DisplayName("가격 변경은 조직 주소로 시리즈에 전달된다")
    void setTicketPrice() {
        when(ticketSeriesUseCase.getSeries(EVENT)).thenReturn(series(ORG, SeriesState.OPEN));

        organizationService.setTicketPrice(ALICE, ORG, EVENT, 300);

        verify(ticketSeriesUseCase).updateTicketPrice(ORG, EVENT, 300);
    }

    @Nested
    @DisplayName("토큰 출금")
    class Withdraw {

        @Test
        @DisplayName("조직 잔액 전부가 소유자에게 이체된다")
        void withdraw() {
            when(paymentTokenPort.balanceOf(TOKEN, ORG)).thenReturn(190L);
            when(paymentTokenPort.transfer(TOKEN, ORG, ALICE, 190L)).thenReturn(true);

            long amount = organizationService.withdrawTokens(ALICE, ORG, TOKEN);

            assertThat(amount).isEqualTo(190);
            verify(activityRecorder).record(any());
        }

        @Test
        @DisplayName("플랫폼 일시정지 중에도 출금할 수 있다")
        void withdrawWhilePaused() {
            platform.pause(ADMIN);
            organization.pause(PLATFORM);
            when(paymentTokenPort.balanceOf(TOKEN, ORG)).thenReturn(5L);
            when(paymentTokenPort.transfer(TOKEN, ORG, ALICE, 5L)).thenReturn(true);

            assertThat(organizationService.withdrawTokens(ALICE, ORG, TOKEN)).isEqualTo(5);
        }

        @Test
        @DisplayName("소유자가 아니거나 잔액이 없으면 실패한다")
        void withdraw_rejected() {
            assertThatThrownBy(() -> organizationService.withdrawTokens(BOB, ORG, TOKEN))
                    .isInstanceOf(AuthorizationException.class);

            when(paymentTokenPort.balanceOf(TOKEN, ORG)).thenReturn(0L);
            assertThatThrownBy(() -> organizationService.withdrawTokens(ALICE, ORG, TOKEN))
                    .isInstanceOf(PaymentException.class);
        }

        @Test
        @DisplayName("이체 중 같은 출금이 다시 호출되면 StateException")
        void reentrantWithdraw() {
            when(paymentTokenPort.balanceOf(TOKEN, ORG)).thenReturn(190L);
            when(paymentTokenPort.transfer(TOKEN, ORG, ALICE, 190L)).thenAnswer(invocation -> {
                organizationService.withdrawTokens(ALICE, ORG, TOKEN);
                return true;
            });

            assertThatThrownBy(() -> organizationService.withdrawTokens(ALICE, ORG, TOKEN))
                    .isInstanceOf(StateException.class)
                    .hasMessageContaining("재진입");
            verify(paymentTokenPort, times(1)).balanceOf(TOKEN, ORG);
        }
    }
}
