package kr.hhplus.be.ticketing.integration;

import kr.hhplus.be.ticketing.application.event.ActivityType;
import kr.hhplus.be.ticketing.application.port.in.PlatformRegistryUseCase;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.common.exception.StateException;
import kr.hhplus.be.ticketing.domain.series.SeriesState;
import kr.hhplus.be.ticketing.infrastructure.persistence.activity.jpa.entity.TicketingActivityJpaEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.mock.mockito.SpyBean;

import static kr.hhplus.be.ticketing.support.TestAddresses.ALICE;
import static kr.hhplus.be.ticketing.support.TestAddresses.BOB;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

/**
 * 마감의 두 번째 단계(레지스트리 이동)가 실패하면 시리즈 마감도 남지 않는다
 */
class EventCloseRollbackTest extends IntegrationTestSupport {

    @SpyBean
    private PlatformRegistryUseCase registrySpy;

    @Test
    @DisplayName("레지스트리 종료 처리가 실패하면 시리즈는 판매중, 레지스트리는 활성 상태로 남는다")
    void registryFailureKeepsSeriesOpen() {
        // given
        Address organization = createOrganization(ALICE);
        Address event = createEvent(ALICE, organization, 200, 10);
        doThrow(new StateException("종료 처리 실패"))
                .when(registrySpy).markEventAsClosed(any(), any());

        // when
        assertThatThrownBy(() -> organizationUseCase.closeEvent(ALICE, organization, event))
                .isInstanceOf(StateException.class)
                .hasMessage("종료 처리 실패");

        // then
        assertThat(ticketSeriesUseCase.getSeries(event).state()).isEqualTo(SeriesState.OPEN);
        assertThat(platformRegistryUseCase.activeEvents()).containsExactly(event);
        assertThat(platformRegistryUseCase.pastEvents()).isEmpty();
        assertThat(activityRepository.findAll())
                .extracting(TicketingActivityJpaEntity::getType)
                .doesNotContain(ActivityType.SERIES_CLOSED, ActivityType.EVENT_MARKED_CLOSED);

        // 마감이 롤백됐으므로 발행은 계속 가능하다
        fund(BOB, event, 200);
        assertThat(ticketSeriesUseCase.mint(BOB, event).ticketId()).isZero();
    }
}
