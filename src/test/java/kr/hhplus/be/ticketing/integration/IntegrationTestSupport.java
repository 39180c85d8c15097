package kr.hhplus.be.ticketing.integration;

import kr.hhplus.be.ticketing.application.port.in.OrganizationUseCase;
import kr.hhplus.be.ticketing.application.port.in.OrganizationUseCase.CreateEventCommand;
import kr.hhplus.be.ticketing.application.port.in.PlatformRegistryUseCase;
import kr.hhplus.be.ticketing.application.port.in.TicketSeriesUseCase;
import kr.hhplus.be.ticketing.application.port.in.TokenLedgerUseCase;
import kr.hhplus.be.ticketing.application.port.in.TokenLedgerUseCase.ApproveCommand;
import kr.hhplus.be.ticketing.application.port.in.TokenLedgerUseCase.CreditCommand;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.infrastructure.config.PlatformBootstrap;
import kr.hhplus.be.ticketing.infrastructure.persistence.activity.jpa.repository.TicketingActivityJpaRepository;
import kr.hhplus.be.ticketing.infrastructure.persistence.organization.jpa.repository.OrganizationJpaRepository;
import kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.repository.OrganizationOwnershipJpaRepository;
import kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.repository.OrganizerAllowlistJpaRepository;
import kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.repository.PlatformJpaRepository;
import kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.repository.RegisteredEventJpaRepository;
import kr.hhplus.be.ticketing.infrastructure.persistence.series.jpa.repository.TicketJpaRepository;
import kr.hhplus.be.ticketing.infrastructure.persistence.series.jpa.repository.TicketSeriesJpaRepository;
import kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.repository.TokenAllowanceJpaRepository;
import kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.repository.TokenBalanceJpaRepository;
import kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.repository.TokenLedgerJpaRepository;
import kr.hhplus.be.ticketing.concurrency.config.TestTaskExecutorConfig;
import kr.hhplus.be.ticketing.support.MutableClock;
import kr.hhplus.be.ticketing.support.TestClockConfig;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.time.Instant;

import static kr.hhplus.be.ticketing.support.TestAddresses.ADMIN;
import static kr.hhplus.be.ticketing.support.TestAddresses.TOKEN;

/**
 * 통합 테스트 베이스
 * - H2 + 로컬 원장 락
 * - 매 테스트 전 모든 테이블을 비우고 플랫폼을 설정값으로 다시 만든다
 */
@Slf4j
@SpringBootTest
@Import({TestClockConfig.class, TestTaskExecutorConfig.class})
public abstract class IntegrationTestSupport {

    @Autowired
    protected PlatformRegistryUseCase platformRegistryUseCase;

    @Autowired
    protected OrganizationUseCase organizationUseCase;

    @Autowired
    protected TicketSeriesUseCase ticketSeriesUseCase;

    @Autowired
    protected TokenLedgerUseCase tokenLedgerUseCase;

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected TicketingActivityJpaRepository activityRepository;

    @Autowired
    protected TicketSeriesJpaRepository seriesRepository;

    @Autowired
    protected TicketJpaRepository ticketRepository;

    @Autowired
    protected RegisteredEventJpaRepository registeredEventRepository;

    @Autowired
    protected OrganizationJpaRepository organizationRepository;

    @Autowired
    protected OrganizationOwnershipJpaRepository ownershipRepository;

    @Autowired
    private OrganizerAllowlistJpaRepository allowlistRepository;

    @Autowired
    private PlatformJpaRepository platformRepository;

    @Autowired
    private TokenBalanceJpaRepository balanceRepository;

    @Autowired
    private TokenAllowanceJpaRepository allowanceRepository;

    @Autowired
    private TokenLedgerJpaRepository tokenLedgerRepository;

    @Autowired
    private PlatformBootstrap platformBootstrap;

    @BeforeEach
    void resetState() {
        log.info("테스트 시작 전 데이터 정리");
        activityRepository.deleteAllInBatch();
        ticketRepository.deleteAllInBatch();
        seriesRepository.deleteAllInBatch();
        registeredEventRepository.deleteAllInBatch();
        ownershipRepository.deleteAllInBatch();
        organizationRepository.deleteAllInBatch();
        allowlistRepository.deleteAllInBatch();
        tokenLedgerRepository.deleteAllInBatch();
        allowanceRepository.deleteAllInBatch();
        balanceRepository.deleteAllInBatch();
        platformRepository.deleteAllInBatch();

        clock.setInstant(Instant.now());
        platformBootstrap.run(null);
    }

    // === 시나리오 헬퍼 ===

    protected Address createOrganization(Address owner) {
        platformRegistryUseCase.setOrganizerStatus(ADMIN, owner, true);
        return platformRegistryUseCase.createOrganization(owner);
    }

    protected Address createEvent(Address owner, Address organization, long price, long maxSupply) {
        return organizationUseCase.createEvent(new CreateEventCommand(
                owner, organization, "ipfs://event/", price, clock.instant().plus(Duration.ofDays(1)), maxSupply));
    }

    protected void fund(Address buyer, Address event, long amount) {
        tokenLedgerUseCase.credit(new CreditCommand(TOKEN, buyer, amount));
        tokenLedgerUseCase.approve(new ApproveCommand(TOKEN, buyer, event, amount));
    }

    protected long balance(Address holder) {
        return tokenLedgerUseCase.balanceOf(TOKEN, holder);
    }
}
