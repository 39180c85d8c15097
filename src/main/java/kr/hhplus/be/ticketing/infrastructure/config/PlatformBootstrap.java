package kr.hhplus.be.ticketing.infrastructure.config;

import kr.hhplus.be.ticketing.application.port.out.PlatformPort;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.platform.Platform;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 기동 시 플랫폼 관리 컨텍스트가 없으면 설정값으로 생성
 * - 이미 존재하면 저장된 값을 그대로 사용한다 (설정 변경은 관리자 API로)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlatformBootstrap implements ApplicationRunner {

    private final PlatformPort platformPort;
    private final TicketingProperties properties;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (platformPort.find().isPresent()) {
            log.info("플랫폼이 이미 존재합니다 - address: {}", properties.getPlatform().getAddress());
            return;
        }

        TicketingProperties.PlatformConfig config = properties.getPlatform();
        Platform platform = Platform.create(
                Address.of(config.getAddress()),
                Address.of(config.getOwner()),
                config.getFeeBps(),
                Address.of(config.getPaymentToken())
        );
        platformPort.save(platform);

        log.info("플랫폼 생성 완료 - address: {}, owner: {}, feeBps: {}",
                platform.getAddress(), platform.getOwner(), platform.getFeeBps());
    }
}
