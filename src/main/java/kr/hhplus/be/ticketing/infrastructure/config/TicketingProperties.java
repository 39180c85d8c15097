package kr.hhplus.be.ticketing.infrastructure.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * ticketing.* 설정
 * - platform: 부트스트랩 시 생성할 플랫폼 관리 컨텍스트
 * - factory: 팩토리 주소와 템플릿 메타데이터
 * - lock: 원장 락 구현 선택 (local / redis)
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "ticketing")
public class TicketingProperties {

    private PlatformConfig platform = new PlatformConfig();
    private FactoryConfig factory = new FactoryConfig();
    private LockConfig lock = new LockConfig();

    @Getter
    @Setter
    public static class PlatformConfig {
        private String address;
        private String owner;
        private int feeBps = 500;
        private String paymentToken;
    }

    @Getter
    @Setter
    public static class FactoryConfig {
        private String address;
        private String templateId = "ticket-series-v1";
        private String name = "Event Ticket";
        private String symbol = "TIX";
    }

    @Getter
    @Setter
    public static class LockConfig {
        private String type = "local";
        private long ttlSeconds = 10;
        private int retryCount = 50;
        private long retryDelayMillis = 100;
        // 로컬 락 대기 한도
        private long waitMillis = 5_000;
    }
}
