package kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.adapter;

import kr.hhplus.be.ticketing.application.port.out.PlatformPort;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.platform.Platform;
import kr.hhplus.be.ticketing.infrastructure.config.TicketingProperties;
import kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.entity.PlatformJpaEntity;
import kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.repository.PlatformJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 플랫폼 JPA 어댑터
 * - 배포당 플랫폼은 하나이며, 설정된 플랫폼 주소로 조회한다
 */
@Component
@RequiredArgsConstructor
public class PlatformJpaAdapter implements PlatformPort {

    private final PlatformJpaRepository repository;
    private final TicketingProperties properties;

    @Override
    public Optional<Platform> find() {
        return repository.findById(platformAddress()).map(this::toDomain);
    }

    @Override
    public Optional<Platform> findForUpdate() {
        return repository.findForUpdate(platformAddress()).map(this::toDomain);
    }

    @Override
    public void save(Platform platform) {
        PlatformJpaEntity entity = repository.findById(platform.getAddress().value())
                .orElseGet(() -> new PlatformJpaEntity(
                        platform.getAddress().value(),
                        platform.getOwner().value(),
                        platform.getFeeBps(),
                        platform.getPaymentToken().value(),
                        platform.isPaused()
                ));

        entity.apply(platform.getFeeBps(), platform.getPaymentToken().value(), platform.isPaused());
        repository.save(entity);
    }

    private String platformAddress() {
        return Address.of(properties.getPlatform().getAddress()).value();
    }

    private Platform toDomain(PlatformJpaEntity entity) {
        return Platform.restore(
                Address.of(entity.getAddress()),
                Address.of(entity.getOwner()),
                entity.getFeeBps(),
                Address.of(entity.getPaymentToken()),
                entity.isPaused(),
                entity.getVersion()
        );
    }
}
