package kr.hhplus.be.ticketing.infrastructure.persistence.series.jpa.adapter;

import kr.hhplus.be.ticketing.application.port.out.TicketSeriesPort;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.series.TicketSeries;
import kr.hhplus.be.ticketing.domain.series.TicketSeriesTemplate;
import kr.hhplus.be.ticketing.infrastructure.persistence.series.jpa.entity.TicketSeriesJpaEntity;
import kr.hhplus.be.ticketing.infrastructure.persistence.series.jpa.repository.TicketSeriesJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 티켓 시리즈 JPA 어댑터
 * - 시리즈는 템플릿 ID만 저장하고, 복원 시 배포된 템플릿을 다시 연결한다
 * - 저장소에는 초기화가 끝난 시리즈만 기록된다 (생성과 초기화가 같은 트랜잭션)
 */
@Component
@RequiredArgsConstructor
public class TicketSeriesJpaAdapter implements TicketSeriesPort {

    private final TicketSeriesJpaRepository repository;
    private final TicketSeriesTemplate template;

    @Override
    public Optional<TicketSeries> find(Address address) {
        return repository.findById(address.value()).map(this::toDomain);
    }

    @Override
    public Optional<TicketSeries> findForUpdate(Address address) {
        return repository.findForUpdate(address.value()).map(this::toDomain);
    }

    @Override
    public void save(TicketSeries series) {
        TicketSeriesJpaEntity entity = repository.findById(series.getAddress().value())
                .orElseGet(() -> new TicketSeriesJpaEntity(
                        series.getAddress().value(),
                        series.getTemplate().getTemplateId(),
                        series.getOrganization().value(),
                        series.getPlatform().value(),
                        series.getBaseUri(),
                        series.getMaxSupply()
                ));

        entity.apply(series.getState(), series.getTicketPrice(), series.getDeadline(), series.getCurrentSupply());
        repository.save(entity);
    }

    private TicketSeries toDomain(TicketSeriesJpaEntity entity) {
        if (!template.getTemplateId().equals(entity.getTemplateId())) {
            throw new IllegalStateException(
                    String.format("알 수 없는 템플릿입니다. series: %s, templateId: %s",
                            entity.getAddress(), entity.getTemplateId()));
        }
        return TicketSeries.restore(
                Address.of(entity.getAddress()),
                template,
                entity.getState(),
                Address.of(entity.getOrganization()),
                Address.of(entity.getPlatform()),
                entity.getBaseUri(),
                entity.getTicketPrice(),
                entity.getDeadline(),
                entity.getMaxSupply(),
                entity.getCurrentSupply(),
                entity.getVersion()
        );
    }
}
