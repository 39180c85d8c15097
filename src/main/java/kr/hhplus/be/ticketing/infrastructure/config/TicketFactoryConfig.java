package kr.hhplus.be.ticketing.infrastructure.config;

import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.factory.TicketFactory;
import kr.hhplus.be.ticketing.domain.series.TicketSeriesTemplate;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 팩토리와 템플릿은 배포 시점에 한 번 정해지는 불변 값이다
 */
@Configuration
@RequiredArgsConstructor
public class TicketFactoryConfig {

    private final TicketingProperties properties;

    @Bean
    public TicketSeriesTemplate ticketSeriesTemplate() {
        TicketingProperties.FactoryConfig factory = properties.getFactory();
        return new TicketSeriesTemplate(factory.getTemplateId(), factory.getName(), factory.getSymbol());
    }

    @Bean
    public TicketFactory ticketFactory(TicketSeriesTemplate ticketSeriesTemplate) {
        return new TicketFactory(Address.of(properties.getFactory().getAddress()), ticketSeriesTemplate);
    }
}
