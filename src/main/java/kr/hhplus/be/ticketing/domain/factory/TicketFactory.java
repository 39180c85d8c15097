package kr.hhplus.be.ticketing.domain.factory;

import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.common.exception.ValidationException;
import kr.hhplus.be.ticketing.domain.series.SeriesTerms;
import kr.hhplus.be.ticketing.domain.series.TicketSeries;
import kr.hhplus.be.ticketing.domain.series.TicketSeriesTemplate;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * 티켓 시리즈 팩토리
 * - 공유 템플릿을 복제해 새 시리즈(새 주소, 빈 상태)를 만들고 곧바로 1회 초기화한다
 * - 식별자 생성과 상태 초기화는 별도 단계이며, 초기화는 시리즈 쪽에서 재호출을 막는다
 */
public class TicketFactory {

    private final Address address;
    private final TicketSeriesTemplate template;
    private final Supplier<Address> addressGenerator;

    public TicketFactory(Address address, TicketSeriesTemplate template) {
        this(address, template, Address::generate);
    }

    public TicketFactory(Address address, TicketSeriesTemplate template, Supplier<Address> addressGenerator) {
        this.address = Objects.requireNonNull(address, "팩토리 주소는 필수입니다");
        this.template = Objects.requireNonNull(template, "템플릿은 필수입니다");
        this.addressGenerator = Objects.requireNonNull(addressGenerator, "주소 생성기는 필수입니다");
    }

    public TicketSeries createEvent(Address organization, String uri, long ticketPrice, Instant deadline,
                                    long maxSupply, Address platform, Instant now) {
        if (organization == null || organization.isZero()) throw ValidationException.zeroAddress("organization");
        if (platform == null || platform.isZero()) throw ValidationException.zeroAddress("platform");
        template.validateDeadline(deadline, now);
        if (maxSupply <= 0) throw ValidationException.nonPositiveSupply(maxSupply);
        template.validatePrice(ticketPrice);

        TicketSeries series = template.instantiate(addressGenerator.get());
        series.initialize(SeriesTerms.builder()
                .organization(organization)
                .platform(platform)
                .baseUri(uri)
                .ticketPrice(ticketPrice)
                .deadline(deadline)
                .maxSupply(maxSupply)
                .build(), now);
        return series;
    }

    public Address getAddress() { return address; }
    public TicketSeriesTemplate getTemplate() { return template; }
}
