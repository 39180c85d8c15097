package kr.hhplus.be.ticketing.domain.series;

import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.common.exception.ValidationException;

import java.time.Instant;
import java.util.Objects;

/**
 * 모든 시리즈가 공유하는 불변 동작 템플릿
 * - 팩토리는 이 템플릿을 참조하는 새 인스턴스(새 주소, 빈 저장소)만 만든다
 * - 판매 조건 검증과 tokenURI 규칙은 템플릿에 있다
 */
public final class TicketSeriesTemplate {

    private final String templateId;
    private final String name;
    private final String symbol;

    public TicketSeriesTemplate(String templateId, String name, String symbol) {
        if (templateId == null || templateId.isBlank()) {
            throw new IllegalArgumentException("템플릿 ID는 필수입니다");
        }
        this.templateId = templateId;
        this.name = Objects.requireNonNullElse(name, "");
        this.symbol = Objects.requireNonNullElse(symbol, "");
    }

    /**
     * 새 식별자와 빈 상태로 인스턴스를 만든다. 초기화는 별도 단계
     */
    public TicketSeries instantiate(Address address) {
        Objects.requireNonNull(address, "시리즈 주소는 필수입니다");
        if (address.isZero()) {
            throw ValidationException.zeroAddress("series");
        }
        return TicketSeries.blank(address, this);
    }

    public void validateTerms(SeriesTerms terms, Instant now) {
        Objects.requireNonNull(terms, "판매 조건은 필수입니다");
        requireNonZero(terms.organization(), "organization");
        requireNonZero(terms.platform(), "platform");
        validatePrice(terms.ticketPrice());
        validateDeadline(terms.deadline(), now);
        if (terms.maxSupply() <= 0) {
            throw ValidationException.nonPositiveSupply(terms.maxSupply());
        }
    }

    public void validatePrice(long price) {
        if (price <= 0) {
            throw ValidationException.nonPositivePrice(price);
        }
    }

    public void validateDeadline(Instant deadline, Instant now) {
        if (deadline == null || !deadline.isAfter(now)) {
            throw ValidationException.deadlineNotInFuture(deadline, now);
        }
    }

    public String tokenUri(String baseUri, long ticketId) {
        return (baseUri == null ? "" : baseUri) + ticketId;
    }

    private static void requireNonZero(Address address, String field) {
        if (address == null || address.isZero()) {
            throw ValidationException.zeroAddress(field);
        }
    }

    public String getTemplateId() { return templateId; }
    public String getName() { return name; }
    public String getSymbol() { return symbol; }
}
