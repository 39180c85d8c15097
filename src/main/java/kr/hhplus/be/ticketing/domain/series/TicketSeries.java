package kr.hhplus.be.ticketing.domain.series;

import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.common.exception.AuthorizationException;
import kr.hhplus.be.ticketing.domain.common.exception.StateException;

import java.time.Instant;
import java.util.Objects;

/**
 * 티켓 시리즈(이벤트) 애그리게이트
 *
 * 불변식
 * - currentSupply ≤ maxSupply, 발행된 ticketId 는 0..currentSupply-1
 * - organization/platform 은 초기화 시 한 번만 설정
 * - CLOSED 가 되면 다시 열리지 않는다
 * - 가격/마감시각은 마감 전까지만 변경 가능
 */
public class TicketSeries {

    private final Address address;
    private final TicketSeriesTemplate template;

    private Address organization;
    private Address platform;
    private String baseUri;
    private long ticketPrice;
    private Instant deadline;
    private long maxSupply;
    private long currentSupply;
    private SeriesState state;
    private long version;

    private TicketSeries(Address address, TicketSeriesTemplate template) {
        this.address = Objects.requireNonNull(address, "시리즈 주소는 필수입니다");
        this.template = Objects.requireNonNull(template, "템플릿은 필수입니다");
        this.state = SeriesState.UNINITIALIZED;
    }

    static TicketSeries blank(Address address, TicketSeriesTemplate template) {
        return new TicketSeries(address, template);
    }

    public static TicketSeries restore(Address address, TicketSeriesTemplate template, SeriesState state,
                                       Address organization, Address platform, String baseUri,
                                       long ticketPrice, Instant deadline, long maxSupply,
                                       long currentSupply, long version) {
        TicketSeries series = new TicketSeries(address, template);
        series.state = Objects.requireNonNull(state, "상태는 필수입니다");
        series.organization = organization;
        series.platform = platform;
        series.baseUri = baseUri;
        series.ticketPrice = ticketPrice;
        series.deadline = deadline;
        series.maxSupply = maxSupply;
        series.currentSupply = currentSupply;
        series.version = version;
        return series;
    }

    // === 초기화 (1회) ===

    public void initialize(SeriesTerms terms, Instant now) {
        if (state != SeriesState.UNINITIALIZED) {
            throw new StateException("이미 초기화된 이벤트입니다: " + address);
        }
        template.validateTerms(terms, now);

        this.organization = terms.organization();
        this.platform = terms.platform();
        this.baseUri = terms.baseUri() == null ? "" : terms.baseUri();
        this.ticketPrice = terms.ticketPrice();
        this.deadline = terms.deadline();
        this.maxSupply = terms.maxSupply();
        this.currentSupply = 0L;
        this.state = SeriesState.OPEN;
    }

    // === 발행 / 양도 ===

    /**
     * 발행 가능 여부 확인. 결제 전 진입 검증과 소유권 기록 직전 재검증에 모두 쓰인다
     */
    public void requireMintable(Instant now) {
        requireOpen();
        requireBeforeDeadline(now);
        if (currentSupply >= maxSupply) {
            throw new StateException(
                    String.format("매진된 이벤트입니다. 발행량: %d / %d", currentSupply, maxSupply));
        }
    }

    public Ticket issueTicket(Address holder, Instant now) {
        requireMintable(now);
        Ticket ticket = Ticket.issue(address, currentSupply, holder);
        currentSupply++;
        return ticket;
    }

    public void requireTransferable(Instant now) {
        requireOpen();
        requireBeforeDeadline(now);
    }

    public void transferTicket(Ticket ticket, Address from, Address to, Instant now) {
        requireTransferable(now);
        if (!address.equals(ticket.getSeries())) {
            throw new StateException("다른 이벤트의 티켓입니다: " + ticket.getSeries());
        }
        ticket.moveTo(from, to);
    }

    // === 조직 전용 ===

    public void updateTicketPrice(Address caller, long newPrice) {
        requireOrganization(caller);
        requireNotClosed();
        template.validatePrice(newPrice);
        this.ticketPrice = newPrice;
    }

    public void updateDeadline(Address caller, Instant newDeadline, Instant now) {
        requireOrganization(caller);
        requireNotClosed();
        template.validateDeadline(newDeadline, now);
        this.deadline = newDeadline;
    }

    /**
     * 이미 마감된 시리즈에 대한 재호출은 StateException
     */
    public void close(Address caller) {
        requireOrganization(caller);
        if (!state.canTransitionTo(SeriesState.CLOSED)) {
            throw new StateException(
                    String.format("현재 상태[%s]에서는 마감할 수 없습니다: %s", state.getDisplayName(), address));
        }
        this.state = SeriesState.CLOSED;
    }

    public void requireOrganization(Address caller) {
        if (organization == null || !organization.equals(caller)) {
            throw new AuthorizationException("이벤트를 소유한 조직만 호출할 수 있습니다. 호출자: " + caller);
        }
    }

    // === 조회 ===

    public boolean isMinted(long ticketId) {
        return ticketId >= 0 && ticketId < currentSupply;
    }

    public boolean validateTicket(long ticketId, Instant now) {
        return isMinted(ticketId) && state == SeriesState.OPEN && now.isBefore(deadline);
    }

    public String tokenUri(long ticketId) {
        if (!isMinted(ticketId)) {
            throw StateException.notFound("티켓", ticketId);
        }
        return template.tokenUri(baseUri, ticketId);
    }

    public boolean isClosed() {
        return state == SeriesState.CLOSED;
    }

    private void requireOpen() {
        if (state == SeriesState.UNINITIALIZED) {
            throw new StateException("초기화되지 않은 이벤트입니다: " + address);
        }
        if (state == SeriesState.CLOSED) {
            throw new StateException("마감된 이벤트입니다: " + address);
        }
    }

    private void requireNotClosed() {
        if (state == SeriesState.CLOSED) {
            throw new StateException("마감된 이벤트입니다: " + address);
        }
    }

    private void requireBeforeDeadline(Instant now) {
        if (!now.isBefore(deadline)) {
            throw new StateException(
                    String.format("판매 마감시각이 지났습니다. 마감: %s, 현재: %s", deadline, now));
        }
    }

    public Address getAddress() { return address; }
    public TicketSeriesTemplate getTemplate() { return template; }
    public Address getOrganization() { return organization; }
    public Address getPlatform() { return platform; }
    public String getBaseUri() { return baseUri; }
    public long getTicketPrice() { return ticketPrice; }
    public Instant getDeadline() { return deadline; }
    public long getMaxSupply() { return maxSupply; }
    public long getCurrentSupply() { return currentSupply; }
    public SeriesState getState() { return state; }
    public long getVersion() { return version; }
}
