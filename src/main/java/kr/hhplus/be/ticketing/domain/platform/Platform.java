package kr.hhplus.be.ticketing.domain.platform;

import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.common.FeeSplit;
import kr.hhplus.be.ticketing.domain.common.exception.AuthorizationException;
import kr.hhplus.be.ticketing.domain.common.exception.StateException;
import kr.hhplus.be.ticketing.domain.common.exception.ValidationException;

import java.util.Objects;

/**
 * 플랫폼 관리 컨텍스트
 * - 관리자(owner), 수수료율, 결제 토큰, 전역 일시정지 여부
 * - 변경은 관리자만 가능하며 모든 변경은 이 객체의 메서드를 통한다
 */
public class Platform {

    private final Address address;
    private final Address owner;
    private int feeBps;
    private Address paymentToken;
    private boolean paused;
    private long version;

    private Platform(Address address, Address owner, int feeBps, Address paymentToken, boolean paused, long version) {
        this.address = Objects.requireNonNull(address, "플랫폼 주소는 필수입니다");
        this.owner = Objects.requireNonNull(owner, "플랫폼 관리자는 필수입니다");
        this.feeBps = feeBps;
        this.paymentToken = Objects.requireNonNull(paymentToken, "결제 토큰은 필수입니다");
        this.paused = paused;
        this.version = version;
    }

    public static Platform create(Address address, Address owner, int feeBps, Address paymentToken) {
        if (address.isZero()) throw ValidationException.zeroAddress("platform");
        if (owner.isZero()) throw ValidationException.zeroAddress("owner");
        if (paymentToken.isZero()) throw ValidationException.zeroAddress("paymentToken");
        validateFee(feeBps);
        return new Platform(address, owner, feeBps, paymentToken, false, 0L);
    }

    public static Platform restore(Address address, Address owner, int feeBps, Address paymentToken,
                                   boolean paused, long version) {
        return new Platform(address, owner, feeBps, paymentToken, paused, version);
    }

    // === 관리자 작업 ===

    public void requireAdmin(Address caller) {
        if (!owner.equals(caller)) {
            throw AuthorizationException.notAdmin(caller);
        }
    }

    public void updateFee(Address caller, int newFeeBps) {
        requireAdmin(caller);
        validateFee(newFeeBps);
        this.feeBps = newFeeBps;
    }

    public void updatePaymentToken(Address caller, Address newToken) {
        requireAdmin(caller);
        if (newToken == null || newToken.isZero()) {
            throw ValidationException.zeroAddress("paymentToken");
        }
        this.paymentToken = newToken;
    }

    public void pause(Address caller) {
        requireAdmin(caller);
        if (paused) {
            throw new StateException("플랫폼이 이미 일시정지 상태입니다");
        }
        this.paused = true;
    }

    public void unpause(Address caller) {
        requireAdmin(caller);
        if (!paused) {
            throw new StateException("플랫폼이 일시정지 상태가 아닙니다");
        }
        this.paused = false;
    }

    // === 조회/검증 ===

    public void requireNotPaused() {
        if (paused) {
            throw new StateException("플랫폼이 일시정지 상태입니다");
        }
    }

    public FeeSplit split(long price) {
        return FeeSplit.of(price, feeBps);
    }

    private static void validateFee(int feeBps) {
        if (feeBps < 0 || feeBps > FeeSplit.MAX_BPS) {
            throw ValidationException.feeOutOfRange(feeBps);
        }
    }

    public Address getAddress() { return address; }
    public Address getOwner() { return owner; }
    public int getFeeBps() { return feeBps; }
    public Address getPaymentToken() { return paymentToken; }
    public boolean isPaused() { return paused; }
    public long getVersion() { return version; }
}
