package kr.hhplus.be.ticketing.domain.organization;

import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.common.exception.AuthorizationException;
import kr.hhplus.be.ticketing.domain.common.exception.StateException;
import kr.hhplus.be.ticketing.domain.common.exception.ValidationException;

import java.time.Instant;
import java.util.Objects;

/**
 * 조직 애그리게이트
 * - platform 은 생성 후 바뀌지 않는다
 * - owner 는 제로 주소가 될 수 없고, 플랫폼만 변경할 수 있다
 * - paused 는 소유자가 아닌 플랫폼이 제어한다
 */
public class Organization {

    private final Address address;
    private final Address platform;
    private final Instant createdAt;
    private Address owner;
    private String bannerUri;
    private boolean paused;
    private long version;

    private Organization(Address address, Address platform, Address owner, String bannerUri,
                         boolean paused, Instant createdAt, long version) {
        this.address = Objects.requireNonNull(address, "조직 주소는 필수입니다");
        this.platform = Objects.requireNonNull(platform, "플랫폼 주소는 필수입니다");
        this.owner = Objects.requireNonNull(owner, "조직 소유자는 필수입니다");
        this.bannerUri = bannerUri;
        this.paused = paused;
        this.createdAt = createdAt;
        this.version = version;
    }

    public static Organization create(Address address, Address platform, Address owner, Instant createdAt) {
        if (owner.isZero()) throw ValidationException.zeroAddress("owner");
        if (platform.isZero()) throw ValidationException.zeroAddress("platform");
        return new Organization(address, platform, owner, "", false, createdAt, 0L);
    }

    public static Organization restore(Address address, Address platform, Address owner, String bannerUri,
                                       boolean paused, Instant createdAt, long version) {
        return new Organization(address, platform, owner, bannerUri, paused, createdAt, version);
    }

    // === 소유자 작업 ===

    public void requireOwner(Address caller) {
        if (!owner.equals(caller)) {
            throw AuthorizationException.notOwner(caller, owner);
        }
    }

    public void requireNotPaused() {
        if (paused) {
            throw new StateException("조직이 일시정지 상태입니다: " + address);
        }
    }

    /**
     * 소유자 작업 공통 가드: 소유자 여부 → 일시정지 여부
     */
    public void requireOperableBy(Address caller) {
        requireOwner(caller);
        requireNotPaused();
    }

    public void updateBanner(Address caller, String uri) {
        requireOperableBy(caller);
        this.bannerUri = uri == null ? "" : uri;
    }

    // === 플랫폼 작업 ===

    public void pause(Address caller) {
        requirePlatform(caller);
        if (paused) {
            throw new StateException("조직이 이미 일시정지 상태입니다: " + address);
        }
        this.paused = true;
    }

    public void unpause(Address caller) {
        requirePlatform(caller);
        if (!paused) {
            throw new StateException("조직이 일시정지 상태가 아닙니다: " + address);
        }
        this.paused = false;
    }

    public void transferOwnership(Address caller, Address newOwner) {
        requirePlatform(caller);
        if (newOwner == null || newOwner.isZero()) {
            throw ValidationException.zeroAddress("newOwner");
        }
        this.owner = newOwner;
    }

    private void requirePlatform(Address caller) {
        if (!platform.equals(caller)) {
            throw AuthorizationException.notPlatform(caller);
        }
    }

    public Address getAddress() { return address; }
    public Address getPlatform() { return platform; }
    public Address getOwner() { return owner; }
    public String getBannerUri() { return bannerUri; }
    public boolean isPaused() { return paused; }
    public Instant getCreatedAt() { return createdAt; }
    public long getVersion() { return version; }
}
