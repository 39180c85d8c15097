package kr.hhplus.be.ticketing.application.port.out;

import kr.hhplus.be.ticketing.domain.platform.Platform;

import java.util.Optional;

/**
 * 플랫폼 관리 컨텍스트 저장소 (단일 레코드)
 */
public interface PlatformPort {

    Optional<Platform> find();

    // 관리자 변경 시 행 잠금
    Optional<Platform> findForUpdate();

    void save(Platform platform);
}
