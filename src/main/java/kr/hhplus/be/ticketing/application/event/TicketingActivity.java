package kr.hhplus.be.ticketing.application.event;

import kr.hhplus.be.ticketing.domain.common.Address;
import lombok.Builder;

import java.time.Instant;

/**
 * 성공한 상태 전이 하나당 하나씩 남는 구조화된 기록
 *
 * - 발행 시점: 작업 트랜잭션 안에서 저장, 커밋 후(AFTER_COMMIT) 로그 출력
 * - 롤백된 작업은 기록을 남기지 않는다
 */
@Builder
public record TicketingActivity(
        ActivityType type,
        Address subject,
        Address actor,
        Address counterparty,
        Long amount,
        Long fee,
        Long ticketId,
        String detail,
        Instant occurredAt
) {}
