package kr.hhplus.be.ticketing.web.activity;

import kr.hhplus.be.ticketing.application.port.in.ActivityQueryUseCase;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.web.activity.dto.ActivityResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/activities")
@RequiredArgsConstructor
public class ActivityController {

    private final ActivityQueryUseCase activityQueryUseCase;

    // 주소(조직/이벤트/플랫폼) 기준 최근 활동 조회
    @GetMapping("/{subject}")
    public ResponseEntity<List<ActivityResponse>> recentActivities(
            @PathVariable String subject,
            @RequestParam(defaultValue = "20") int limit) {

        return ResponseEntity.ok(activityQueryUseCase.recentActivities(Address.of(subject), limit).stream()
                .map(ActivityResponse::from)
                .toList());
    }
}
