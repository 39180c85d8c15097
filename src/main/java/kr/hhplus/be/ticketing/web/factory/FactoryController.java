package kr.hhplus.be.ticketing.web.factory;

import kr.hhplus.be.ticketing.application.port.in.TicketFactoryUseCase;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/factory")
@RequiredArgsConstructor
public class FactoryController {

    private final TicketFactoryUseCase ticketFactoryUseCase;

    // 팩토리 주소와 복제 템플릿 정보
    @GetMapping
    public ResponseEntity<Map<String, String>> getFactory() {
        var factory = ticketFactoryUseCase.getFactory();
        return ResponseEntity.ok(Map.of(
                "address", factory.address().value(),
                "templateId", factory.templateId(),
                "name", factory.name(),
                "symbol", factory.symbol()
        ));
    }
}
