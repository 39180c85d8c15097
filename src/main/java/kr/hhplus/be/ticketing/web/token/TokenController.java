package kr.hhplus.be.ticketing.web.token;

import kr.hhplus.be.ticketing.application.port.in.TokenLedgerUseCase;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.web.common.CallerHeader;
import kr.hhplus.be.ticketing.web.token.dto.*;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * 로컬 결제 토큰 원장 API (개발/테스트용 잔액 적립과 허용량 설정)
 */
@RestController
@RequestMapping("/api/tokens/{token}")
@RequiredArgsConstructor
@Validated
public class TokenController {

    private final TokenLedgerUseCase tokenLedgerUseCase;

    @PostMapping("/credits")
    public ResponseEntity<BalanceResponse> credit(
            @PathVariable String token,
            @RequestBody @Validated CreditRequest request) {

        Address tokenAddress = Address.of(token);
        Address holder = Address.of(request.holder());
        long balance = tokenLedgerUseCase.credit(
                new TokenLedgerUseCase.CreditCommand(tokenAddress, holder, request.amount()));
        return ResponseEntity.ok(new BalanceResponse(tokenAddress.value(), holder.value(), balance));
    }

    // 호출자(owner)가 spender 에게 허용량 부여
    @PutMapping("/allowances")
    public ResponseEntity<AllowanceResponse> approve(
            @RequestHeader(CallerHeader.NAME) String caller,
            @PathVariable String token,
            @RequestBody @Validated ApproveRequest request) {

        Address tokenAddress = Address.of(token);
        Address owner = Address.of(caller);
        Address spender = Address.of(request.spender());
        tokenLedgerUseCase.approve(
                new TokenLedgerUseCase.ApproveCommand(tokenAddress, owner, spender, request.amount()));
        return ResponseEntity.ok(new AllowanceResponse(tokenAddress.value(), owner.value(), spender.value(), request.amount()));
    }

    @GetMapping("/balances/{holder}")
    public ResponseEntity<BalanceResponse> balanceOf(
            @PathVariable String token,
            @PathVariable String holder) {

        Address tokenAddress = Address.of(token);
        Address holderAddress = Address.of(holder);
        return ResponseEntity.ok(new BalanceResponse(
                tokenAddress.value(),
                holderAddress.value(),
                tokenLedgerUseCase.balanceOf(tokenAddress, holderAddress)
        ));
    }

    @GetMapping("/allowances/{owner}/{spender}")
    public ResponseEntity<AllowanceResponse> allowance(
            @PathVariable String token,
            @PathVariable String owner,
            @PathVariable String spender) {

        Address tokenAddress = Address.of(token);
        Address ownerAddress = Address.of(owner);
        Address spenderAddress = Address.of(spender);
        return ResponseEntity.ok(new AllowanceResponse(
                tokenAddress.value(),
                ownerAddress.value(),
                spenderAddress.value(),
                tokenLedgerUseCase.allowance(tokenAddress, ownerAddress, spenderAddress)
        ));
    }
}
