package kr.hhplus.be.ticketing.application.port.in;

import kr.hhplus.be.ticketing.domain.common.Address;

public interface TokenLedgerUseCase {

    record CreditCommand(Address token, Address holder, long amount) {}

    record ApproveCommand(Address token, Address owner, Address spender, long amount) {}

    long credit(CreditCommand command);

    void approve(ApproveCommand command);

    long balanceOf(Address token, Address holder);

    long allowance(Address token, Address owner, Address spender);
}
