package kr.hhplus.be.ticketing.support;

import kr.hhplus.be.ticketing.application.support.LedgerExecutor;

import java.util.function.Supplier;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;

/**
 * mock LedgerExecutor 가 넘겨받은 작업을 그대로 실행하도록 설정
 */
public final class LedgerStubs {

    private LedgerStubs() {
    }

    public static void passThrough(LedgerExecutor ledger) {
        lenient().when(ledger.execute(any()))
                .thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(0)).get());
        lenient().doAnswer(invocation -> {
            ((Runnable) invocation.getArgument(0)).run();
            return null;
        }).when(ledger).run(any());
    }
}
