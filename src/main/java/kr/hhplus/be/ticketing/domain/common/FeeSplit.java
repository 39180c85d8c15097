package kr.hhplus.be.ticketing.domain.common;

/**
 * 수수료 분할 결과
 * - fee = floor(price * feeBps / 10000)
 * - remainder = price - fee (버림 손실은 잔액 수령자에게 귀속)
 */
public record FeeSplit(long price, int feeBps, long fee, long remainder) {

    public static final int MAX_BPS = 10_000;

    public FeeSplit {
        if (fee + remainder != price) {
            throw new IllegalStateException("수수료와 잔액의 합이 가격과 다릅니다");
        }
    }

    public static FeeSplit of(long price, int feeBps) {
        if (price <= 0) {
            throw new IllegalArgumentException("가격은 0보다 커야 합니다: " + price);
        }
        if (feeBps < 0 || feeBps > MAX_BPS) {
            throw new IllegalArgumentException("수수료율은 0~10000 bps 사이여야 합니다: " + feeBps);
        }
        // price * feeBps 는 long 범위를 넘을 수 있어 곱셈 전에 나눈다
        long fee = (price / MAX_BPS) * feeBps + (price % MAX_BPS) * feeBps / MAX_BPS;
        return new FeeSplit(price, feeBps, fee, price - fee);
    }

    public boolean hasFee() {
        return fee > 0;
    }
}
