package kr.hhplus.be.ticketing.domain.common;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * 플랫폼 전역에서 사용하는 주소(식별자)
 * - 0x + 40자리 소문자 16진수
 * - 제로 주소는 "식별자 없음"을 의미하며 필수 주소 자리에 올 수 없다
 */
public record Address(String value) {

    private static final Pattern FORMAT = Pattern.compile("^0x[0-9a-f]{40}$");
    private static final SecureRandom RANDOM = new SecureRandom();

    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("주소는 비어있을 수 없습니다");
        }
        value = value.toLowerCase();
        if (!FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("유효하지 않은 주소 형식입니다: " + value);
        }
    }

    public static Address of(String value) {
        return new Address(value);
    }

    /**
     * 새 조직/이벤트에 부여할 무작위 주소 생성
     */
    public static Address generate() {
        byte[] bytes = new byte[20];
        RANDOM.nextBytes(bytes);
        return new Address("0x" + HexFormat.of().formatHex(bytes));
    }

    public boolean isZero() {
        return ZERO.value.equals(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
