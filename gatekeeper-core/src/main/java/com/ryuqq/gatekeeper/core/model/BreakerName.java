package com.ryuqq.gatekeeper.core.model;

import java.net.URI;
import java.util.Locale;

/**
 * Circuit Breaker 식별자.
 *
 * <p>하위 서비스마다 Circuit Breaker를 하나씩 두는 경우가 많으므로, 이름은 보통 서비스 이름
 * ("payment-api")이나 호스트 이름("payments.example.com")입니다. 호스트 이름을 그대로 쓸 수 있도록
 * 점(.)을 허용하며, {@link #forHost(URI)}로 요청 URI에서 바로 만들 수 있습니다.</p>
 *
 * <p>{@link #toString()}은 값 자체를 반환하므로, 로그와
 * {@code CircuitBreakerOpenException} 메시지("circuit breaker 'payment-api' is OPEN")에
 * 따옴표 안에 그대로 들어갑니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.)만 허용</li>
 * </ul>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public final class BreakerName {

    private final String value;

    private BreakerName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("BreakerName cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("BreakerName length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException(
                "BreakerName contains invalid characters. Only alphanumeric, hyphen, underscore and dot are allowed"
            );
        }
        this.value = value;
    }

    /**
     * BreakerName 생성.
     *
     * @param value 이름 (예: "payment-api", "default")
     * @return BreakerName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static BreakerName of(String value) {
        return new BreakerName(value);
    }

    /**
     * 요청 대상 호스트 이름으로 BreakerName 생성 (호스트별 Circuit Breaker용).
     *
     * <p>호스트는 소문자로 정규화합니다. 포트는 이름에 포함하지 않습니다.</p>
     *
     * @param uri 요청 URI (예: https://Payments.Example.com:8443/charges)
     * @return 호스트 이름 BreakerName (예: "payments.example.com")
     * @throws IllegalArgumentException uri가 null이거나 호스트가 없는 경우
     */
    public static BreakerName forHost(URI uri) {
        if (uri == null) {
            throw new IllegalArgumentException("uri cannot be null");
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("uri has no host (current: " + uri + ")");
        }
        return new BreakerName(uri.getHost().toLowerCase(Locale.ROOT));
    }

    /**
     * 이름 값 조회.
     *
     * @return 이름 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BreakerName that = (BreakerName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
