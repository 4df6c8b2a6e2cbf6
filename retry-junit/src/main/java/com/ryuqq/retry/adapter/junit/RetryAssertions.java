package com.ryuqq.retry.adapter.junit;

import com.ryuqq.retry.core.policy.Timer;
import com.ryuqq.retry.core.runner.CheckFunction;
import com.ryuqq.retry.core.runner.Retry;
import com.ryuqq.retry.core.spi.Retryer;

/**
 * JUnit 5 테스트에서 사용하는 재시도 단언.
 *
 * <pre>{@code
 * @Test
 * void 주문이_결국_배송_상태가_된다() {
 *     orderService.ship(orderId);
 *
 *     RetryAssertions.eventually(r -> {
 *         Order order = orderRepository.find(orderId);
 *         if (order.status() != Status.SHIPPED) {
 *             r.fatalf("status is %s", order.status());
 *         }
 *     });
 * }
 * }</pre>
 *
 * <p>재시도가 소진되면 {@link org.opentest4j.AssertionFailedError}가 발생합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RetryAssertions {

    private RetryAssertions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 기본 정책(timeout 2000ms, wait 25ms)으로 체크가 성공할 때까지 재시도.
     *
     * @param check 체크 함수
     */
    public static void eventually(CheckFunction check) {
        Retry.run(new JUnitReporter(), check);
    }

    /**
     * timeout/wait를 지정하여 재시도.
     *
     * @param timeoutMs 전체 재시도 시간 (밀리초)
     * @param waitMs 시도 간 대기 시간 (밀리초)
     * @param check 체크 함수
     */
    public static void eventually(long timeoutMs, long waitMs, CheckFunction check) {
        Retry.runWith(new JUnitReporter(), new Timer(timeoutMs, waitMs), check);
    }

    /**
     * 정책을 지정하여 재시도.
     *
     * @param retryer 재시도 정책
     * @param check 체크 함수
     */
    public static void eventually(Retryer retryer, CheckFunction check) {
        Retry.runWith(new JUnitReporter(), retryer, check);
    }
}
