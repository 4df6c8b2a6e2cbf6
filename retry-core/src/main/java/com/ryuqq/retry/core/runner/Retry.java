package com.ryuqq.retry.core.runner;

import com.ryuqq.retry.core.policy.Timer;
import com.ryuqq.retry.core.spi.Reporter;
import com.ryuqq.retry.core.spi.Retryer;

/**
 * 재시도 하네스 진입점.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * // 기본 정책: 25ms 간격으로 최대 2초
 * Retry.run(reporter, r -> {
 *     if (!cache.contains(key)) {
 *         r.fatal("key not cached yet: ", key);
 *     }
 * });
 *
 * // 정책 지정
 * Retry.runWith(reporter, new Timer(5000, 100), r -> r.check(client.ping()));
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Retry {

    private static final RetryRunner RUNNER = new RetryRunner();

    private Retry() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 기본 정책(timeout 2000ms, wait 25ms)으로 실행.
     *
     * @param reporter 최종 결과를 받을 리포터
     * @param check 체크 함수
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static void run(Reporter reporter, CheckFunction check) {
        runWith(reporter, new Timer(), check);
    }

    /**
     * 지정한 정책으로 실행.
     *
     * @param reporter 최종 결과를 받을 리포터
     * @param retryer 재시도 정책
     * @param check 체크 함수
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static void runWith(Reporter reporter, Retryer retryer, CheckFunction check) {
        RUNNER.execute(reporter, retryer, check);
    }
}
