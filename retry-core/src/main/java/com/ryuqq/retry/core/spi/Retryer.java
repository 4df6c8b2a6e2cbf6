package com.ryuqq.retry.core.spi;

/**
 * 재시도 정책 SPI.
 *
 * <p>각 시도 직전에 호출되어 다음 시도를 진행할지 결정합니다.
 * 진행하지 않기로 결정하면 전달받은 포기 콜백을 먼저 실행한 뒤 false를 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Retryer retryer = new Timer(new TimerConfig(1000, 100));
 * while (retryer.next(() -> reporter.failNow())) {
 *     // 한 번의 시도 실행
 * }
 * }</pre>
 *
 * <p><strong>동시성:</strong> 하나의 제어 스레드에서 순차적으로만 호출됩니다.
 * 구현체는 thread-safe할 필요가 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Retryer {

    /**
     * 다음 시도 진행 여부 결정.
     *
     * <p>첫 호출은 항상 true를 반환해야 합니다 (최소 1회 시도 보장).
     * 이후 호출은 필요하면 대기한 뒤 true를 반환하거나,
     * {@code onGiveUp}을 정확히 1회 실행하고 false를 반환합니다.</p>
     *
     * @param onGiveUp 재시도를 포기할 때 실행할 콜백
     * @return 다음 시도를 진행해야 하면 true
     * @throws IllegalArgumentException onGiveUp이 null인 경우
     */
    boolean next(Runnable onGiveUp);
}
