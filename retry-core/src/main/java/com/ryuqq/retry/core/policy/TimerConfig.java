package com.ryuqq.retry.core.policy;

/**
 * Timer 정책 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>timeoutMs: 첫 결정 시점부터 재시도를 포기하기까지의 시간 (기본 2000ms)</li>
 *   <li>waitMs: 연속된 시도 사이의 대기 시간 (기본 25ms)</li>
 * </ul>
 *
 * <p>시도 횟수는 {@code timeoutMs / waitMs + 1}을 넘지 않습니다.
 * 시도 횟수에 상한이 필요하면 두 값을 그에 맞게 조정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param timeoutMs 전체 재시도 시간 (밀리초, 양수여야 함)
 * @param waitMs 시도 간 대기 시간 (밀리초, 0 이상이어야 함)
 */
public record TimerConfig(long timeoutMs, long waitMs) {

    /**
     * 기본 timeout (밀리초).
     */
    public static final long DEFAULT_TIMEOUT_MS = 2000;

    /**
     * 기본 wait (밀리초).
     */
    public static final long DEFAULT_WAIT_MS = 25;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: timeoutMs=2000ms, waitMs=25ms</p>
     */
    public TimerConfig() {
        this(DEFAULT_TIMEOUT_MS, DEFAULT_WAIT_MS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public TimerConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException(
                "timeoutMs must be positive (current: " + timeoutMs + ")"
            );
        }
        if (waitMs < 0) {
            throw new IllegalArgumentException(
                "waitMs must be non-negative (current: " + waitMs + ")"
            );
        }
    }

    /**
     * timeoutMs만 변경한 새 인스턴스 생성.
     *
     * @param timeoutMs 새로운 전체 재시도 시간 (밀리초)
     * @return 새 TimerConfig 인스턴스
     */
    public TimerConfig withTimeoutMs(long timeoutMs) {
        return new TimerConfig(timeoutMs, this.waitMs);
    }

    /**
     * waitMs만 변경한 새 인스턴스 생성.
     *
     * @param waitMs 새로운 시도 간 대기 시간 (밀리초)
     * @return 새 TimerConfig 인스턴스
     */
    public TimerConfig withWaitMs(long waitMs) {
        return new TimerConfig(this.timeoutMs, waitMs);
    }
}
