package com.ryuqq.retry.core.policy;

import com.ryuqq.retry.core.spi.RetryClock;
import com.ryuqq.retry.core.spi.Retryer;

/**
 * 시도 횟수 기반 재시도 정책.
 *
 * <p>최대 count회까지 시도를 허용하고, 시도 사이에는 wait만큼 대기합니다.
 * count회를 모두 소진한 뒤의 결정에서 포기 콜백을 실행합니다.</p>
 *
 * <p>마감 시각 대신 시도 횟수로 종료를 보장해야 할 때 {@link Timer} 대신 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Counter implements Retryer {

    private static final int DEFAULT_COUNT = 3;

    private final int count;
    private final long waitMs;
    private final RetryClock clock;

    private int attempts;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: count=3, waitMs=25ms</p>
     */
    public Counter() {
        this(DEFAULT_COUNT, TimerConfig.DEFAULT_WAIT_MS);
    }

    /**
     * 횟수/대기 시간 지정 생성 (시스템 시계 사용).
     *
     * @param count 최대 시도 횟수 (양수여야 함)
     * @param waitMs 시도 간 대기 시간 (밀리초, 0 이상이어야 함)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public Counter(int count, long waitMs) {
        this(count, waitMs, SystemRetryClock.INSTANCE);
    }

    /**
     * 횟수/대기 시간/시계 지정 생성.
     *
     * @param count 최대 시도 횟수 (양수여야 함)
     * @param waitMs 시도 간 대기 시간 (밀리초, 0 이상이어야 함)
     * @param clock 시간 소스
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public Counter(int count, long waitMs, RetryClock clock) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive (current: " + count + ")");
        }
        if (waitMs < 0) {
            throw new IllegalArgumentException("waitMs must be non-negative (current: " + waitMs + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.count = count;
        this.waitMs = waitMs;
        this.clock = clock;
    }

    @Override
    public boolean next(Runnable onGiveUp) {
        if (onGiveUp == null) {
            throw new IllegalArgumentException("onGiveUp cannot be null");
        }
        if (attempts >= count) {
            onGiveUp.run();
            return false;
        }
        if (attempts > 0) {
            clock.sleep(waitMs);
        }
        attempts++;
        return true;
    }

    /**
     * 시도 횟수 초기화.
     */
    public void reset() {
        attempts = 0;
    }

    /**
     * 지금까지 허용한 시도 횟수.
     *
     * @return 시도 횟수
     */
    public int getAttempts() {
        return attempts;
    }

    /**
     * 최대 시도 횟수.
     *
     * @return 최대 시도 횟수
     */
    public int getCount() {
        return count;
    }
}
