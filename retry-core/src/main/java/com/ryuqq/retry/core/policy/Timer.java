package com.ryuqq.retry.core.policy;

import com.ryuqq.retry.core.spi.RetryClock;
import com.ryuqq.retry.core.spi.Retryer;

import java.util.concurrent.TimeUnit;

/**
 * 마감 시각 기반 재시도 정책.
 *
 * <p>첫 결정 시점에 마감 시각(now + timeout)을 기록하고,
 * 마감 시각이 지날 때까지 wait 간격으로 재시도를 허용합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * next(onGiveUp):
 *   첫 호출       → deadline = now + timeout, return true
 *   now > deadline → onGiveUp.run(), return false
 *   그 외          → sleep(wait), return true
 * </pre>
 *
 * <p>시도 횟수 자체는 제한하지 않습니다. 종료 조건은 마감 시각뿐입니다.</p>
 *
 * <p><strong>재사용:</strong> 마감 시각은 인스턴스에 남습니다.
 * 독립된 두 번째 실행에는 새 인스턴스를 쓰거나 {@link #reset()}을 호출합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Timer implements Retryer {

    private final TimerConfig config;
    private final RetryClock clock;

    private boolean started;
    private long deadlineNanos;

    /**
     * 기본 설정으로 생성 (timeout 2000ms, wait 25ms).
     */
    public Timer() {
        this(new TimerConfig());
    }

    /**
     * timeout/wait 지정 생성.
     *
     * @param timeoutMs 전체 재시도 시간 (밀리초)
     * @param waitMs 시도 간 대기 시간 (밀리초)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public Timer(long timeoutMs, long waitMs) {
        this(new TimerConfig(timeoutMs, waitMs));
    }

    /**
     * 설정 지정 생성 (시스템 시계 사용).
     *
     * @param config Timer 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public Timer(TimerConfig config) {
        this(config, SystemRetryClock.INSTANCE);
    }

    /**
     * 설정과 시계 지정 생성.
     *
     * @param config Timer 설정
     * @param clock 시간 소스
     * @throws IllegalArgumentException config 또는 clock이 null인 경우
     */
    public Timer(TimerConfig config, RetryClock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    @Override
    public boolean next(Runnable onGiveUp) {
        if (onGiveUp == null) {
            throw new IllegalArgumentException("onGiveUp cannot be null");
        }

        long now = clock.nanoTime();
        if (!started) {
            started = true;
            deadlineNanos = now + TimeUnit.MILLISECONDS.toNanos(config.timeoutMs());
            return true;
        }

        // nanoTime은 overflow 가능하므로 차이로 비교
        if (now - deadlineNanos > 0) {
            onGiveUp.run();
            return false;
        }

        clock.sleep(config.waitMs());
        return true;
    }

    /**
     * 마감 시각 초기화.
     *
     * <p>다음 {@link #next(Runnable)} 호출이 새 마감 시각을 기록합니다.</p>
     */
    public void reset() {
        started = false;
        deadlineNanos = 0;
    }

    /**
     * 마감 시각이 기록되었는지 확인.
     *
     * @return 첫 결정이 이미 이루어졌으면 true
     */
    public boolean isStarted() {
        return started;
    }

    /**
     * 설정 조회.
     *
     * @return Timer 설정
     */
    public TimerConfig getConfig() {
        return config;
    }
}
