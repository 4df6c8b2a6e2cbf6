package com.ryuqq.retry.core.policy;

import com.ryuqq.retry.core.spi.RetryClock;

/**
 * 시스템 시간 기반 {@link RetryClock}.
 *
 * <p>{@link System#nanoTime()}과 {@link Thread#sleep(long)}에 위임합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SystemRetryClock implements RetryClock {

    /**
     * 공유 인스턴스 (상태 없음).
     */
    public static final SystemRetryClock INSTANCE = new SystemRetryClock();

    private SystemRetryClock() {
    }

    @Override
    public long nanoTime() {
        return System.nanoTime();
    }

    /**
     * Sleep (시도 간 대기).
     *
     * <p>InterruptedException 발생 시 현재 스레드의 인터럽트 플래그를 복원하고
     * IllegalStateException으로 래핑하여 던집니다.</p>
     *
     * @param millis 대기 시간 (밀리초)
     * @throws IllegalStateException sleep 중 인터럽트 발생 시
     */
    @Override
    public void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry wait interrupted", e);
        }
    }
}
