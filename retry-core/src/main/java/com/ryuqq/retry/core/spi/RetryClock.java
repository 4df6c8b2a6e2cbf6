package com.ryuqq.retry.core.spi;

/**
 * 재시도 정책이 사용하는 시간 소스.
 *
 * <p>테스트에서 실제 시간 대신 수동 시계를 주입할 수 있도록 분리되어 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RetryClock {

    /**
     * 단조 증가하는 현재 시각.
     *
     * @return 나노초 단위 시각 (절대값이 아닌 차이로만 의미가 있음)
     */
    long nanoTime();

    /**
     * 현재 스레드를 지정한 시간 동안 블로킹.
     *
     * @param millis 대기 시간 (밀리초, 0이면 즉시 반환)
     * @throws IllegalStateException 대기 중 인터럽트된 경우
     */
    void sleep(long millis);
}
