package com.ryuqq.retry.core.runner;

import com.ryuqq.retry.core.context.AttemptContext;

/**
 * 시도마다 호출되는 사용자 체크 함수.
 *
 * <p>컨텍스트의 기록 메서드로 실패를 알립니다. 실패 표시 없이 반환하면 성공입니다.
 * 던진 예외는 시도 경계에서 잡혀 실패로 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CheckFunction {

    /**
     * 한 번의 시도 실행.
     *
     * @param r 시도 컨텍스트
     * @throws Exception 체크 중 발생한 예외 (실패로 기록됨)
     */
    void run(AttemptContext r) throws Exception;
}
