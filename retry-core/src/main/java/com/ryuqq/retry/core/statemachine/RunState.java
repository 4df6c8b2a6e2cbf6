package com.ryuqq.retry.core.statemachine;

/**
 * 재시도 실행의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>AWAITING_DECISION → RUNNING_ATTEMPT (정책이 계속 진행 결정)</li>
 *   <li>RUNNING_ATTEMPT → AWAITING_DECISION (시도 실패, 실패 표시 초기화)</li>
 *   <li>RUNNING_ATTEMPT → SUCCEEDED (시도 성공)</li>
 *   <li>AWAITING_DECISION → GAVE_UP (정책이 포기 결정, 포기 콜백은 이미 실행됨)</li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * AWAITING_DECISION ──► GAVE_UP
 *    │      ▲
 *    ▼      │ (실패)
 * RUNNING_ATTEMPT
 *    │
 *    └─► SUCCEEDED
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RunState {

    /**
     * 정책의 다음 결정 대기.
     */
    AWAITING_DECISION,

    /**
     * 시도 실행 중.
     */
    RUNNING_ATTEMPT,

    /**
     * 성공 (종료).
     */
    SUCCEEDED,

    /**
     * 포기 (종료).
     */
    GAVE_UP;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCEEDED 또는 GAVE_UP인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == GAVE_UP;
    }
}
