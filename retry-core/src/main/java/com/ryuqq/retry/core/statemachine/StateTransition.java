package com.ryuqq.retry.core.statemachine;

/**
 * 재시도 실행 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>AWAITING_DECISION → RUNNING_ATTEMPT</li>
 *   <li>AWAITING_DECISION → GAVE_UP</li>
 *   <li>RUNNING_ATTEMPT → AWAITING_DECISION</li>
 *   <li>RUNNING_ATTEMPT → SUCCEEDED</li>
 * </ul>
 *
 * <p>종료 상태(SUCCEEDED, GAVE_UP)에서는 어떤 상태로도 전이할 수 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransition {

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RunState from, RunState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case AWAITING_DECISION -> to == RunState.RUNNING_ATTEMPT || to == RunState.GAVE_UP;
            case RUNNING_ATTEMPT -> to == RunState.AWAITING_DECISION || to == RunState.SUCCEEDED;
            case SUCCEEDED, GAVE_UP -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static RunState transition(RunState current, RunState next) {
        validate(current, next);
        return next;
    }
}
