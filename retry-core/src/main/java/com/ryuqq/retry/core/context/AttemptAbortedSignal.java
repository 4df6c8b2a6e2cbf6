package com.ryuqq.retry.core.context;

/**
 * 현재 시도를 즉시 중단시키는 신호.
 *
 * <p>{@link AttemptContext#failNow()}가 던지며, 재시도 루프가 시도 경계에서 잡습니다.
 * 사용자 코드의 {@code catch (Exception e)}에 걸리지 않도록 {@link Error}를 상속합니다.</p>
 *
 * <p>스택 트레이스를 채우지 않습니다. 호출 위치는 메시지 기록 시점에 이미 캡처됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AttemptAbortedSignal extends Error {

    private static final long serialVersionUID = 1L;

    AttemptAbortedSignal() {
        super("attempt aborted", null, false, false);
    }
}
