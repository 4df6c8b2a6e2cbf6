package com.ryuqq.retry.core.context;

/**
 * 재시도 루프 쪽에서 보는 시도 컨텍스트.
 *
 * <p>하나의 {@link AttemptContext}를 소유하고, 체크 함수에는 노출되지 않아야 하는 연산
 * (실패 표시 초기화, 예외 기록, 로그 집계)을 제공합니다.
 * 체크 함수는 {@link #context()}만 전달받으므로 자신의 실패를 되돌릴 수 없습니다.</p>
 *
 * <p>재시도 실행 하나당 하나의 인스턴스를 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AttemptSession {

    private final AttemptContext context = new AttemptContext();

    /**
     * 체크 함수에 전달할 컨텍스트.
     *
     * @return 이 세션이 소유한 컨텍스트
     */
    public AttemptContext context() {
        return context;
    }

    /**
     * 방금 끝난 시도의 실패 여부.
     *
     * @return 실패로 표시되었으면 true
     */
    public boolean attemptFailed() {
        return context.isFailed();
    }

    /**
     * 실패한 시도를 평가한 뒤 실패 표시를 초기화합니다. 로그는 유지됩니다.
     */
    public void clearFailure() {
        context.clearFailure();
    }

    /**
     * 시도 경계에서 잡은 예외를 실패로 기록합니다.
     *
     * @param throwable 체크 함수에서 발생한 예외
     * @throws IllegalArgumentException throwable이 null인 경우
     */
    public void recordUnexpected(Throwable throwable) {
        context.recordUnexpected(throwable);
    }

    /**
     * 누적 로그를 중복 제거하여 반환합니다.
     *
     * @return 처음 등장 순서의 고유 라인 (각 라인 끝에 개행), 없으면 빈 문자열
     */
    public String dedupOutput() {
        return context.outputLog().dedup();
    }
}
