package com.ryuqq.retry.core.context;

import java.util.List;

/**
 * 체크 함수에 전달되는 시도 컨텍스트.
 *
 * <p>재시도 루프 하나당 하나의 인스턴스가 생성되며, 매 시도마다 같은 인스턴스가 체크 함수에 전달됩니다.</p>
 *
 * <p><strong>상태:</strong></p>
 * <ul>
 *   <li>failed: 현재 시도의 실패 여부 (실패한 시도가 끝나면 루프가 초기화)</li>
 *   <li>output: 실행 전체에 걸쳐 누적되는 진단 로그 (시도 사이에 초기화되지 않음)</li>
 * </ul>
 *
 * <p><strong>기록 메서드:</strong></p>
 * <ul>
 *   <li>{@link #fatal(Object...)}, {@link #fatalf(String, Object...)}: 기록 후 시도 즉시 중단</li>
 *   <li>{@link #error(Object...)}, {@link #errorf(String, Object...)}: 기록 후 실패 표시, 실행은 계속</li>
 *   <li>{@link #check(Throwable)}: 예외가 있으면 {@code fatal}과 동일</li>
 *   <li>{@link #log(Object...)}, {@link #logf(String, Object...)}: 실패 표시 없이 기록만</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Retry.run(reporter, r -> {
 *     Order order = repository.find(orderId);
 *     if (order == null) {
 *         r.fatal("order not found: ", orderId);
 *     }
 *     if (order.status() != Status.SHIPPED) {
 *         r.errorf("unexpected status: %s", order.status());
 *     }
 * });
 * }</pre>
 *
 * <p>실패 표시 초기화와 로그 집계는 재시도 루프가 {@link AttemptSession}으로만 수행합니다.</p>
 *
 * <p><strong>동시성:</strong> 시도 스레드만 기록하고, 제어 스레드는 시도 스레드가 종료된 뒤에만 읽습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AttemptContext {

    private final OutputLog output = new OutputLog();
    private volatile boolean failed;

    /**
     * {@link AttemptSession}만 생성합니다.
     */
    AttemptContext() {
    }

    /**
     * 메시지를 기록하고 현재 시도를 즉시 중단합니다.
     *
     * <p>이 호출 뒤의 코드는 같은 시도 안에서 실행되지 않습니다.</p>
     *
     * @param args 메시지 구성 요소
     * @throws AttemptAbortedSignal 항상
     */
    public void fatal(Object... args) {
        record(CallSite.capture(), sprint(args));
        failNow();
    }

    /**
     * 포맷 메시지를 기록하고 현재 시도를 즉시 중단합니다.
     *
     * @param format {@link String#format(String, Object...)} 형식
     * @param args 포맷 인자
     * @throws AttemptAbortedSignal 항상
     */
    public void fatalf(String format, Object... args) {
        record(CallSite.capture(), String.format(format, args));
        failNow();
    }

    /**
     * 메시지를 기록하고 시도를 실패로 표시합니다. 실행은 계속됩니다.
     *
     * @param args 메시지 구성 요소
     */
    public void error(Object... args) {
        record(CallSite.capture(), sprint(args));
        failed = true;
    }

    /**
     * 포맷 메시지를 기록하고 시도를 실패로 표시합니다. 실행은 계속됩니다.
     *
     * @param format {@link String#format(String, Object...)} 형식
     * @param args 포맷 인자
     */
    public void errorf(String format, Object... args) {
        record(CallSite.capture(), String.format(format, args));
        failed = true;
    }

    /**
     * 예외가 있으면 그 메시지를 기록하고 시도를 중단합니다.
     *
     * @param err 검사할 예외 (null이면 아무 동작 안 함)
     * @throws AttemptAbortedSignal err가 null이 아닌 경우
     */
    public void check(Throwable err) {
        if (err != null) {
            record(CallSite.capture(), describe(err));
            failNow();
        }
    }

    /**
     * 실패 표시 없이 진단 메시지만 기록합니다.
     *
     * @param args 메시지 구성 요소
     */
    public void log(Object... args) {
        record(CallSite.capture(), sprint(args));
    }

    /**
     * 실패 표시 없이 포맷 진단 메시지만 기록합니다.
     *
     * @param format {@link String#format(String, Object...)} 형식
     * @param args 포맷 인자
     */
    public void logf(String format, Object... args) {
        record(CallSite.capture(), String.format(format, args));
    }

    /**
     * 메시지 없이 시도를 실패로 표시하고 즉시 중단합니다.
     *
     * @throws AttemptAbortedSignal 항상
     */
    public void failNow() {
        failed = true;
        throw new AttemptAbortedSignal();
    }

    /**
     * 현재 시도의 실패 여부.
     *
     * @return 실패로 표시되었으면 true
     */
    public boolean isFailed() {
        return failed;
    }

    /**
     * 지금까지 기록된 진단 로그 스냅샷.
     *
     * @return 기록 순서대로 정렬된 불변 리스트
     */
    public List<String> output() {
        return output.lines();
    }

    /**
     * 누적 로그. 재시도 루프 전용입니다.
     */
    OutputLog outputLog() {
        return output;
    }

    /**
     * 실패 표시 초기화. 로그는 유지됩니다.
     *
     * <p>체크 함수는 자신의 실패를 되돌릴 수 없으므로 {@link AttemptSession}을 통해서만 호출됩니다.</p>
     */
    void clearFailure() {
        failed = false;
    }

    /**
     * 체크 함수가 던진 예외를 실패로 기록합니다.
     *
     * @param throwable 체크 함수에서 발생한 예외
     * @throws IllegalArgumentException throwable이 null인 경우
     */
    void recordUnexpected(Throwable throwable) {
        if (throwable == null) {
            throw new IllegalArgumentException("throwable cannot be null");
        }
        record(CallSite.fromThrowable(throwable), throwable.toString());
        failed = true;
    }

    private void record(CallSite site, String message) {
        output.append(site.decorate(message));
    }

    private static String describe(Throwable err) {
        String message = err.getMessage();
        return message != null ? message : err.getClass().getName();
    }

    /**
     * 인자를 이어 붙여 메시지 생성.
     *
     * <p>양쪽 모두 문자열이 아닌 인자 사이에만 공백을 넣습니다.</p>
     */
    static String sprint(Object... args) {
        if (args == null) {
            return "null";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            if (i > 0 && !(args[i - 1] instanceof String) && !(args[i] instanceof String)) {
                sb.append(' ');
            }
            sb.append(args[i]);
        }
        return sb.toString();
    }
}
