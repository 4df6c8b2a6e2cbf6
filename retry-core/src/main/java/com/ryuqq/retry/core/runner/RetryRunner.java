package com.ryuqq.retry.core.runner;

import com.ryuqq.retry.core.context.AttemptAbortedSignal;
import com.ryuqq.retry.core.context.AttemptContext;
import com.ryuqq.retry.core.context.AttemptSession;
import com.ryuqq.retry.core.spi.Reporter;
import com.ryuqq.retry.core.spi.Retryer;
import com.ryuqq.retry.core.statemachine.RunState;
import com.ryuqq.retry.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 재시도 루프.
 *
 * <p>정책에 진행 여부를 묻고, 한 번의 시도를 격리된 스레드에서 실행한 뒤,
 * 컨텍스트의 실패 표시를 보고 재시도하거나 종료합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. AttemptSession 생성 (체크 함수에는 AttemptContext만 전달, 로그는 실행 전체에서 유지)
 * 2. 포기 콜백 정의: dedup(log) → reporter.log(비어있지 않으면) → reporter.failNow()
 * 3. while (retryer.next(포기 콜백)):
 *    a. 새 스레드에서 check.run(context) 실행 후 join
 *    b. failed → 초기화 후 다음 시도
 *    c. !failed → 성공, 종료
 * </pre>
 *
 * <p><strong>격리:</strong></p>
 * <ul>
 *   <li>{@link AttemptContext#failNow()}의 중단 신호는 시도 스레드 안에서만 풀립니다.</li>
 *   <li>체크 함수가 던진 다른 예외도 시도 경계에서 잡혀 실패로 기록됩니다.</li>
 *   <li>시도는 항상 한 번에 하나만 실행됩니다 (제어 스레드가 join으로 대기).</li>
 * </ul>
 *
 * <p><strong>오류 전파:</strong> 루프 자체는 예외를 던지거나 결과를 반환하지 않습니다.
 * 재시도 소진은 오직 {@link Reporter#failNow()}로만 알립니다.
 * 단, Reporter 구현체가 failNow()에서 던진 예외는 그대로 전파됩니다.</p>
 *
 * <p>인스턴스는 상태가 없으므로 여러 스레드에서 공유할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RetryRunner {

    private static final Logger log = LoggerFactory.getLogger(RetryRunner.class);

    private static final String ATTEMPT_THREAD_PREFIX = "retry-attempt-";

    /**
     * 성공하거나 정책이 포기할 때까지 체크 함수를 반복 실행합니다.
     *
     * @param reporter 최종 결과를 받을 리포터
     * @param retryer 재시도 정책
     * @param check 체크 함수
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws IllegalStateException 시도 대기 중 제어 스레드가 인터럽트된 경우
     */
    public void execute(Reporter reporter, Retryer retryer, CheckFunction check) {
        validateInput(reporter, retryer, check);

        AttemptSession session = new AttemptSession();
        AtomicInteger attempts = new AtomicInteger();
        Runnable giveUp = () -> giveUp(reporter, session, attempts.get());

        RunState state = RunState.AWAITING_DECISION;
        while (retryer.next(giveUp)) {
            state = StateTransition.transition(state, RunState.RUNNING_ATTEMPT);
            int attempt = attempts.incrementAndGet();

            runAttempt(session, check, attempt);

            if (session.attemptFailed()) {
                log.debug("Attempt {} failed, retrying", attempt);
                session.clearFailure();
                state = StateTransition.transition(state, RunState.AWAITING_DECISION);
                continue;
            }

            state = StateTransition.transition(state, RunState.SUCCEEDED);
            log.debug("Check succeeded on attempt {}", attempt);
            return;
        }

        state = StateTransition.transition(state, RunState.GAVE_UP);
        log.debug("Retry run finished in state {}", state);
    }

    /**
     * 입력 유효성 검증.
     *
     * @throws IllegalArgumentException 유효하지 않은 입력인 경우
     */
    private void validateInput(Reporter reporter, Retryer retryer, CheckFunction check) {
        if (reporter == null) {
            throw new IllegalArgumentException("reporter cannot be null");
        }
        if (retryer == null) {
            throw new IllegalArgumentException("retryer cannot be null");
        }
        if (check == null) {
            throw new IllegalArgumentException("check cannot be null");
        }
    }

    /**
     * 한 번의 시도를 별도 스레드에서 실행하고 종료까지 대기.
     *
     * @param session 시도 세션
     * @param check 체크 함수
     * @param attempt 시도 번호 (1부터 시작)
     * @throws IllegalStateException join 중 인터럽트 발생 시
     */
    private void runAttempt(AttemptSession session, CheckFunction check, int attempt) {
        Thread worker = new Thread(() -> {
            try {
                check.run(session.context());
            } catch (AttemptAbortedSignal signal) {
                log.debug("Attempt {} aborted by check function", attempt);
            } catch (Throwable t) {
                log.warn("Attempt {} threw {}", attempt, t.toString());
                session.recordUnexpected(t);
            }
        }, ATTEMPT_THREAD_PREFIX + attempt);
        worker.setDaemon(true);

        log.debug("Attempt {} started", attempt);
        worker.start();
        try {
            worker.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for attempt " + attempt, e);
        }
    }

    /**
     * 재시도 포기 처리.
     *
     * <p>누적 로그를 중복 제거하여 한 번만 전달한 뒤 포기 신호를 보냅니다.</p>
     */
    private void giveUp(Reporter reporter, AttemptSession session, int attempts) {
        log.info("Giving up after {} attempts", attempts);
        String out = session.dedupOutput();
        if (!out.isEmpty()) {
            reporter.log(out);
        }
        reporter.failNow();
    }
}
