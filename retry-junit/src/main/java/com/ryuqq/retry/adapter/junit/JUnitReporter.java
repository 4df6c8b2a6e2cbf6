package com.ryuqq.retry.adapter.junit;

import com.ryuqq.retry.core.spi.Reporter;
import org.opentest4j.AssertionFailedError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * JUnit 5용 {@link Reporter} 구현체.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>log(): 진단 메시지를 SLF4J INFO로 출력하고 보관</li>
 *   <li>failNow(): {@link AssertionFailedError}를 던져 테스트를 실패시키고 이후 실행을 중단</li>
 * </ul>
 *
 * <p>예외 메시지에는 마지막 진단 메시지가 포함되므로 테스트 리포트에서 바로 원인을 볼 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JUnitReporter implements Reporter {

    private static final Logger log = LoggerFactory.getLogger(JUnitReporter.class);

    static final String ABANDONED_MESSAGE = "retry abandoned";

    private final List<String> diagnostics = new ArrayList<>();

    @Override
    public void log(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        diagnostics.add(text);
        log.info("Retry diagnostics:\n{}", text);
    }

    @Override
    public void failNow() {
        if (diagnostics.isEmpty()) {
            throw new AssertionFailedError(ABANDONED_MESSAGE);
        }
        throw new AssertionFailedError(ABANDONED_MESSAGE + ":\n" + diagnostics.get(diagnostics.size() - 1));
    }

    /**
     * 지금까지 받은 진단 메시지.
     *
     * @return 수신 순서대로 정렬된 불변 리스트
     */
    public List<String> getDiagnostics() {
        return List.copyOf(diagnostics);
    }
}
