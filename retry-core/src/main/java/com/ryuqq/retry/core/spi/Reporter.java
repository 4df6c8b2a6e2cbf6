package com.ryuqq.retry.core.spi;

/**
 * 재시도 결과를 전달받는 호스트 리포터 SPI.
 *
 * <p>테스트 러너(JUnit 등)에 종속되지 않도록 최소한의 기능만 정의합니다.
 * 호스트 환경은 이 인터페이스를 구현하여 최종 진단 메시지와 실패 신호를 받습니다.</p>
 *
 * <p><strong>호출 규칙:</strong></p>
 * <ul>
 *   <li>성공한 실행에서는 어떤 메서드도 호출되지 않습니다.</li>
 *   <li>재시도가 포기되면 {@link #log(String)}이 최대 1회 호출된 뒤 {@link #failNow()}가 정확히 1회 호출됩니다.</li>
 *   <li>기록된 진단 메시지가 없으면 {@link #log(String)}은 생략됩니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Reporter {

    /**
     * 최종 진단 메시지 출력.
     *
     * @param text 중복 제거된 진단 메시지 (각 줄은 개행으로 끝남)
     */
    void log(String text);

    /**
     * 재시도 포기 신호.
     *
     * <p>테스트 환경에서는 테스트를 실패로 표시하고 이후 실행을 중단해야 합니다.
     * 구현체가 예외를 던지는 것도 허용됩니다.</p>
     */
    void failNow();
}
