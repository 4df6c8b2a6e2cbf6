package com.ryuqq.retry.core.context;

import java.util.List;

/**
 * 진단 메시지를 기록한 호출 위치.
 *
 * <p>메시지 앞에 {@code "파일명:줄번호: "} 형식의 접두어를 붙이는 데 사용됩니다.
 * 호출 위치는 고정된 스택 깊이가 아니라 공개 API 경계에서 캡처합니다.
 * 래퍼 계층이 바뀌어도 사용자 코드의 위치를 가리킵니다.</p>
 *
 * @param fileName 짧은 소스 파일명 (예: {@code OrderServiceTest.java})
 * @param lineNumber 줄 번호 (1 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CallSite(String fileName, int lineNumber) {

    /**
     * 위치를 알 수 없을 때 사용하는 값.
     */
    public static final CallSite UNKNOWN = new CallSite("???", 1);

    private static final StackWalker WALKER = StackWalker.getInstance();

    private static final List<String> FRAMEWORK_PREFIXES = List.of(
        "java.",
        "jdk.",
        "sun.",
        "org.junit.",
        "org.opentest4j.",
        "org.assertj."
    );

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public CallSite {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("fileName cannot be null or blank");
        }
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be positive (current: " + lineNumber + ")");
        }
    }

    /**
     * 현재 스레드 스택에서 {@link AttemptContext} 바깥의 첫 프레임을 찾습니다.
     *
     * @return 호출 위치, 찾지 못하면 {@link #UNKNOWN}
     */
    static CallSite capture() {
        return WALKER.walk(frames -> frames
            .filter(frame -> !isHarnessFrame(frame.getClassName()))
            .findFirst()
            .map(frame -> of(frame.getFileName(), frame.getLineNumber()))
            .orElse(UNKNOWN));
    }

    /**
     * 예외의 스택 트레이스에서 사용자 코드 위치를 찾습니다.
     *
     * <p>JDK, JUnit, opentest4j, AssertJ 프레임은 건너뜁니다.</p>
     *
     * @param throwable 체크 함수에서 발생한 예외
     * @return 호출 위치, 찾지 못하면 {@link #UNKNOWN}
     */
    public static CallSite fromThrowable(Throwable throwable) {
        if (throwable == null) {
            return UNKNOWN;
        }
        for (StackTraceElement element : throwable.getStackTrace()) {
            String className = element.getClassName();
            if (!isFrameworkFrame(className) && !isHarnessFrame(className)) {
                return of(element.getFileName(), element.getLineNumber());
            }
        }
        return UNKNOWN;
    }

    /**
     * 메시지 앞에 위치 접두어 추가.
     *
     * @param message 원본 메시지
     * @return {@code "파일명:줄번호: 메시지"}
     */
    public String decorate(String message) {
        return fileName + ":" + lineNumber + ": " + message;
    }

    private static CallSite of(String file, int line) {
        if (file == null || file.isBlank() || line < 1) {
            return UNKNOWN;
        }
        int slash = Math.max(file.lastIndexOf('/'), file.lastIndexOf('\\'));
        return new CallSite(slash >= 0 ? file.substring(slash + 1) : file, line);
    }

    private static boolean isHarnessFrame(String className) {
        return className.equals(CallSite.class.getName())
            || className.equals(AttemptContext.class.getName());
    }

    private static boolean isFrameworkFrame(String className) {
        for (String prefix : FRAMEWORK_PREFIXES) {
            if (className.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
