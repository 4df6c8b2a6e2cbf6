package com.ryuqq.retry.core.context;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 재시도 실행 전체에 걸쳐 누적되는 진단 로그.
 *
 * <p>시도 사이에 초기화되지 않으며, 포기 시점에 한 번만 읽힙니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OutputLog {

    private final List<String> lines = new ArrayList<>();

    /**
     * 한 줄 추가.
     *
     * @param line 위치 접두어가 붙은 메시지
     * @throws IllegalArgumentException line이 null인 경우
     */
    public void append(String line) {
        if (line == null) {
            throw new IllegalArgumentException("line cannot be null");
        }
        lines.add(line);
    }

    /**
     * 기록된 줄의 스냅샷.
     *
     * @return 기록 순서대로 정렬된 불변 리스트
     */
    public List<String> lines() {
        return List.copyOf(lines);
    }

    /**
     * 기록이 없는지 확인.
     *
     * @return 한 줄도 기록되지 않았으면 true
     */
    public boolean isEmpty() {
        return lines.isEmpty();
    }

    /**
     * 중복을 제거한 리포트 문자열 생성.
     *
     * <p>같은 메시지는 처음 등장한 위치에 한 번만 남고, 각 줄은 개행으로 끝납니다.
     * 예: {@code ["a","b","a","c","b"]} → {@code "a\nb\nc\n"}</p>
     *
     * @return 중복 제거된 문자열, 기록이 없으면 빈 문자열
     */
    public String dedup() {
        Set<String> distinct = new LinkedHashSet<>(lines);
        StringBuilder sb = new StringBuilder();
        for (String line : distinct) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }
}
