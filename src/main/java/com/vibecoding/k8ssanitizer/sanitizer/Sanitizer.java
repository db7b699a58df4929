package com.vibecoding.k8ssanitizer.sanitizer;

import com.vibecoding.k8ssanitizer.model.Outcome;
import com.vibecoding.k8ssanitizer.model.SanitizeRequest;

/**
 * 리소스 종류별 새니타이저
 */
public interface Sanitizer {

    /**
     * 검사 대상 리소스 종류 (Deployment, Pod ...)
     */
    String getResourceKind();

    /**
     * 해당 종류의 모든 리소스를 검사해 공유 수집기에 기록.
     * 같은 수집기로 두 번 호출하면 이슈가 중복 누적된다.
     */
    void sanitize(SanitizeRequest request);

    /**
     * 수집기의 현재 결과
     */
    Outcome outcome();
}
