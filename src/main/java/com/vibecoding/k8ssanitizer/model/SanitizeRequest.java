package com.vibecoding.k8ssanitizer.model;

import lombok.Builder;
import lombok.Value;

/**
 * 새니타이즈 호출 단위 옵션
 */
@Value
@Builder
public class SanitizeRequest {

    /**
     * 메트릭 기반 과소/과다 할당 분석 포함 여부 (기본 비활성)
     */
    boolean overAllocs;

    public static SanitizeRequest defaults() {
        return SanitizeRequest.builder().build();
    }

    public static SanitizeRequest withOverAllocs() {
        return SanitizeRequest.builder().overAllocs(true).build();
    }
}
