package com.vibecoding.k8ssanitizer.model;

/**
 * 이슈 심각도 (선언 순서가 곧 심각도 순서)
 */
public enum Severity {
    OK("정상"),
    INFO("정보"),
    WARN("경고"),
    ERROR("오류");

    private final String displayName;

    Severity(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * 둘 중 더 심각한 레벨
     */
    public static Severity max(Severity a, Severity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
