package com.vibecoding.k8ssanitizer.model;

import lombok.Value;

import java.util.Locale;

/**
 * 리소스에서 발견된 진단 이슈
 * group은 리소스 전체에 대한 이슈면 {@link #ROOT}, 컨테이너 단위 이슈면 컨테이너 이름
 */
@Value
public class Issue {

    public static final String ROOT = "__root__";

    String group;
    Severity level;
    String message;   // 생성 시점에 완성된 메시지

    public static Issue of(String group, Severity level, String message) {
        return new Issue(group, level, message);
    }

    public static Issue format(String group, Severity level, String pattern, Object... args) {
        return new Issue(group, level, String.format(Locale.ROOT, pattern, args));
    }

    public boolean isRoot() {
        return ROOT.equals(group);
    }
}
