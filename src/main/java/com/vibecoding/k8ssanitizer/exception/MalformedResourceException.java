package com.vibecoding.k8ssanitizer.exception;

/**
 * 데이터 접근 계층이 잘못된 리소스를 넘겼을 때 발생하는 예외
 * (파싱할 수 없는 quantity, 필수 spec 누락 등)
 */
public class MalformedResourceException extends RuntimeException {

    private final String fqn;

    public MalformedResourceException(String fqn, String message) {
        super(message + ": " + fqn);
        this.fqn = fqn;
    }

    public MalformedResourceException(String fqn, String message, Throwable cause) {
        super(message + ": " + fqn, cause);
        this.fqn = fqn;
    }

    public String getFqn() {
        return fqn;
    }
}
