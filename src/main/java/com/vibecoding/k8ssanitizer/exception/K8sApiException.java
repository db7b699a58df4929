package com.vibecoding.k8ssanitizer.exception;

/**
 * 클러스터 스냅샷 로딩 중 Kubernetes API 호출이 실패했을 때 발생하는 예외
 */
public class K8sApiException extends RuntimeException {

    private final String resourceKind;

    public K8sApiException(String resourceKind, String message, Throwable cause) {
        super(message, cause);
        this.resourceKind = resourceKind;
    }

    public String getResourceKind() {
        return resourceKind;
    }
}
