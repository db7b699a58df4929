package com.vibecoding.k8ssanitizer.cache;

/**
 * Pod 관련 상한값 조회
 */
public interface PodLimiter {

    /**
     * 컨테이너 재시작 허용 횟수
     */
    int restartsLimit();

    /**
     * 컨테이너 CPU 사용량 상한 (선언된 limit 대비 %)
     */
    double podCpuLimit();

    /**
     * 컨테이너 Memory 사용량 상한 (선언된 limit 대비 %)
     */
    double podMemLimit();
}
