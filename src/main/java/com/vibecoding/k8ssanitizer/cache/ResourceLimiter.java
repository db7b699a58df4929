package com.vibecoding.k8ssanitizer.cache;

import com.vibecoding.k8ssanitizer.model.Allocations;

/**
 * CPU/Memory 할당 허용 범위 조회
 */
public interface ResourceLimiter {

    Allocations cpuResourceLimits();

    Allocations memResourceLimits();
}
