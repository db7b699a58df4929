package com.vibecoding.k8ssanitizer.model;

/**
 * 컨테이너 requests/limits 선언으로 결정되는 QoS 클래스
 */
public enum Qos {
    BEST_EFFORT,
    BURSTABLE,
    GUARANTEED;

    /**
     * 여러 컨테이너의 QoS를 합친다. 하나라도 다르면 Burstable.
     */
    public Qos merge(Qos other) {
        if (other == null || other == this) {
            return this;
        }
        return BURSTABLE;
    }
}
