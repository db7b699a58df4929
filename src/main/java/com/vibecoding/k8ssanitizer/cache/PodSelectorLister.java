package com.vibecoding.k8ssanitizer.cache;

import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.Pod;

import java.util.Map;

/**
 * 라벨 셀렉터로 Pod 조회
 */
public interface PodSelectorLister {

    /**
     * namespace 안에서 셀렉터와 일치하는 Pod (FQN -> Pod)
     */
    Map<String, Pod> listPodsBySelector(String namespace, LabelSelector selector);
}
