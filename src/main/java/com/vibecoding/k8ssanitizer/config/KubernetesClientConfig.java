package com.vibecoding.k8ssanitizer.config;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Kubernetes 클라이언트 설정
 * kubeconfig(KUBECONFIG 또는 ~/.kube/config) 또는 in-cluster 서비스 계정을 자동으로 사용
 */
@Configuration
public class KubernetesClientConfig {

    private static final Logger log = LoggerFactory.getLogger(KubernetesClientConfig.class);

    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient() {
        Config config = new ConfigBuilder(Config.autoConfigure(null))
                .withRequestTimeout(30000)      // 30초
                .withConnectionTimeout(10000)   // 10초
                .build();

        log.info("Kubernetes client configured for {}", config.getMasterUrl());
        return new KubernetesClientBuilder()
                .withConfig(config)
                .build();
    }
}
