package com.vibecoding.k8ssanitizer.cache;

import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * 리소스 식별자 (namespace/name)
 */
public final class Fqn {

    private Fqn() {
    }

    public static String of(String namespace, String name) {
        if (namespace == null || namespace.isEmpty()) {
            return name;
        }
        return namespace + "/" + name;
    }

    public static String of(HasMetadata resource) {
        return of(resource.getMetadata().getNamespace(), resource.getMetadata().getName());
    }
}
