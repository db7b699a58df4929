package com.vibecoding.k8ssanitizer;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class K8sSanitizerApplication {

    private static final Logger log = LoggerFactory.getLogger(K8sSanitizerApplication.class);

    public static void main(String[] args) {
        log.info("K8s Sanitizer - Kubernetes workload hygiene scan");
        loadDotenv();
        SpringApplication.run(K8sSanitizerApplication.class, args);
    }

    // KUBECONFIG, SANITIZER_* 값을 .env에서 읽어 온다
    private static void loadDotenv() {
        try {
            Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();
            dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)
                    .forEach(entry -> System.setProperty(entry.getKey(), entry.getValue()));
        } catch (DotenvException e) {
            log.warn("Ignoring unreadable .env file: {}", e.getMessage());
        }
    }
}
