package com.namingtool.config;

import com.namingtool.service.validation.AccessTokenProvider;
import com.namingtool.service.validation.ArmExistenceOracle;
import com.namingtool.service.validation.DisabledExistenceOracle;
import com.namingtool.service.validation.ExistenceOracle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wiring for external name validation: the existence oracle and the executor its calls run on.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(NamingProperties.class)
public class ValidationConfig {

    @Bean
    public ExistenceOracle existenceOracle(NamingProperties properties) {
        NamingProperties.Arm arm = properties.validation().arm();
        if (!arm.enabled()) {
            log.info("Azure Resource Manager lookups disabled; names will not be checked externally");
            return new DisabledExistenceOracle();
        }
        log.info("Azure Resource Manager lookups enabled against {} ({} subscription(s))",
            arm.endpoint(), arm.subscriptionIds().size());
        return new ArmExistenceOracle(armRestClient(arm), staticTokenProvider(arm), arm);
    }

    @Bean(name = "existenceCheckExecutor", destroyMethod = "shutdownNow")
    public ExecutorService existenceCheckExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "existence-check-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }

    private static RestClient armRestClient(NamingProperties.Arm arm) {
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(arm.connectTimeout())
            .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(arm.readTimeout());
        return RestClient.builder()
            .requestFactory(requestFactory)
            .build();
    }

    private static AccessTokenProvider staticTokenProvider(NamingProperties.Arm arm) {
        return () -> {
            if (arm.accessToken() == null || arm.accessToken().isBlank()) {
                throw new IllegalStateException("naming.validation.arm.access-token is not configured");
            }
            return arm.accessToken();
        };
    }
}
