package com.namingtool.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

/**
 * naming.* configuration binding.
 * <p>
 * YAML:
 * naming:
 *   duplicate-names-allowed: false
 *   auto-increment-resource-instance: false
 *   validation:
 *     enabled: true
 *     strategy: auto-increment
 *     max-attempts: 100
 *     cache-duration: 5m
 *     arm:
 *       enabled: true
 *       subscription-ids: [ "..." ]
 *       api-versions:
 *         "[Microsoft.Storage]": 2023-01-01
 */
@ConfigurationProperties(prefix = "naming")
public record NamingProperties(

        /** Allow a name that already exists in the naming history to be generated again */
        @DefaultValue("false")
        boolean duplicateNamesAllowed,

        /** Bump the resource instance when the generated name is already in the naming history */
        @DefaultValue("false")
        boolean autoIncrementResourceInstance,

        @DefaultValue
        Validation validation
) {

    public record Validation(

            /** Check generated names against the external namespace */
            @DefaultValue("false")
            boolean enabled,

            @DefaultValue("notify-only")
            String strategy,

            @DefaultValue("100")
            int maxAttempts,

            @DefaultValue("true")
            boolean includeWarnings,

            @DefaultValue("true")
            boolean cacheEnabled,

            @DurationUnit(ChronoUnit.MINUTES)
            @DefaultValue("5m")
            Duration cacheDuration,

            /** Upper bound for a single existence check */
            @DurationUnit(ChronoUnit.SECONDS)
            @DefaultValue("5s")
            Duration oracleTimeout,

            @DefaultValue
            Arm arm
    ) {
    }

    /**
     * Azure Resource Manager client settings.
     */
    public record Arm(

            @DefaultValue("false")
            boolean enabled,

            @DefaultValue("https://management.azure.com")
            String endpoint,

            List<String> subscriptionIds,

            /** Static bearer token; acquiring tokens is left to the deployment */
            String accessToken,

            @DurationUnit(ChronoUnit.SECONDS)
            @DefaultValue("2s")
            Duration connectTimeout,

            @DurationUnit(ChronoUnit.SECONDS)
            @DefaultValue("5s")
            Duration readTimeout,

            @DefaultValue("2021-04-01")
            String defaultApiVersion,

            @DefaultValue("2021-03-01")
            String resourceGraphApiVersion,

            /** Provider namespace to checkNameAvailability api-version */
            Map<String, String> apiVersions
    ) {

        public Arm {
            subscriptionIds = subscriptionIds == null ? List.of() : List.copyOf(subscriptionIds);
            apiVersions = apiVersions == null ? Map.of() : Map.copyOf(apiVersions);
        }

        public String apiVersionFor(String providerNamespace) {
            return apiVersions.getOrDefault(providerNamespace, defaultApiVersion);
        }
    }
}
