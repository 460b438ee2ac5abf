package com.namingtool.service.validation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.namingtool.config.NamingProperties;
import com.namingtool.model.type.ResourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Existence oracle backed by Azure Resource Manager.
 *
 * Globally scoped types go through the provider's checkNameAvailability endpoint,
 * falling back to a Resource Graph query when that call fails or no subscription is
 * configured. Every other type is looked up with Resource Graph.
 */
@Slf4j
public class ArmExistenceOracle implements ExistenceOracle {

    static final String GLOBAL_SCOPE = "global";
    private static final String PROVIDER_PREFIX = "Microsoft.";

    private final RestClient restClient;
    private final AccessTokenProvider tokenProvider;
    private final NamingProperties.Arm arm;

    public ArmExistenceOracle(RestClient restClient, AccessTokenProvider tokenProvider, NamingProperties.Arm arm) {
        this.restClient = restClient;
        this.tokenProvider = tokenProvider;
        this.arm = arm;
    }

    @Override
    public ExistenceCheck exists(String name, ResourceType resourceType) {
        if (resourceType == null || resourceType.getResource() == null) {
            throw new ExistenceCheckException("Resource type has no provider resource to query");
        }
        if (GLOBAL_SCOPE.equalsIgnoreCase(resourceType.getScope()) && !arm.subscriptionIds().isEmpty()) {
            try {
                return checkNameAvailability(name, resourceType);
            } catch (RestClientException e) {
                log.warn("checkNameAvailability failed for {}, falling back to Resource Graph: {}",
                    name, e.getMessage());
            }
        }
        return queryResourceGraph(name, resourceType);
    }

    // ========================================================================
    // checkNameAvailability
    // ========================================================================

    private ExistenceCheck checkNameAvailability(String name, ResourceType resourceType) {
        ProviderType providerType = ProviderType.parse(resourceType.getResource());
        String subscriptionId = arm.subscriptionIds().get(0);
        String apiVersion = arm.apiVersionFor(providerType.namespace());

        NameAvailability response = restClient.post()
            .uri(arm.endpoint() + "/subscriptions/{subscriptionId}/providers/{namespace}/checkNameAvailability?api-version={apiVersion}",
                subscriptionId, providerType.namespace(), apiVersion)
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + tokenProvider.getAccessToken())
            .contentType(MediaType.APPLICATION_JSON)
            .body(Map.of("name", name, "type", providerType.namespace() + "/" + providerType.typeName()))
            .retrieve()
            .body(NameAvailability.class);

        if (response == null) {
            throw new ExistenceCheckException("checkNameAvailability returned no body for " + name);
        }

        log.info("checkNameAvailability for {}: available={}, reason={}",
            name, response.nameAvailable(), response.reason());

        if (response.nameAvailable()) {
            return ExistenceCheck.notFound();
        }
        String detail = response.message() != null ? response.message() : "Name already exists globally";
        return ExistenceCheck.found(List.of(detail));
    }

    // ========================================================================
    // Resource Graph
    // ========================================================================

    private ExistenceCheck queryResourceGraph(String name, ResourceType resourceType) {
        String query = buildResourceGraphQuery(name, resourceType.getResource());

        Map<String, Object> body = new LinkedHashMap<>();
        if (!arm.subscriptionIds().isEmpty()) {
            body.put("subscriptions", arm.subscriptionIds());
        }
        body.put("query", query);
        body.put("options", Map.of("resultFormat", "objectArray"));

        ResourceGraphResponse response;
        try {
            response = restClient.post()
                .uri(arm.endpoint() + "/providers/Microsoft.ResourceGraph/resources?api-version={apiVersion}",
                    arm.resourceGraphApiVersion())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + tokenProvider.getAccessToken())
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(ResourceGraphResponse.class);
        } catch (RestClientException e) {
            throw new ExistenceCheckException("Resource Graph query failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new ExistenceCheckException("Resource Graph query returned no body for " + name);
        }

        List<String> ids = new ArrayList<>();
        if (response.data() != null) {
            for (Map<String, Object> row : response.data()) {
                Object id = row.get("id");
                if (id != null && !id.toString().isEmpty()) {
                    ids.add(id.toString());
                }
            }
        }
        return ids.isEmpty() ? ExistenceCheck.notFound() : ExistenceCheck.found(ids);
    }

    static String buildResourceGraphQuery(String name, String resource) {
        ProviderType providerType = ProviderType.parse(resource);
        String armType = (providerType.namespace() + "/" + providerType.typeName()).toLowerCase(Locale.ROOT);
        return "Resources | where name =~ '" + escape(name) + "'"
            + " | where type =~ '" + escape(armType) + "'"
            + " | project id, name, type, resourceGroup";
    }

    private static String escape(String value) {
        return value.replace("'", "\\'");
    }

    /**
     * Provider namespace and type name, e.g. {@code Storage/storageAccounts} becomes
     * ({@code Microsoft.Storage}, {@code storageAccounts}).
     */
    record ProviderType(String namespace, String typeName) {

        static ProviderType parse(String resource) {
            String[] parts = resource.split("/");
            List<String> segments = new ArrayList<>();
            for (String part : parts) {
                if (!part.isEmpty()) {
                    segments.add(part);
                }
            }
            if (segments.size() >= 2) {
                String namespace = segments.get(0).startsWith(PROVIDER_PREFIX)
                    ? segments.get(0)
                    : PROVIDER_PREFIX + segments.get(0);
                return new ProviderType(namespace, segments.get(1));
            }
            return new ProviderType("Microsoft.Resources", resource);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record NameAvailability(boolean nameAvailable, String reason, String message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ResourceGraphResponse(List<Map<String, Object>> data, Long totalRecords) {
    }
}
