package com.namingtool.service.validation;

import com.namingtool.model.type.ResourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Existence checks through the configured {@link ExistenceOracle}, with caching and a
 * bounded wait per call. Only successful answers are cached.
 */
@Slf4j
@Service
public class ExistenceCheckService {

    public static final String CACHE_KEY_PREFIX = "name-validation:";

    private final ExistenceOracle oracle;
    private final ValidationResultCache cache;
    private final ExecutorService executor;

    public ExistenceCheckService(
            ExistenceOracle oracle,
            ValidationResultCache cache,
            @Qualifier("existenceCheckExecutor") ExecutorService executor) {
        this.oracle = oracle;
        this.cache = cache;
        this.executor = executor;
    }

    /**
     * Whether an oracle backed by a real namespace is configured.
     */
    public boolean isOracleActive() {
        return oracle.isActive();
    }

    /**
     * @throws ExistenceCheckException on oracle failure, timeout or interruption
     */
    public ExistenceCheck check(String name, ResourceType resourceType, ValidationSettings settings) {
        String key = cacheKey(resourceType, name);
        boolean cacheEnabled = settings.cache().enabled();

        if (cacheEnabled) {
            Optional<ExistenceCheck> cached = cache.get(key);
            if (cached.isPresent()) {
                return cached.get().asCached();
            }
        }

        ExistenceCheck result = callOracle(name, resourceType, settings);

        if (cacheEnabled) {
            cache.put(key, result, settings.cache().duration());
        }
        return result;
    }

    /**
     * Drop the cached result for one name, e.g. once that name has been handed out.
     */
    public void invalidate(String name, ResourceType resourceType) {
        cache.invalidate(cacheKey(resourceType, name));
    }

    public static String cacheKey(ResourceType resourceType, String name) {
        String type = resourceType == null || resourceType.getResource() == null
            ? ""
            : resourceType.getResource().toLowerCase(Locale.ROOT);
        return CACHE_KEY_PREFIX + type + ":" + name.toLowerCase(Locale.ROOT);
    }

    private ExistenceCheck callOracle(String name, ResourceType resourceType, ValidationSettings settings) {
        Future<ExistenceCheck> future = executor.submit(() -> oracle.exists(name, resourceType));
        try {
            ExistenceCheck result = future.get(settings.oracleTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                throw new ExistenceCheckException("Existence oracle returned no answer for " + name);
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Existence check for {} timed out after {} ms", name, settings.oracleTimeout().toMillis());
            throw new ExistenceCheckException("Existence check timed out after "
                + settings.oracleTimeout().toMillis() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExistenceCheckException("Existence check interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExistenceCheckException existenceCheckException) {
                throw existenceCheckException;
            }
            throw new ExistenceCheckException("Existence check failed: " + cause.getMessage(), cause);
        }
    }
}
