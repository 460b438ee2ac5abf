package com.namingtool.service.naming;

import com.namingtool.model.enums.ConflictStrategy;
import com.namingtool.model.enums.ResolutionFailure;
import com.namingtool.model.type.ResourceType;
import com.namingtool.service.naming.ConflictResolutionService.ConflictResolutionOutcome;
import com.namingtool.service.validation.ExistenceCheck;
import com.namingtool.service.validation.ExistenceCheckException;
import com.namingtool.service.validation.ExistenceCheckService;
import com.namingtool.service.validation.ExistenceOracle;
import com.namingtool.service.validation.ValidationResultCache;
import com.namingtool.service.validation.ValidationSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ConflictResolutionService} against a mocked {@link ExistenceOracle}.
 */
class ConflictResolutionServiceTest {

    private ExistenceOracle oracle;
    private ExecutorService executor;
    private ConflictResolutionService resolver;
    private ResourceType resourceType;

    @BeforeEach
    void setUp() {
        oracle = mock(ExistenceOracle.class);
        executor = Executors.newSingleThreadExecutor();
        ExistenceCheckService checkService = new ExistenceCheckService(oracle, new ValidationResultCache(), executor);
        resolver = new ConflictResolutionService(checkService, new Random(42));
        resourceType = ResourceType.builder().resource("Resources/resourcegroups").shortName("rg").build();
        when(oracle.exists(anyString(), any())).thenReturn(ExistenceCheck.notFound());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static ValidationSettings settings(ConflictStrategy strategy, int maxAttempts, boolean includeWarnings) {
        return new ValidationSettings(true,
            new ValidationSettings.ConflictResolution(strategy, maxAttempts, includeWarnings),
            new ValidationSettings.Cache(false, Duration.ofMinutes(5)),
            Duration.ofSeconds(5));
    }

    private void taken(String... names) {
        for (String name : names) {
            when(oracle.exists(eq(name), any())).thenReturn(ExistenceCheck.found(List.of("/subscriptions/x/" + name)));
        }
    }

    // ========================================================================
    // AutoIncrement
    // ========================================================================

    @Test
    void testAutoIncrement_FindsFirstFreeCandidate() {
        taken("rg-app-001", "rg-app-002", "rg-app-003");

        ConflictResolutionOutcome outcome = resolver.resolve("rg-app-001", resourceType,
            settings(ConflictStrategy.AUTO_INCREMENT, 100, true));

        assertTrue(outcome.success());
        assertEquals("rg-app-004", outcome.finalName());
        assertEquals(3, outcome.attempts());
        assertEquals(ResolutionFailure.NONE, outcome.failureReason());
        assertEquals("Original name 'rg-app-001' exists in Azure. Auto-incremented to 'rg-app-004'.", outcome.warning());
        verify(oracle, times(3)).exists(anyString(), any());
    }

    @Test
    void testAutoIncrement_BareDigitsKeepNoDelimiter() {
        taken("stapp01");

        ConflictResolutionOutcome outcome = resolver.resolve("stapp01", resourceType,
            settings(ConflictStrategy.AUTO_INCREMENT, 100, true));

        assertTrue(outcome.success());
        assertEquals("stapp02", outcome.finalName());
        assertEquals(1, outcome.attempts());
        verify(oracle).exists(eq("stapp02"), any());
    }

    @Test
    void testAutoIncrement_NoInstancePattern() {
        ConflictResolutionOutcome outcome = resolver.resolve("storageacct", resourceType,
            settings(ConflictStrategy.AUTO_INCREMENT, 100, true));

        assertFalse(outcome.success());
        assertEquals(0, outcome.attempts());
        assertEquals("storageacct", outcome.finalName());
        assertEquals("Cannot auto-increment: No instance number pattern found in name", outcome.errorMessage());
        assertEquals(ResolutionFailure.NO_INSTANCE_PATTERN, outcome.failureReason());
        verifyNoInteractions(oracle);
    }

    @Test
    void testAutoIncrement_WidthOverflowAccepted() {
        ConflictResolutionOutcome outcome = resolver.resolve("vm-999", resourceType,
            settings(ConflictStrategy.AUTO_INCREMENT, 100, true));

        assertTrue(outcome.success());
        assertEquals("vm-1000", outcome.finalName());
    }

    @Test
    void testAutoIncrement_PaddingPreserved() {
        taken("kv-0009");

        ConflictResolutionOutcome outcome = resolver.resolve("kv-0008", resourceType,
            settings(ConflictStrategy.AUTO_INCREMENT, 100, false));

        assertEquals("kv-0010", outcome.finalName());
        assertEquals(2, outcome.attempts());
        assertNull(outcome.warning());
    }

    @Test
    void testAutoIncrement_ExhaustionKeepsLastCandidate() {
        when(oracle.exists(anyString(), any())).thenReturn(ExistenceCheck.found(List.of()));

        ConflictResolutionOutcome outcome = resolver.resolve("rg-app-001", resourceType,
            settings(ConflictStrategy.AUTO_INCREMENT, 5, true));

        assertFalse(outcome.success());
        assertEquals(5, outcome.attempts());
        assertEquals("rg-app-006", outcome.finalName());
        assertEquals(ResolutionFailure.EXHAUSTED, outcome.failureReason());
        assertEquals("Could not find unique name after 5 attempts", outcome.errorMessage());
        assertTrue(outcome.warning().contains("Last tried: rg-app-006"));
        verify(oracle, times(5)).exists(anyString(), any());
    }

    @Test
    void testAutoIncrement_OracleFailureIsNotAvailability() {
        taken("rg-app-002");
        when(oracle.exists(eq("rg-app-003"), any())).thenThrow(new ExistenceCheckException("service unavailable"));

        ConflictResolutionOutcome outcome = resolver.resolve("rg-app-001", resourceType,
            settings(ConflictStrategy.AUTO_INCREMENT, 100, true));

        assertFalse(outcome.success());
        assertEquals(ResolutionFailure.ORACLE_FAILURE, outcome.failureReason());
        assertEquals("rg-app-001", outcome.finalName());
        assertEquals(2, outcome.attempts());
        assertTrue(outcome.errorMessage().contains("service unavailable"));
    }

    @Test
    void testAutoIncrement_InterruptedThreadCancels() {
        Thread.currentThread().interrupt();
        try {
            ConflictResolutionOutcome outcome = resolver.resolve("rg-app-001", resourceType,
                settings(ConflictStrategy.AUTO_INCREMENT, 100, true));

            assertFalse(outcome.success());
            assertEquals(ResolutionFailure.CANCELLED, outcome.failureReason());
            assertEquals("rg-app-001", outcome.finalName());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    // ========================================================================
    // SuffixRandom
    // ========================================================================

    @Test
    void testSuffixRandom_AppendsSixCharacterSuffix() {
        ConflictResolutionOutcome outcome = resolver.resolve("stapp", resourceType,
            settings(ConflictStrategy.SUFFIX_RANDOM, 100, true));

        assertTrue(outcome.success());
        assertEquals(1, outcome.attempts());
        assertTrue(outcome.finalName().matches("stapp-[a-z0-9]{6}"), outcome.finalName());
        assertTrue(outcome.warning().startsWith("Original name 'stapp' exists in Azure. Added random suffix:"));
    }

    @Test
    void testSuffixRandom_NeverExceedsFiftyCallsAndRevertsName() {
        when(oracle.exists(anyString(), any())).thenReturn(ExistenceCheck.found(List.of()));

        ConflictResolutionOutcome outcome = resolver.resolve("stapp", resourceType,
            settings(ConflictStrategy.SUFFIX_RANDOM, 500, true));

        assertFalse(outcome.success());
        assertEquals("stapp", outcome.finalName());
        assertEquals(50, outcome.attempts());
        assertEquals(ResolutionFailure.EXHAUSTED, outcome.failureReason());
        verify(oracle, times(50)).exists(anyString(), any());
    }

    @Test
    void testSuffixRandom_OracleFailureIsNotAvailability() {
        when(oracle.exists(anyString(), any()))
            .thenReturn(ExistenceCheck.found(List.of("/subscriptions/x/taken")))
            .thenThrow(new ExistenceCheckException("request timed out"));

        ConflictResolutionOutcome outcome = resolver.resolve("kv-app", resourceType,
            settings(ConflictStrategy.SUFFIX_RANDOM, 10, true));

        assertFalse(outcome.success());
        assertEquals(ResolutionFailure.ORACLE_FAILURE, outcome.failureReason());
        assertEquals("kv-app", outcome.finalName());
        assertEquals(2, outcome.attempts());
        assertTrue(outcome.errorMessage().contains("request timed out"));
        verify(oracle, times(2)).exists(anyString(), any());
    }

    @Test
    void testSuffixRandom_BoundedByMaxAttempts() {
        when(oracle.exists(anyString(), any())).thenReturn(ExistenceCheck.found(List.of()));

        ConflictResolutionOutcome outcome = resolver.resolve("stapp", resourceType,
            settings(ConflictStrategy.SUFFIX_RANDOM, 3, true));

        assertEquals(3, outcome.attempts());
        verify(oracle, times(3)).exists(anyString(), any());
    }

    // ========================================================================
    // NotifyOnly and Fail
    // ========================================================================

    @Test
    void testNotifyOnly_WarnsWithConflictCount() {
        when(oracle.exists(eq("rg-app-001"), any())).thenReturn(ExistenceCheck.found(List.of("/a", "/b")));

        ConflictResolutionOutcome outcome = resolver.resolve("rg-app-001", resourceType,
            settings(ConflictStrategy.NOTIFY_ONLY, 100, true));

        assertTrue(outcome.success());
        assertEquals("rg-app-001", outcome.finalName());
        assertEquals(1, outcome.attempts());
        assertEquals("Warning: Name 'rg-app-001' already exists in Azure (2 conflicting resource(s) found).",
            outcome.warning());
    }

    @Test
    void testNotifyOnly_NoWarningsWhenDisabled() {
        taken("rg-app-001");

        ConflictResolutionOutcome outcome = resolver.resolve("rg-app-001", resourceType,
            settings(ConflictStrategy.NOTIFY_ONLY, 100, false));

        assertTrue(outcome.success());
        assertNull(outcome.warning());
    }

    @Test
    void testNotifyOnly_OracleFailureStillSucceeds() {
        when(oracle.exists(anyString(), any())).thenThrow(new ExistenceCheckException("timeout"));

        ConflictResolutionOutcome outcome = resolver.resolve("rg-app-001", resourceType,
            settings(ConflictStrategy.NOTIFY_ONLY, 100, true));

        assertTrue(outcome.success());
        assertEquals("rg-app-001", outcome.finalName());
        assertTrue(outcome.warning().contains("could not be verified"));
    }

    @Test
    void testFail_NeverCallsOracle() {
        ConflictResolutionOutcome outcome = resolver.resolve("rg-app-001", resourceType,
            settings(ConflictStrategy.FAIL, 100, true));

        assertFalse(outcome.success());
        assertEquals(0, outcome.attempts());
        assertEquals("rg-app-001", outcome.finalName());
        assertEquals(ResolutionFailure.CONFLICT, outcome.failureReason());
        assertEquals("Name conflict: 'rg-app-001' already exists in Azure and conflict strategy is set to Fail.",
            outcome.errorMessage());
        verifyNoInteractions(oracle);
    }
}
