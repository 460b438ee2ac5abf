package com.namingtool.service.naming;

import com.namingtool.dto.request.BulkResourceNameRequest;
import com.namingtool.dto.request.ResourceNameRequest;
import com.namingtool.dto.request.ResourceNameRequestWithComponents;
import com.namingtool.dto.request.ValidateNameRequest;
import com.namingtool.dto.response.BulkResourceNameResponse;
import com.namingtool.dto.response.ResourceNameResponse;
import com.namingtool.dto.response.ValidateNameResponse;
import com.namingtool.model.component.ComponentOption;
import com.namingtool.model.component.CustomComponentOption;
import com.namingtool.model.component.ResourceComponent;
import com.namingtool.model.delimiter.ResourceDelimiter;
import com.namingtool.model.enums.ConflictStrategy;
import com.namingtool.model.type.ResourceType;
import com.namingtool.repository.ComponentOptionRepository;
import com.namingtool.repository.CustomComponentOptionRepository;
import com.namingtool.repository.GeneratedNameRepository;
import com.namingtool.repository.ResourceComponentRepository;
import com.namingtool.repository.ResourceDelimiterRepository;
import com.namingtool.repository.ResourceTypeRepository;
import com.namingtool.service.validation.ExistenceCheck;
import com.namingtool.service.validation.ExistenceCheckException;
import com.namingtool.service.validation.ExistenceOracle;
import com.namingtool.service.validation.ValidationSettings;
import com.namingtool.service.validation.ValidationSettingsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * End-to-end tests of the naming pipeline over H2, with the existence oracle mocked.
 */
@SpringBootTest(properties = "naming.auto-increment-resource-instance=true")
class ResourceNamingRequestServiceTest {

    @Autowired
    private ResourceNamingRequestService namingService;

    @Autowired
    private ValidationSettingsService settingsService;

    @Autowired
    private ResourceComponentRepository componentRepository;

    @Autowired
    private ComponentOptionRepository optionRepository;

    @Autowired
    private CustomComponentOptionRepository customOptionRepository;

    @Autowired
    private ResourceTypeRepository resourceTypeRepository;

    @Autowired
    private ResourceDelimiterRepository delimiterRepository;

    @Autowired
    private GeneratedNameRepository generatedNameRepository;

    @MockBean
    private ExistenceOracle existenceOracle;

    private ResourceType rg;

    @BeforeEach
    void setUp() {
        generatedNameRepository.deleteAll();
        customOptionRepository.deleteAll();
        optionRepository.deleteAll();
        componentRepository.deleteAll();
        resourceTypeRepository.deleteAll();
        delimiterRepository.deleteAll();
        settingsService.update(ValidationSettings.defaults());

        delimiterRepository.save(ResourceDelimiter.builder().name("dash").delimiter("-").enabled(true).sortOrder(1).build());

        component("ResourceType", "Resource Type", 1, false);
        component("ResourceEnvironment", "Environment", 2, false);
        component("ResourceLocation", "Location", 3, false);
        component("ResourceInstance", "Instance", 4, false);
        component("CostCenter", "Cost Center", 5, true);

        option("ResourceEnvironment", "Development", "dev");
        option("ResourceEnvironment", "Production", "prd");
        option("ResourceLocation", "East US", "eus");
        customOptionRepository.save(CustomComponentOption.builder()
            .parentComponent("costcenter").name("Finance").shortName("fin").sortOrder(1).build());

        rg = resourceTypeRepository.save(ResourceType.builder()
            .resource("Resources/resourcegroups")
            .shortName("rg")
            .optional("CostCenter")
            .exclude("")
            .lengthMax(90)
            .regex("^[a-zA-Z0-9._()-]{1,90}$")
            .build());
        resourceTypeRepository.save(ResourceType.builder()
            .resource("Storage/storageAccounts")
            .shortName("st")
            .scope("global")
            .optional("CostCenter")
            .exclude("Location")
            .invalidCharacters("-_")
            .lengthMin(3)
            .lengthMax(24)
            .regex("^[a-z0-9]{3,24}$")
            .build());
        resourceTypeRepository.save(ResourceType.builder()
            .resource("KeyVault/vaults")
            .shortName("kv")
            .optional("CostCenter")
            .exclude("ResourceInstance")
            .build());
        resourceTypeRepository.save(ResourceType.builder()
            .resource("Network/dnsZones")
            .shortName("dns")
            .staticValue("privatelink.blob.core.windows.net")
            .build());
    }

    private void component(String name, String displayName, int sortOrder, boolean custom) {
        componentRepository.save(ResourceComponent.builder()
            .name(name)
            .displayName(displayName)
            .enabled(true)
            .custom(custom)
            .sortOrder(sortOrder)
            .build());
    }

    private void option(String component, String name, String shortName) {
        optionRepository.save(ComponentOption.builder()
            .component(component).name(name).shortName(shortName).sortOrder(1).build());
    }

    private static ResourceNameRequest.ResourceNameRequestBuilder request(String type) {
        return ResourceNameRequest.builder()
            .resourceType(type)
            .resourceEnvironment("dev")
            .resourceLocation("eus")
            .resourceInstance("001");
    }

    private void enableValidation(ConflictStrategy strategy) {
        when(existenceOracle.isActive()).thenReturn(true);
        settingsService.update(new ValidationSettings(true,
            new ValidationSettings.ConflictResolution(strategy, 10, true),
            new ValidationSettings.Cache(false, Duration.ofMinutes(5)),
            Duration.ofSeconds(5)));
    }

    // ========================================================================
    // Single requests
    // ========================================================================

    @Test
    void testRequestName_GeneratesAndRecords() {
        ResourceNameResponse response = namingService.requestName(request("rg").createdBy("alice").build());

        assertTrue(response.success(), response.message());
        assertEquals("rg-dev-eus-001", response.resourceName());
        assertNotNull(response.details());
        assertEquals("Resources/resourcegroups", response.details().resourceTypeName());
        assertEquals("alice", response.details().createdBy());
        assertEquals(4, response.details().components().size());
        assertEquals("Development (dev)", response.details().components().get(1).valueLabel());
        assertEquals(1, generatedNameRepository.count());
        verifyNoInteractions(existenceOracle);
    }

    @Test
    void testRequestName_CustomComponentValue() {
        ResourceNameResponse response = namingService.requestName(request("rg")
            .customComponents(Map.of("Cost Center", "fin")).build());

        assertTrue(response.success(), response.message());
        assertEquals("rg-dev-eus-001-fin", response.resourceName());
    }

    @Test
    void testRequestName_InvalidCustomComponentValue() {
        ResourceNameResponse response = namingService.requestName(request("rg")
            .customComponents(Map.of("CostCenter", "xyz")).build());

        assertFalse(response.success());
        assertEquals(ResourceNamingRequestService.NAME_NOT_GENERATED, response.resourceName());
        assertEquals("CostCenter value is not a valid custom component short name.", response.message());
    }

    @Test
    void testRequestName_DelimiterRemovedForStorage() {
        ResourceNameResponse response = namingService.requestName(request("st").build());

        assertTrue(response.success(), response.message());
        assertEquals("stdev001", response.resourceName());
        assertTrue(response.message().contains(NameComposerService.DELIMITER_REMOVED_MESSAGE));
    }

    @Test
    void testRequestName_UnknownOptionsAccumulated() {
        ResourceNameResponse response = namingService.requestName(request("rg")
            .resourceEnvironment("qa")
            .resourceLocation("zzz")
            .build());

        assertFalse(response.success());
        assertTrue(response.message().contains("ResourceEnvironment value is invalid."));
        assertTrue(response.message().contains("ResourceLocation value is invalid."));
    }

    @Test
    void testRequestName_ComponentLengthChecked() {
        ResourceNameResponse response = namingService.requestName(request("rg")
            .resourceInstance("00000000001")
            .build());

        assertFalse(response.success());
        assertEquals("Instance value length is invalid. The value must be between 1 and 10 characters.",
            response.message());
    }

    @Test
    void testRequestName_FreeTextIgnoresComponentLength() {
        componentRepository.save(ResourceComponent.builder()
            .name("Project")
            .displayName("Project")
            .enabled(true)
            .custom(true)
            .freeText(true)
            .sortOrder(6)
            .build());

        ResourceNameResponse response = namingService.requestName(request("rg")
            .customComponents(Map.of("Project", "customerportal"))
            .build());

        assertTrue(response.success(), response.message());
        assertEquals("rg-dev-eus-001-customerportal", response.resourceName());
    }

    @Test
    void testRequestName_MissingRequiredComponent() {
        ResourceNameResponse response = namingService.requestName(request("rg").resourceLocation(null).build());

        assertFalse(response.success());
        assertEquals("You must supply the required components. ResourceLocation value was not provided.",
            response.message());
    }

    @Test
    void testRequestName_NonNumericInstance() {
        ResourceNameResponse response = namingService.requestName(request("rg").resourceInstance("one").build());

        assertFalse(response.success());
        assertEquals(NameComposerService.INSTANCE_NOT_NUMERIC_MESSAGE, response.message());
    }

    @Test
    void testRequestName_UnknownResourceType() {
        ResourceNameResponse response = namingService.requestName(request("zz").build());

        assertFalse(response.success());
        assertEquals(ResourceNamingRequestService.INVALID_RESOURCE_TYPE_MESSAGE, response.message());
    }

    @Test
    void testRequestName_NoActiveDelimiter() {
        delimiterRepository.deleteAll();

        ResourceNameResponse response = namingService.requestName(request("rg").build());

        assertFalse(response.success());
        assertEquals(ResourceNamingRequestService.DELIMITER_NOT_SET_MESSAGE, response.message());
    }

    @Test
    void testRequestName_StaticValue() {
        ResourceNameResponse response = namingService.requestName(request("dns").build());

        assertTrue(response.success());
        assertEquals("privatelink.blob.core.windows.net", response.resourceName());
        assertEquals(NameComposerService.STATIC_VALUE_MESSAGE, response.message());
        assertEquals(0, generatedNameRepository.count());
    }

    // ========================================================================
    // Naming history duplicates
    // ========================================================================

    @Test
    void testRequestName_DuplicateInstanceAutoIncremented() {
        namingService.requestName(request("rg").build());
        namingService.requestName(request("rg").build());

        ResourceNameResponse third = namingService.requestName(request("rg").build());

        assertTrue(third.success(), third.message());
        assertEquals("rg-dev-eus-003", third.resourceName());
        assertTrue(third.message().contains(ResourceNamingRequestService.INSTANCE_INCREMENTED_MESSAGE));
    }

    @Test
    void testRequestName_DuplicateWithoutInstanceRejected() {
        ResourceNameResponse first = namingService.requestName(request("kv").build());
        ResourceNameResponse second = namingService.requestName(request("kv").build());

        assertTrue(first.success(), first.message());
        assertEquals("kv-dev-eus", first.resourceName());
        assertFalse(second.success());
        assertEquals("The name (kv-dev-eus) you are trying to generate already exists. "
            + "Please select different component options and try again.", second.message());
    }

    // ========================================================================
    // External validation
    // ========================================================================

    @Test
    void testRequestName_ExternalConflictAutoIncremented() {
        enableValidation(ConflictStrategy.AUTO_INCREMENT);
        when(existenceOracle.exists(anyString(), any())).thenReturn(ExistenceCheck.notFound());
        when(existenceOracle.exists(eq("rg-dev-eus-001"), any()))
            .thenReturn(ExistenceCheck.found(List.of("/subscriptions/s/resourceGroups/rg-dev-eus-001")));

        ResourceNameResponse response = namingService.requestName(request("rg").build());

        assertTrue(response.success(), response.message());
        assertEquals("rg-dev-eus-002", response.resourceName());
        assertTrue(response.message().startsWith(
            "Name conflict resolved using auto-increment strategy. Original: rg-dev-eus-001, Final: rg-dev-eus-002"));
        assertTrue(response.validationMetadata().validationPerformed());
        assertTrue(response.validationMetadata().existsInTarget());
        assertEquals("rg-dev-eus-002", response.details().resourceName());
    }

    @Test
    void testRequestName_ExternalConflictWithFailStrategy() {
        enableValidation(ConflictStrategy.FAIL);
        when(existenceOracle.exists(anyString(), any())).thenReturn(ExistenceCheck.found(List.of()));

        ResourceNameResponse response = namingService.requestName(request("rg").build());

        assertFalse(response.success());
        assertEquals(ResourceNamingRequestService.NAME_NOT_GENERATED, response.resourceName());
        assertEquals("Name conflict: 'rg-dev-eus-001' already exists in Azure and conflict strategy is set to Fail.",
            response.message());
        verify(existenceOracle, times(1)).exists(anyString(), any());
        assertEquals(0, generatedNameRepository.count());
    }

    @Test
    void testRequestName_ExternalCheckFailureDoesNotFailGeneration() {
        enableValidation(ConflictStrategy.AUTO_INCREMENT);
        when(existenceOracle.exists(anyString(), any())).thenThrow(new ExistenceCheckException("throttled"));

        ResourceNameResponse response = namingService.requestName(request("rg").build());

        assertTrue(response.success(), response.message());
        assertEquals("rg-dev-eus-001", response.resourceName());
        assertEquals("Azure validation could not be performed: throttled", response.validationMetadata().warning());
    }

    // ========================================================================
    // Typed, bulk and validate requests
    // ========================================================================

    @Test
    void testRequestNameWithComponents_UsesGivenDelimiter() {
        ResourceNameResponse response = namingService.requestNameWithComponents(ResourceNameRequestWithComponents.builder()
            .resourceDelimiter(ResourceDelimiter.builder().name("underscore").delimiter("_").enabled(true).build())
            .resourceType(rg)
            .resourceEnvironment(ComponentOption.builder().component("ResourceEnvironment").name("Production").shortName("prd").build())
            .resourceLocation(ComponentOption.builder().component("ResourceLocation").name("East US").shortName("eus").build())
            .resourceInstance("7")
            .build());

        assertTrue(response.success(), response.message());
        assertEquals("rg_prd_eus_7", response.resourceName());
    }

    @Test
    void testRequestNameWithComponents_MissingDelimiter() {
        ResourceNameResponse response = namingService.requestNameWithComponents(ResourceNameRequestWithComponents.builder()
            .resourceType(rg)
            .build());

        assertFalse(response.success());
        assertEquals(ResourceNamingRequestService.DELIMITER_NOT_SET_MESSAGE, response.message());
    }

    @Test
    void testRequestBulk_PartialSuccessWithOverrides() {
        BulkResourceNameResponse response = namingService.requestBulk(BulkResourceNameRequest.builder()
            .resourceTypes(List.of("rg", "zz", "st"))
            .resourceEnvironment("dev")
            .resourceLocation("eus")
            .resourceInstance("001")
            .resourceTypeOverrides(Map.of("st", BulkResourceNameRequest.ResourceTypeOverride.builder()
                .resourceEnvironment("prd")
                .build()))
            .build());

        assertFalse(response.success());
        assertEquals("Partially successful: 2 succeeded, 1 failed", response.message());
        assertEquals(3, response.totalRequested());
        assertEquals(3, response.results().size());
        assertEquals("rg-dev-eus-001", response.results().get(0).resourceName());
        assertEquals(ResourceNamingRequestService.INVALID_RESOURCE_TYPE_MESSAGE, response.results().get(1).errorMessage());
        assertEquals("stprd001", response.results().get(2).resourceName());
        assertNotNull(response.results().get(0).resourceNameDetails());
    }

    @Test
    void testRequestBulk_StopsOnFirstErrorWhenRequested() {
        BulkResourceNameResponse response = namingService.requestBulk(BulkResourceNameRequest.builder()
            .resourceTypes(List.of("zz", "rg"))
            .resourceEnvironment("dev")
            .resourceLocation("eus")
            .resourceInstance("001")
            .continueOnError(false)
            .build());

        assertFalse(response.success());
        assertEquals(1, response.results().size());
        assertEquals("All 1 resource name generation(s) failed", response.message());
    }

    @Test
    void testRequestBulk_ValidateOnlyOmitsDetails() {
        BulkResourceNameResponse response = namingService.requestBulk(BulkResourceNameRequest.builder()
            .resourceTypes(List.of("rg", "st"))
            .resourceEnvironment("dev")
            .resourceLocation("eus")
            .resourceInstance("001")
            .validateOnly(true)
            .build());

        assertTrue(response.success());
        assertEquals("Successfully generated 2 resource name(s)", response.message());
        assertTrue(response.results().stream().allMatch(r -> r.resourceNameDetails() == null));
    }

    @Test
    void testValidateName() {
        ValidateNameResponse unknown = namingService.validateName(new ValidateNameRequest(null, "zz", "abc"));
        ValidateNameResponse stripped = namingService.validateName(new ValidateNameRequest(null, "st", "st-dev-001"));
        ValidateNameResponse tooShort = namingService.validateName(new ValidateNameRequest(null, "st", "s"));

        assertFalse(unknown.valid());
        assertEquals(ResourceNamingRequestService.UNKNOWN_RESOURCE_TYPE_MESSAGE, unknown.message());
        assertFalse(stripped.valid());
        assertTrue(stripped.message().contains("Name cannot contain the following character: -"));
        assertFalse(tooShort.valid());
        assertTrue(tooShort.message().contains(NameValidatorService.MIN_LENGTH_MESSAGE));
    }
}
