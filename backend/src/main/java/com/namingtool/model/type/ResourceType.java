package com.namingtool.model.type;

import com.namingtool.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * A kind of resource that can be named, together with its naming rules.
 *
 * <p>{@code optional} and {@code exclude} are comma-separated component name lists.
 * When {@code staticValue} is set, the type has exactly one legal name.
 */
@Entity
@Table(name = "resource_type", indexes = {
    @Index(name = "idx_resource_type_short_name", columnList = "short_name")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class ResourceType extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String resource;

    @Column(name = "short_name", nullable = false, length = 50)
    private String shortName;

    @Column(name = "type_property", length = 255)
    private String property;

    @Column(length = 50)
    private String scope;

    @Column(name = "static_value", length = 255)
    private String staticValue;

    @Column(name = "optional_components", length = 1000)
    private String optional;

    @Column(name = "exclude_components", length = 1000)
    private String exclude;

    @Column(name = "length_min")
    private Integer lengthMin;

    @Column(name = "length_max")
    private Integer lengthMax;

    @Column(name = "name_regex", length = 500)
    private String regex;

    @Column(name = "invalid_characters", length = 255)
    private String invalidCharacters;

    @Column(name = "invalid_characters_start", length = 255)
    private String invalidCharactersStart;

    @Column(name = "invalid_characters_end", length = 255)
    private String invalidCharactersEnd;

    @Column(name = "invalid_characters_consecutive", length = 255)
    private String invalidCharactersConsecutive;

    @Column(name = "apply_delimiter")
    @Builder.Default
    private boolean applyDelimiter = true;

    @Column(nullable = false)
    @Builder.Default
    private boolean enabled = true;

    public boolean hasStaticValue() {
        return staticValue != null && !staticValue.isEmpty();
    }

    /**
     * Display name used in naming history: the resource, plus the property when one is set.
     */
    public String getDisplayName() {
        if (property != null && !property.isBlank()) {
            return resource + " - " + property;
        }
        return resource;
    }
}
