package com.namingtool.model.component;

import com.namingtool.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * A named, orderable contributor to a composed resource name.
 * Built-in components (see {@link com.namingtool.model.enums.BuiltInComponent}) are reserved;
 * custom and free-text components are defined by administrators.
 */
@Entity
@Table(name = "resource_component", indexes = {
    @Index(name = "idx_component_sort", columnList = "sort_order"),
    @Index(name = "idx_component_name", columnList = "name", unique = true)
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class ResourceComponent extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "display_name", length = 255)
    private String displayName;

    @Column(nullable = false)
    private boolean enabled;

    @Column(name = "is_custom")
    private boolean custom;

    @Column(name = "is_free_text")
    private boolean freeText;

    @Column(name = "sort_order")
    private int sortOrder;

    @Column(name = "parent_component", length = 100)
    private String parentComponent;

    /**
     * Minimum accepted length of a value supplied for this component.
     */
    @Column(name = "min_length")
    @Builder.Default
    private int minLength = 1;

    @Column(name = "max_length")
    @Builder.Default
    private int maxLength = 10;

    @Column(name = "apply_delimiter_before")
    @Builder.Default
    private boolean applyDelimiterBefore = true;

    @Column(name = "apply_delimiter_after")
    @Builder.Default
    private boolean applyDelimiterAfter = true;
}
