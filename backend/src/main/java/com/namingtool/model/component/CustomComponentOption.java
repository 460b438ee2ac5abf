package com.namingtool.model.component;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An allowed value for a custom (non free-text) component.
 * {@code parentComponent} is the normalized name of the owning component.
 */
@Entity
@Table(name = "custom_component_option", indexes = {
    @Index(name = "idx_custom_option_parent", columnList = "parent_component")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomComponentOption {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "parent_component", nullable = false, length = 100)
    private String parentComponent;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(name = "short_name", nullable = false, length = 100)
    private String shortName;

    @Column(name = "sort_order")
    private int sortOrder;

    @Column(name = "min_length")
    @Builder.Default
    private int minLength = 1;

    @Column(name = "max_length")
    @Builder.Default
    private int maxLength = 10;
}
