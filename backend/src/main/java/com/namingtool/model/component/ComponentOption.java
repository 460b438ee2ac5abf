package com.namingtool.model.component;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A configured value for one of the built-in components
 * (an environment, a location, an organization, ...).
 * The {@code component} column holds the built-in component name, e.g. "ResourceEnvironment".
 */
@Entity
@Table(name = "component_option", indexes = {
    @Index(name = "idx_option_component", columnList = "component")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComponentOption {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String component;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(name = "short_name", nullable = false, length = 100)
    private String shortName;

    @Column(name = "sort_order")
    private int sortOrder;
}
