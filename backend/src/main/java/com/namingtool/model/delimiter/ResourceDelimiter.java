package com.namingtool.model.delimiter;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Separator placed between name components. Only the first enabled delimiter
 * by sort order is active.
 */
@Entity
@Table(name = "resource_delimiter")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceDelimiter {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    private String name;

    @Column(name = "delimiter_value", length = 1)
    private String delimiter;

    @Column(nullable = false)
    private boolean enabled;

    @Column(name = "sort_order")
    private int sortOrder;
}
