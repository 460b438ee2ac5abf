package com.namingtool.model.history;

import com.namingtool.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * A name accepted by the pipeline. Components are stored as a JSON array of
 * {@link com.namingtool.model.naming.ComponentContribution}.
 */
@Entity
@Table(name = "generated_name", indexes = {
    @Index(name = "idx_generated_name_resource_name", columnList = "resource_name")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class GeneratedName extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resource_name", nullable = false, length = 500)
    private String resourceName;

    @Column(name = "resource_type_name", length = 500)
    private String resourceTypeName;

    @Column(name = "components_json", columnDefinition = "TEXT")
    private String componentsJson;

    @Column(name = "created_by", length = 255)
    private String createdBy;

    @Column(columnDefinition = "TEXT")
    private String message;
}
