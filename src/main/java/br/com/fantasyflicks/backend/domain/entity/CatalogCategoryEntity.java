package br.com.fantasyflicks.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "catalog_categories", uniqueConstraints = @UniqueConstraint(name = "uk_catalog_category", columnNames = {
        "pool_id", "category_id" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CatalogCategoryEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "pool_id", nullable = false)
    private String poolId;

    @Column(name = "category_id", nullable = false)
    private String categoryId;

    @Column(name = "display_name")
    private String displayName;

    @Column(name = "display_order", nullable = false)
    private int displayOrder;
}
