package br.com.fantasyflicks.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "catalog_items", uniqueConstraints = @UniqueConstraint(name = "uk_catalog_item", columnNames = {
        "pool_id", "item_id" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CatalogItemEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "pool_id", nullable = false)
    private String poolId;

    @Column(name = "item_id", nullable = false)
    private String itemId;

    @Column(name = "category_id")
    private String categoryId;

    @Column(name = "display_name")
    private String displayName;

    // menor = melhor
    @Column(name = "rank_order", nullable = false)
    private int rankOrder;

    @Column(name = "score_value")
    private Double scoreValue;

    @Column(nullable = false)
    private boolean winner;
}
