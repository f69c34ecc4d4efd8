package com.flagship.textile_ledger.inventory;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "inventory_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InventoryItemEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "item_code", nullable = false, unique = true, updatable = false, length = 40)
    private String itemCode;

    @Column(name = "description", nullable = false)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "product_kind", nullable = false, length = 20)
    private ProductKind productKind;

    @Column(name = "current_quantity", nullable = false, precision = 19, scale = 3)
    private BigDecimal currentQuantity;

    @Column(name = "unit_of_measure", length = 20)
    private String unitOfMeasure;

    @Column(name = "cost_per_unit", nullable = false, precision = 19, scale = 2)
    private BigDecimal costPerUnit;

    @Column(name = "sale_price", nullable = false, precision = 19, scale = 2)
    private BigDecimal salePrice;

    @Column(name = "min_stock_level", nullable = false, precision = 19, scale = 3)
    private BigDecimal minStockLevel;

    @Column(name = "location")
    private String location;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static InventoryItemEntity fromDomain(InventoryItem item) {
        return new InventoryItemEntity(
            null,
            item.getItemCode(),
            item.getDescription(),
            item.getProductKind(),
            item.getCurrentQuantity(),
            item.getUnitOfMeasure(),
            item.getCostPerUnit(),
            item.getSalePrice(),
            item.getMinStockLevel(),
            item.getLocation(),
            null,
            null
        );
    }

    public InventoryItem toDomain() {
        return InventoryItem.builder()
            .id(id)
            .itemCode(itemCode)
            .description(description)
            .productKind(productKind)
            .currentQuantity(currentQuantity)
            .unitOfMeasure(unitOfMeasure)
            .costPerUnit(costPerUnit)
            .salePrice(salePrice)
            .minStockLevel(minStockLevel)
            .location(location)
            .build();
    }
}
