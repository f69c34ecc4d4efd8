package com.flagship.textile_ledger.inventory;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Entity
@Table(name = "fabric_productions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FabricProductionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "fabric_type", nullable = false)
    private String fabricType;

    @Column(name = "dimensions")
    private String dimensions;

    @Column(name = "quantity_produced", precision = 19, scale = 3)
    private BigDecimal quantityProduced;

    @Column(name = "unit_of_measure", length = 20)
    private String unitOfMeasure;

    @Column(name = "total_cost", precision = 19, scale = 2)
    private BigDecimal totalCost;

    @Column(name = "completion_date")
    private LocalDate completionDate;

    @Column(name = "status", length = 20)
    private String status;

    @Column(name = "inventory_status", length = 20)
    private String inventoryStatus;

    static FabricProductionEntity fromDomain(FabricProduction production) {
        return new FabricProductionEntity(
            null,
            production.getFabricType(),
            production.getDimensions(),
            production.getQuantityProduced(),
            production.getUnitOfMeasure(),
            production.getTotalCost(),
            production.getCompletionDate(),
            production.getStatus(),
            production.getInventoryStatus()
        );
    }

    public FabricProduction toDomain() {
        return FabricProduction.builder()
            .id(id)
            .fabricType(fabricType)
            .dimensions(dimensions)
            .quantityProduced(quantityProduced)
            .unitOfMeasure(unitOfMeasure)
            .totalCost(totalCost)
            .completionDate(completionDate)
            .status(status)
            .inventoryStatus(inventoryStatus)
            .build();
    }

    void markAddedToInventory() {
        this.inventoryStatus = InventorySourceScanner.ADDED;
    }
}
