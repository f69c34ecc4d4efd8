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
@Table(name = "dyeing_processes")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DyeingProcessEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "thread_purchase_id")
    private Long threadPurchaseId;

    @Column(name = "color_name")
    private String colorName;

    @Column(name = "color_code", length = 20)
    private String colorCode;

    @Column(name = "output_quantity", precision = 19, scale = 3)
    private BigDecimal outputQuantity;

    @Column(name = "total_cost", precision = 19, scale = 2)
    private BigDecimal totalCost;

    @Column(name = "completion_date")
    private LocalDate completionDate;

    @Column(name = "result_status", length = 20)
    private String resultStatus;

    @Column(name = "inventory_status", length = 20)
    private String inventoryStatus;

    static DyeingProcessEntity fromDomain(DyeingProcess process) {
        return new DyeingProcessEntity(
            null,
            process.getThreadPurchaseId(),
            process.getColorName(),
            process.getColorCode(),
            process.getOutputQuantity(),
            process.getTotalCost(),
            process.getCompletionDate(),
            process.getResultStatus(),
            process.getInventoryStatus()
        );
    }

    public DyeingProcess toDomain() {
        return DyeingProcess.builder()
            .id(id)
            .threadPurchaseId(threadPurchaseId)
            .colorName(colorName)
            .colorCode(colorCode)
            .outputQuantity(outputQuantity)
            .totalCost(totalCost)
            .completionDate(completionDate)
            .resultStatus(resultStatus)
            .inventoryStatus(inventoryStatus)
            .build();
    }

    void markAddedToInventory() {
        this.inventoryStatus = InventorySourceScanner.ADDED;
    }
}
