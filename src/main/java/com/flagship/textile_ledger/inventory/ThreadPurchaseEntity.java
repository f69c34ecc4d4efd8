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

/**
 * Row of the thread purchasing domain. This service only reads it and flips
 * {@code inventory_status}.
 */
@Entity
@Table(name = "thread_purchases")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ThreadPurchaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vendor_name")
    private String vendorName;

    @Column(name = "thread_type", nullable = false)
    private String threadType;

    @Column(name = "color")
    private String color;

    @Column(name = "quantity", nullable = false, precision = 19, scale = 3)
    private BigDecimal quantity;

    @Column(name = "unit_of_measure", nullable = false, length = 20)
    private String unitOfMeasure;

    @Column(name = "total_cost", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalCost;

    @Column(name = "order_date")
    private LocalDate orderDate;

    @Column(name = "received", nullable = false)
    private boolean received;

    @Column(name = "inventory_status", length = 20)
    private String inventoryStatus;

    static ThreadPurchaseEntity fromDomain(ThreadPurchase purchase) {
        return new ThreadPurchaseEntity(
            null,
            purchase.getVendorName(),
            purchase.getThreadType(),
            purchase.getColor(),
            purchase.getQuantity(),
            purchase.getUnitOfMeasure(),
            purchase.getTotalCost(),
            purchase.getOrderDate(),
            purchase.isReceived(),
            purchase.getInventoryStatus()
        );
    }

    public ThreadPurchase toDomain() {
        return ThreadPurchase.builder()
            .id(id)
            .vendorName(vendorName)
            .threadType(threadType)
            .color(color)
            .quantity(quantity)
            .unitOfMeasure(unitOfMeasure)
            .totalCost(totalCost)
            .orderDate(orderDate)
            .received(received)
            .inventoryStatus(inventoryStatus)
            .build();
    }

    void markAddedToInventory() {
        this.inventoryStatus = InventorySourceScanner.ADDED;
    }
}
