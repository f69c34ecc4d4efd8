package com.flagship.textile_ledger.inventory;

import com.flagship.textile_ledger.inventory.dto.ImportRequest;
import com.flagship.textile_ledger.inventory.dto.ImportResponse;
import com.flagship.textile_ledger.inventory.dto.PendingItemResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/inventory")
@RequiredArgsConstructor
@Slf4j
public class InventoryController {

    private final InventoryReconciliationService reconciliationService;

    @GetMapping("/pending")
    public List<PendingItemResponse> pending() {
        return reconciliationService.findPending().stream().map(PendingItemResponse::from).toList();
    }

    /**
     * Imports the selection. Always 200: per-item failures are listed in the body
     * next to the items that did import.
     */
    @PostMapping("/import")
    public ImportResponse importItems(@Valid @RequestBody ImportRequest request) {
        log.info("Received inventory import request for {} item(s)", request.getItems().size());
        return ImportResponse.from(reconciliationService.importAndReconcile(request.toSourceKeys()));
    }
}
