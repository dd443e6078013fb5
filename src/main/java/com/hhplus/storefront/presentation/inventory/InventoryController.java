package com.hhplus.storefront.presentation.inventory;

import com.hhplus.storefront.application.inventory.InventoryService;
import com.hhplus.storefront.application.inventory.dto.InventoryResponse;
import com.hhplus.storefront.presentation.inventory.request.InventoryAdjustmentRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * InventoryController - 재고 조회 및 관리자 재고 조정 API
 */
@RestController
public class InventoryController {

    private final InventoryService inventoryService;

    public InventoryController(InventoryService inventoryService) {
        this.inventoryService = inventoryService;
    }

    @GetMapping("/inventory/{product_id}")
    public ResponseEntity<InventoryResponse> getInventory(@PathVariable("product_id") Long productId) {
        return ResponseEntity.ok(inventoryService.getInventory(productId));
    }

    /**
     * 가용 재고 (GET /api/inventory/{product_id}/available?size_id=)
     */
    @GetMapping("/inventory/{product_id}/available")
    public ResponseEntity<Map<String, Object>> getAvailableQuantity(
            @PathVariable("product_id") Long productId,
            @RequestParam(value = "size_id", required = false) Long sizeId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("product_id", productId);
        body.put("size_id", sizeId);
        body.put("available", inventoryService.availableQuantity(productId, sizeId));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/admin/inventory/reserve")
    public ResponseEntity<Void> reserve(@RequestBody InventoryAdjustmentRequest request) {
        inventoryService.reserve(request.getProductId(), request.getSizeId(), request.getQuantity());
        return ResponseEntity.noContent().build();
    }

    /**
     * 입고/재고 반환 (POST /api/admin/inventory/release)
     */
    @PostMapping("/admin/inventory/release")
    public ResponseEntity<Void> release(
            @RequestHeader("X-USER-ID") Long operatorId,
            @RequestBody InventoryAdjustmentRequest request) {
        inventoryService.restock(request.getProductId(), request.getSizeId(), request.getQuantity(),
                String.valueOf(operatorId));
        return ResponseEntity.noContent().build();
    }
}
