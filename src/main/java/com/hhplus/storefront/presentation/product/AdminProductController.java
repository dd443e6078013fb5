package com.hhplus.storefront.presentation.product;

import com.hhplus.storefront.application.product.ProductCatalogService;
import com.hhplus.storefront.application.product.dto.ProductResponse;
import com.hhplus.storefront.application.product.dto.RegisterProductCommand;
import com.hhplus.storefront.presentation.product.request.AddProductSizeRequest;
import com.hhplus.storefront.presentation.product.request.ChangePriceRequest;
import com.hhplus.storefront.presentation.product.request.RegisterProductRequest;
import com.hhplus.storefront.presentation.product.request.RegisterSizeRequest;
import com.hhplus.storefront.presentation.product.response.ProductSizeResponse;
import com.hhplus.storefront.presentation.product.response.SizeResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * AdminProductController - 상품/사이즈 관리 API
 */
@RestController
@RequestMapping("/admin")
public class AdminProductController {

    private final ProductCatalogService productCatalogService;

    public AdminProductController(ProductCatalogService productCatalogService) {
        this.productCatalogService = productCatalogService;
    }

    @PostMapping("/products")
    public ResponseEntity<ProductResponse> registerProduct(@RequestBody RegisterProductRequest request) {
        RegisterProductCommand command = RegisterProductCommand.builder()
                .productName(request.getProductName())
                .description(request.getDescription())
                .price(request.getPrice())
                .initialStock(request.getInitialStock())
                .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(productCatalogService.registerProduct(command));
    }

    @PostMapping("/sizes")
    public ResponseEntity<SizeResponse> registerSize(@RequestBody RegisterSizeRequest request) {
        SizeResponse response = SizeResponse.from(
                productCatalogService.registerSize(request.getName(), request.getDescription(), request.getSortOrder()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/products/{product_id}/sizes")
    public ResponseEntity<ProductSizeResponse> addProductSize(
            @PathVariable("product_id") Long productId,
            @RequestBody AddProductSizeRequest request) {
        ProductSizeResponse response = ProductSizeResponse.from(
                productCatalogService.addProductSize(productId, request.getSizeId(), request.getInitialStock()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PutMapping("/products/{product_id}/price")
    public ResponseEntity<ProductResponse> changePrice(
            @PathVariable("product_id") Long productId,
            @RequestBody ChangePriceRequest request) {
        return ResponseEntity.ok(productCatalogService.changePrice(productId, request.getPrice()));
    }

    /**
     * 상품 삭제 (DELETE /api/admin/products/{product_id})
     * 기존 주문 항목은 스냅샷을 유지한 채 상품 참조만 끊긴다.
     */
    @DeleteMapping("/products/{product_id}")
    public ResponseEntity<Void> deleteProduct(@PathVariable("product_id") Long productId) {
        productCatalogService.deleteProduct(productId);
        return ResponseEntity.noContent().build();
    }
}
