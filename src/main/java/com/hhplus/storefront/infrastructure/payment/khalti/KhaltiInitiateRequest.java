package com.hhplus.storefront.infrastructure.payment.khalti;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Khalti epayment/initiate 요청 본문
 * 금액은 모두 paisa 단위
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KhaltiInitiateRequest {
    @JsonProperty("return_url")
    private String returnUrl;

    @JsonProperty("website_url")
    private String websiteUrl;

    @JsonProperty("amount")
    private long amount;

    @JsonProperty("purchase_order_id")
    private String purchaseOrderId;

    @JsonProperty("purchase_order_name")
    private String purchaseOrderName;

    @JsonProperty("customer_info")
    private CustomerInfo customerInfo;

    @JsonProperty("amount_breakdown")
    private List<AmountBreakdown> amountBreakdown;

    @JsonProperty("product_details")
    private List<ProductDetail> productDetails;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CustomerInfo {
        @JsonProperty("name")
        private String name;

        @JsonProperty("email")
        private String email;

        @JsonProperty("phone")
        private String phone;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AmountBreakdown {
        @JsonProperty("label")
        private String label;

        @JsonProperty("amount")
        private long amount;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProductDetail {
        @JsonProperty("identity")
        private String identity;

        @JsonProperty("name")
        private String name;

        @JsonProperty("total_price")
        private long totalPrice;

        @JsonProperty("quantity")
        private int quantity;

        @JsonProperty("unit_price")
        private long unitPrice;
    }
}
