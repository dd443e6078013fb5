package com.hhplus.storefront.infrastructure.payment.khalti;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Khalti epayment/lookup 응답
 * status: Completed, Pending, Initiated, Expired, User canceled, Refunded, Partially Refunded
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class KhaltiLookupResponse {
    @JsonProperty("pidx")
    private String pidx;

    @JsonProperty("total_amount")
    private Long totalAmount;

    @JsonProperty("status")
    private String status;

    @JsonProperty("transaction_id")
    private String transactionId;

    @JsonProperty("fee")
    private Long fee;

    @JsonProperty("refunded")
    private Boolean refunded;
}
