package com.hhplus.storefront.infrastructure.payment.khalti;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class KhaltiInitiateResponse {
    @JsonProperty("pidx")
    private String pidx;

    @JsonProperty("payment_url")
    private String paymentUrl;

    @JsonProperty("expires_at")
    private String expiresAt;

    @JsonProperty("expires_in")
    private Long expiresIn;
}
