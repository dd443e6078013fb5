package com.hhplus.storefront.infrastructure.payment.khalti;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class KhaltiLookupRequest {
    @JsonProperty("pidx")
    private String pidx;
}
