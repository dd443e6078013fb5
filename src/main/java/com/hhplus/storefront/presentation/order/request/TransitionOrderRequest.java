package com.hhplus.storefront.presentation.order.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 관리자 상태 변경 요청
 * status는 OrderStatus 이름 (대소문자 무관, 예: "shipped")
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class TransitionOrderRequest {
    @JsonProperty("status")
    private String status;

    @JsonProperty("note")
    private String note;
}
