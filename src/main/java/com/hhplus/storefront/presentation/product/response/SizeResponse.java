package com.hhplus.storefront.presentation.product.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.storefront.domain.product.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SizeResponse {
    @JsonProperty("size_id")
    private Long sizeId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("sort_order")
    private Integer sortOrder;

    public static SizeResponse from(Size size) {
        return new SizeResponse(size.getSizeId(), size.getName(), size.getDescription(), size.getSortOrder());
    }
}
