package com.hhplus.storefront.application.order.dto;

import com.hhplus.storefront.domain.order.CustomerInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문자 정보 Command
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerInfoCommand {
    private String fullName;
    private String email;
    private String phone;
    private String address;
    private String city;
    private String state;
    private String postalCode;
    private String receiverName;
    private String receiverPhone;

    public CustomerInfo toCustomerInfo() {
        return CustomerInfo.builder()
                .fullName(fullName)
                .email(email)
                .phone(phone)
                .address(address)
                .city(city)
                .state(state)
                .postalCode(postalCode)
                .receiverName(receiverName)
                .receiverPhone(receiverPhone)
                .build();
    }
}
