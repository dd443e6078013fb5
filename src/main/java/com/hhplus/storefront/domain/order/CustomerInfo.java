package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.common.exception.InvalidArgumentException;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문자 정보 스냅샷 (Value Object)
 *
 * 주문 생성 시점에 복사되며 이후 변경되지 않는다. (setter 없음)
 * 수령인 정보가 없으면 주문자 정보를 사용한다.
 */
@Embeddable
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CustomerInfo {

    @Column(name = "full_name", nullable = false, length = 100)
    private String fullName;

    @Column(name = "email", nullable = false)
    private String email;

    @Column(name = "phone", nullable = false, length = 20)
    private String phone;

    @Column(name = "address", nullable = false)
    private String address;

    @Column(name = "city", nullable = false, length = 100)
    private String city;

    @Column(name = "state", length = 100)
    private String state;

    @Column(name = "postal_code", length = 20)
    private String postalCode;

    @Column(name = "receiver_name", length = 100)
    private String receiverName;

    @Column(name = "receiver_phone", length = 20)
    private String receiverPhone;

    /**
     * 필수 항목 검증
     *
     * @throws InvalidArgumentException 이름/이메일/연락처/주소/도시 중 누락
     */
    public void validate() {
        requireText(fullName, "주문자 이름");
        requireText(email, "이메일");
        requireText(phone, "연락처");
        requireText(address, "주소");
        requireText(city, "도시");
    }

    /**
     * 결제 게이트웨이에 전달할 연락처 정보가 모두 있는지
     */
    public boolean hasContactDetails() {
        return hasText(fullName) && hasText(email) && hasText(phone);
    }

    public String getEffectiveReceiverName() {
        return hasText(receiverName) ? receiverName : fullName;
    }

    public String getEffectiveReceiverPhone() {
        return hasText(receiverPhone) ? receiverPhone : phone;
    }

    private static void requireText(String value, String fieldName) {
        if (!hasText(value)) {
            throw new InvalidArgumentException(fieldName + "은(는) 필수입니다");
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
