package com.hhplus.storefront.domain.product;

import com.hhplus.storefront.common.exception.InvalidArgumentException;
import jakarta.persistence.*;
import lombok.*;

/**
 * Size 마스터 엔티티
 *
 * S, M, L 같은 사이즈 정의. sortOrder 순으로 노출된다.
 */
@Entity
@Table(name = "sizes")
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Size {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "size_id")
    private Long sizeId;

    @Column(name = "name", nullable = false, unique = true, length = 50)
    private String name;

    @Column(name = "description")
    private String description;

    @Column(name = "sort_order", nullable = false)
    private Integer sortOrder;

    public static Size createSize(String name, String description, int sortOrder) {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("사이즈명은 필수입니다");
        }
        return Size.builder()
                .name(name)
                .description(description)
                .sortOrder(sortOrder)
                .build();
    }
}
