package com.hhplus.storefront.domain.notification;

import com.hhplus.storefront.common.exception.InvalidArgumentException;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * UserMessage 엔티티 (사용자 알림함)
 * 주문 상태 변경, 결제 확인, 수령 확인 알림이 쌓인다.
 */
@Entity
@Table(name = "user_messages", indexes = {
    @Index(name = "idx_user_messages_user_id", columnList = "user_id")
})
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UserMessage {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "message_id")
    private Long messageId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "message", nullable = false, length = 1000)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 20)
    private Severity severity;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static UserMessage create(Long userId, String message, Severity severity, LocalDateTime now) {
        if (userId == null) {
            throw new InvalidArgumentException("알림 대상 사용자는 필수입니다");
        }
        if (message == null || message.isBlank()) {
            throw new InvalidArgumentException("알림 내용은 필수입니다");
        }
        return UserMessage.builder()
                .userId(userId)
                .message(message)
                .severity(severity == null ? Severity.INFO : severity)
                .read(false)
                .createdAt(now)
                .build();
    }

    public void markAsRead() {
        this.read = true;
    }
}
