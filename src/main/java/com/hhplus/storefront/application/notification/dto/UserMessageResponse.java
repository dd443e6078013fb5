package com.hhplus.storefront.application.notification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.storefront.domain.notification.Severity;
import com.hhplus.storefront.domain.notification.UserMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserMessageResponse {
    @JsonProperty("message_id")
    private Long messageId;

    @JsonProperty("message")
    private String message;

    @JsonProperty("severity")
    private Severity severity;

    @JsonProperty("read")
    private boolean read;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    public static UserMessageResponse from(UserMessage message) {
        return UserMessageResponse.builder()
                .messageId(message.getMessageId())
                .message(message.getMessage())
                .severity(message.getSeverity())
                .read(message.isRead())
                .createdAt(message.getCreatedAt())
                .build();
    }
}
