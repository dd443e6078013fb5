package com.hhplus.storefront.application.notification;

import com.hhplus.storefront.application.notification.dto.UserMessageResponse;
import com.hhplus.storefront.domain.notification.Severity;
import com.hhplus.storefront.domain.notification.UserMessageNotFoundException;
import com.hhplus.storefront.infrastructure.notification.UserMessageNotificationSink;
import com.hhplus.storefront.infrastructure.persistence.notification.InMemoryUserMessageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NotificationService 단위 테스트")
class NotificationServiceTest {

    private NotificationService notificationService;
    private NotificationSink notificationSink;

    @BeforeEach
    void setup() {
        InMemoryUserMessageRepository repository = new InMemoryUserMessageRepository();
        notificationService = new NotificationService(repository);
        notificationSink = new UserMessageNotificationSink(repository,
                Clock.fixed(Instant.parse("2026-03-02T01:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("알림 조회 - 본인 알림만 최신순")
    void testGetMessages() {
        // Given
        notificationSink.notify(1L, "주문 #1이(가) 접수되었습니다.", Severity.SUCCESS);
        notificationSink.notify(2L, "다른 사용자 알림", Severity.INFO);
        notificationSink.notify(1L, "주문 #1이(가) 발송되었습니다.", Severity.INFO);

        // When
        List<UserMessageResponse> messages = notificationService.getMessages(1L);

        // Then
        assertEquals(2, messages.size());
        assertEquals("주문 #1이(가) 발송되었습니다.", messages.get(0).getMessage());
        assertFalse(messages.get(0).isRead());
    }

    @Test
    @DisplayName("읽음 처리 - 본인 알림")
    void testMarkAsRead() {
        notificationSink.notify(1L, "주문 #1이(가) 접수되었습니다.", Severity.SUCCESS);
        Long messageId = notificationService.getMessages(1L).get(0).getMessageId();

        UserMessageResponse result = notificationService.markAsRead(1L, messageId);

        assertTrue(result.isRead());
        assertTrue(notificationService.getMessages(1L).get(0).isRead());
    }

    @Test
    @DisplayName("읽음 처리 - 다른 사용자의 알림은 찾을 수 없음")
    void testMarkAsRead_OtherUser() {
        notificationSink.notify(1L, "주문 #1이(가) 접수되었습니다.", Severity.SUCCESS);
        Long messageId = notificationService.getMessages(1L).get(0).getMessageId();

        assertThrows(UserMessageNotFoundException.class, () -> notificationService.markAsRead(2L, messageId));
        assertThrows(UserMessageNotFoundException.class, () -> notificationService.markAsRead(1L, 999L));
    }
}
