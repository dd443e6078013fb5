package com.hhplus.storefront.infrastructure.notification;

import com.hhplus.storefront.application.notification.NotificationSink;
import com.hhplus.storefront.domain.notification.Severity;
import com.hhplus.storefront.domain.notification.UserMessage;
import com.hhplus.storefront.domain.notification.UserMessageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 사용자 알림함(user_messages)에 저장하는 NotificationSink
 * 주문 트랜잭션이 끝난 뒤 호출되므로 별도 트랜잭션으로 저장한다.
 */
@Slf4j
@Component
public class UserMessageNotificationSink implements NotificationSink {

    private final UserMessageRepository userMessageRepository;
    private final Clock clock;

    public UserMessageNotificationSink(UserMessageRepository userMessageRepository, Clock clock) {
        this.userMessageRepository = userMessageRepository;
        this.clock = clock;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void notify(Long userId, String message, Severity severity) {
        UserMessage saved = userMessageRepository.save(UserMessage.create(userId, message, severity, LocalDateTime.now(clock)));
        log.debug("[UserMessageNotificationSink] 알림 저장: messageId={}, userId={}", saved.getMessageId(), userId);
    }
}
