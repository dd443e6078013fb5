package com.hhplus.storefront.application.notification;

import com.hhplus.storefront.domain.notification.Severity;

/**
 * 알림 전달 Port
 * 구현체: UserMessageNotificationSink (사용자 알림함 저장)
 */
public interface NotificationSink {

    void notify(Long userId, String message, Severity severity);
}
