package com.hhplus.storefront.domain.notification;

/**
 * 알림 메시지 수준
 */
public enum Severity {
    DEBUG,
    INFO,
    SUCCESS,
    WARNING,
    ERROR
}
