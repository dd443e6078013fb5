package com.hhplus.storefront.domain.notification;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 알림 메시지를 찾을 수 없을 때 발생하는 예외 (404)
 * 다른 사용자의 메시지를 지정한 경우에도 동일하게 처리한다.
 */
public class UserMessageNotFoundException extends DomainException {

    public UserMessageNotFoundException(Long messageId) {
        super(ErrorCode.USER_MESSAGE_NOT_FOUND, "messageId=" + messageId);
    }
}
