package com.hhplus.storefront.common.exception;

/**
 * 잘못된 입력값 예외 (400 Bad Request)
 * 상태를 변경하기 전에 검증 단계에서 발생한다.
 */
public class InvalidArgumentException extends DomainException {

    public InvalidArgumentException(String detailMessage) {
        super(ErrorCode.INVALID_ARGUMENT, detailMessage);
    }
}
