package com.hhplus.storefront.presentation.common;

import com.hhplus.storefront.common.exception.BizException;
import com.hhplus.storefront.common.exception.ErrorCode;
import com.hhplus.storefront.common.exception.SystemException;
import com.hhplus.storefront.presentation.common.response.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * GlobalExceptionHandler - 전역 예외 처리 (Presentation 계층)
 *
 * 에러 응답 형식:
 * {
 *   "error_code": "DOMAIN_PRODUCT_INSUFFICIENT_STOCK",
 *   "error_message": "재고가 부족합니다 | 1번째 항목 '티셔츠' 재고 부족 (요청: 3, 보유: 1)",
 *   "timestamp": "2025-11-07T12:34:56.000Z",
 *   "request_id": "req-abc123def456"
 * }
 *
 * HTTP 상태 코드는 ErrorCode에 정의된 값을 그대로 사용한다.
 * - 400: 입력 오류, 사이즈 미지정
 * - 403: 다른 사용자의 주문
 * - 404: 상품/사이즈/주문/장바구니 항목/메시지 없음
 * - 409: 재고 부족, 허용되지 않은 전이, 취소 불가, 잘못된 주문 상태
 * - 502/504: 결제 게이트웨이 거절/시간 초과
 * - 503: 재고 락 재시도 소진
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BizException.class)
    public ResponseEntity<ErrorResponse> handleBizException(BizException e) {
        if (e instanceof SystemException) {
            log.error("[GlobalExceptionHandler] 시스템 오류: code={}, message={}", e.getErrorCodeValue(), e.getMessage(), e);
        } else {
            log.info("[GlobalExceptionHandler] 요청 거절: code={}, message={}", e.getErrorCodeValue(), e.getMessage());
        }
        return ResponseEntity.status(e.getStatusCode())
                .body(ErrorResponse.of(e.getErrorCodeValue(), e.getMessage()));
    }

    /**
     * X-USER-ID 헤더 누락, 필수 파라미터 누락, 형식 오류, 본문 파싱 실패 (400)
     */
    @ExceptionHandler({
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        ErrorCode code = ErrorCode.INVALID_ARGUMENT;
        return ResponseEntity.status(code.getStatusCode())
                .body(ErrorResponse.of(code, e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("[GlobalExceptionHandler] 처리되지 않은 예외", e);
        ErrorCode code = ErrorCode.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(code.getStatusCode())
                .body(ErrorResponse.of(code, null));
    }
}
