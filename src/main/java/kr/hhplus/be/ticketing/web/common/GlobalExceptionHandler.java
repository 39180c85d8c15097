package kr.hhplus.be.ticketing.web.common;

import kr.hhplus.be.ticketing.domain.common.exception.AuthorizationException;
import kr.hhplus.be.ticketing.domain.common.exception.PaymentException;
import kr.hhplus.be.ticketing.domain.common.exception.StateException;
import kr.hhplus.be.ticketing.domain.common.exception.ValidationException;
import kr.hhplus.be.ticketing.infrastructure.redis.lock.LockAcquisitionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    public record ErrorResponse(String code, String message) {}

    // ========== 도메인 예외 ==========
    @ExceptionHandler(AuthorizationException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    ErrorResponse handleAuthorization(AuthorizationException e) {
        return new ErrorResponse(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(ValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleValidation(ValidationException e) {
        return new ErrorResponse(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(StateException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    ErrorResponse handleState(StateException e) {
        return new ErrorResponse(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(PaymentException.class)
    @ResponseStatus(HttpStatus.PAYMENT_REQUIRED)
    ErrorResponse handlePayment(PaymentException e) {
        return new ErrorResponse(e.getErrorCode(), e.getMessage());
    }

    // ========== 락 ==========
    @ExceptionHandler(LockAcquisitionException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    ErrorResponse handleLockAcquisition(LockAcquisitionException e) {
        log.warn("원장 락 획득 실패: {}", e.getMessage());
        return new ErrorResponse("LOCK_UNAVAILABLE", "요청이 많아 처리하지 못했습니다. 잠시 후 다시 시도해주세요");
    }

    // ========== 요청 형식 ==========
    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleMethodArgumentNotValid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .findFirst()
                .orElse("요청 값이 올바르지 않습니다");
        return new ErrorResponse("INVALID_ARGUMENT", message);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleMissingHeader(MissingRequestHeaderException e) {
        return new ErrorResponse("INVALID_ARGUMENT", e.getHeaderName() + " 헤더가 필요합니다");
    }

    // ========== 일반 예외 ==========
    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleIllegalArgument(IllegalArgumentException e) {
        return new ErrorResponse("INVALID_ARGUMENT", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    ErrorResponse handleGenericException(Exception e) {
        log.error("처리되지 않은 예외", e);
        return new ErrorResponse("INTERNAL_ERROR", "서버 내부 오류가 발생했습니다");
    }
}
