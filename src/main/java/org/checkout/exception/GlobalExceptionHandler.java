package org.checkout.exception;

import lombok.extern.slf4j.Slf4j;
import org.checkout.util.ResponseUtil;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * 全局异常处理
 * 错误响应与成功响应使用同一结构：{code, message, traceId}
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(ValidationException e) {
        log.warn("[参数校验失败] code={}, message={}", e.getCode(), e.getMessage());
        return ResponseUtil.error(e.getCode(), e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("[请求体无法解析] message={}", e.getMessage());
        return ResponseUtil.error(ValidationException.CODE, "请求体格式错误");
    }

    @ExceptionHandler(EmptyCartException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleEmptyCart(EmptyCartException e) {
        return ResponseUtil.error(e.getCode(), e.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NotFoundException e) {
        return ResponseUtil.error(e.getCode(), e.getMessage());
    }

    @ExceptionHandler(IdempotencyConflictException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleIdempotencyConflict(IdempotencyConflictException e) {
        return ResponseUtil.error(e.getCode(), e.getMessage());
    }

    @ExceptionHandler(TransientStoreException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleTransientStore(TransientStoreException e) {
        log.error("[存储瞬时故障] message={}", e.getMessage());
        return ResponseUtil.error(e.getCode(), e.getMessage());
    }

    @ExceptionHandler({TransientDataAccessException.class,
            RecoverableDataAccessException.class,
            DataAccessResourceFailureException.class})
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleDataAccess(RuntimeException e) {
        log.error("[存储瞬时故障] message={}", e.getMessage(), e);
        return ResponseUtil.error(TransientStoreException.CODE, "存储暂时不可用，请稍后重试");
    }

    @ExceptionHandler(BusinessException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBusiness(BusinessException e) {
        log.warn("[业务异常] code={}, message={}", e.getCode(), e.getMessage());
        return ResponseUtil.error(e.getCode(), e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception e) {
        log.error("[系统异常] message={}", e.getMessage(), e);
        return ResponseUtil.error("INTERNAL_ERROR", "系统繁忙，请稍后重试");
    }
}
