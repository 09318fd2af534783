package org.checkout.exception;

/**
 * 幂等键已绑定到一个失败的订单（409）
 */
public class IdempotencyConflictException extends BusinessException {

    public static final String CODE = "IDEMPOTENCY_CONFLICT";

    public IdempotencyConflictException(String message) {
        super(CODE, message);
    }
}
