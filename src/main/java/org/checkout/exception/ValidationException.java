package org.checkout.exception;

/**
 * 参数校验失败（400）
 */
public class ValidationException extends BusinessException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(CODE, message);
    }

    protected ValidationException(String code, String message) {
        super(code, message);
    }
}
