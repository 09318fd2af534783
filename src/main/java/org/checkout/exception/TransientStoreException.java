package org.checkout.exception;

/**
 * 存储层瞬时故障（超时、连接丢失等，503）
 * 客户端可携带同一幂等token安全重试
 */
public class TransientStoreException extends BusinessException {

    public static final String CODE = "TRANSIENT_STORE_ERROR";

    public TransientStoreException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
