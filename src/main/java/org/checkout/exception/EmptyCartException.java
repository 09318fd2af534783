package org.checkout.exception;

/**
 * 购物车为空（400）
 * 不做幂等记忆：加购后用同一token重试可以成功
 */
public class EmptyCartException extends BusinessException {

    public static final String CODE = "EMPTY_CART";

    public EmptyCartException(String message) {
        super(CODE, message);
    }
}
