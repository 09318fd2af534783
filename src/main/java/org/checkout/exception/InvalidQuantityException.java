package org.checkout.exception;

public class InvalidQuantityException extends ValidationException {

    public static final String CODE = "INVALID_QUANTITY";

    public InvalidQuantityException(Integer quantity) {
        super(CODE, "购物车数量必须 >= 1, quantity=" + quantity);
    }
}
