package org.checkout.exception;

/**
 * 商品或订单不存在（404）
 */
public class NotFoundException extends BusinessException {

    public static final String CODE = "NOT_FOUND";

    public NotFoundException(String resource, String id) {
        super(CODE, resource + "不存在: " + id);
    }
}
