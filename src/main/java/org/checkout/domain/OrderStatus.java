package org.checkout.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 订单状态
 * <p>
 * 状态流转：
 * - PENDING -> COMPLETED：订单与幂等记录写入后翻转
 * - PENDING -> FAILED：长时间停留在PENDING，由对账任务判定为废弃
 * COMPLETED 为终态，之后订单永不修改
 */
public enum OrderStatus {

    PENDING("pending"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String code;

    OrderStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
