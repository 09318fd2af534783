package org.checkout.business;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CheckoutResult {

    private String orderId;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal total;

    /**
     * true 表示本次请求返回（或续完）的是之前已写入的订单
     */
    private boolean replayed;
}
