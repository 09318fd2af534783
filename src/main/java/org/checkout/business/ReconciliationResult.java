package org.checkout.business;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReconciliationResult {

    /**
     * 扫描到有已完成订单的用户数
     */
    private int usersScanned;

    private int clearedLines;

    /**
     * 清理失败的用户数，下一轮继续处理
     */
    private int failedUsers;

    /**
     * 判定为废弃并置为 FAILED 的订单数
     */
    private int expiredOrders;
}
