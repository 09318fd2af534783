package org.checkout.service;

import org.checkout.domain.CartLine;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 购物车服务接口
 * 每个方法都显式携带 userId
 */
public interface ICartService {

    /**
     * 读取用户的全部购物车行，空购物车返回空列表
     *
     * @param userId 用户ID
     * @return 购物车行
     */
    List<CartLine> getLines(String userId);

    /**
     * 写入或覆盖一行
     *
     * @param userId    用户ID
     * @param productId 商品ID
     * @param quantity  数量
     * @return 写入后的购物车行
     * @throws org.checkout.exception.InvalidQuantityException quantity < 1
     */
    CartLine putLine(String userId, String productId, Integer quantity);

    /**
     * 删除一行，行不存在时视为成功
     */
    void deleteLine(String userId, String productId);

    /**
     * 条件删除一行：仅当该行最后修改时间不晚于cutoff时删除
     *
     * @return true: 已删除；false: 行不存在或在cutoff之后被修改过
     */
    boolean deleteLineIfNotModifiedAfter(String userId, String productId, LocalDateTime cutoff);

    /**
     * 删除用户所有最后修改时间不晚于cutoff的行
     *
     * @return 删除行数
     */
    int deleteLinesNotModifiedAfter(String userId, LocalDateTime cutoff);
}
