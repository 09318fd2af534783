package org.checkout.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.checkout.domain.CartLine;
import org.checkout.exception.InvalidQuantityException;
import org.checkout.exception.ValidationException;
import org.checkout.mapper.CartLineMapper;
import org.checkout.service.ICartService;
import org.checkout.util.TimeUtil;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 购物车服务实现
 * <p>
 * 每个操作都是单行原子操作：
 * 1. putLine 依赖 (user_id, product_id) 唯一约束做 upsert
 * 2. 删除操作天然幂等，行不存在时影响行数为0
 * 3. 条件删除以 update_time 判断该行是否在截止时间后被修改
 */
@Slf4j
@Service
public class CartServiceImpl extends ServiceImpl<CartLineMapper, CartLine> implements ICartService {

    private final Clock clock;

    public CartServiceImpl(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<CartLine> getLines(String userId) {
        return this.lambdaQuery()
                .eq(CartLine::getUserId, userId)
                .orderByAsc(CartLine::getCreateTime)
                .orderByAsc(CartLine::getId)
                .list();
    }

    @Override
    public CartLine putLine(String userId, String productId, Integer quantity) {
        if (!StringUtils.hasText(userId) || !StringUtils.hasText(productId)) {
            throw new ValidationException("userId和productId不能为空");
        }
        if (quantity == null || quantity < 1) {
            throw new InvalidQuantityException(quantity);
        }

        LocalDateTime now = TimeUtil.now(clock);
        baseMapper.upsertLine(userId, productId, quantity, now);
        log.info("[购物车写入] userId={}, productId={}, quantity={}", userId, productId, quantity);

        return this.lambdaQuery()
                .eq(CartLine::getUserId, userId)
                .eq(CartLine::getProductId, productId)
                .one();
    }

    @Override
    public void deleteLine(String userId, String productId) {
        int deleted = baseMapper.delete(new LambdaQueryWrapper<CartLine>()
                .eq(CartLine::getUserId, userId)
                .eq(CartLine::getProductId, productId));
        log.info("[购物车删除] userId={}, productId={}, deleted={}", userId, productId, deleted);
    }

    @Override
    public boolean deleteLineIfNotModifiedAfter(String userId, String productId, LocalDateTime cutoff) {
        return baseMapper.deleteLineNotModifiedAfter(userId, productId, cutoff) > 0;
    }

    @Override
    public int deleteLinesNotModifiedAfter(String userId, LocalDateTime cutoff) {
        return baseMapper.deleteLinesNotModifiedAfter(userId, cutoff);
    }
}
