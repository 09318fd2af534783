package org.checkout.support;

import org.checkout.domain.CartLine;
import org.checkout.exception.InvalidQuantityException;
import org.checkout.service.ICartService;
import org.checkout.util.TimeUtil;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 内存版购物车，支持注入读/删失败
 */
public class InMemoryCartService implements ICartService {

    private final Map<String, LinkedHashMap<String, CartLine>> carts = new LinkedHashMap<>();
    private final Set<String> failingDeletes = new HashSet<>();
    private final Clock clock;
    private RuntimeException readFailure;
    private Runnable beforeNextRead;
    private Runnable afterNextRead;

    public InMemoryCartService(Clock clock) {
        this.clock = clock;
    }

    public synchronized void failDeletesOf(String productId) {
        failingDeletes.add(productId);
    }

    public synchronized void failReadsWith(RuntimeException failure) {
        this.readFailure = failure;
    }

    /**
     * 下一次读取前执行，模拟读取前的并发写入
     */
    public synchronized void beforeNextRead(Runnable action) {
        this.beforeNextRead = action;
    }

    /**
     * 下一次读取返回后执行，模拟读取后的并发写入
     */
    public synchronized void afterNextRead(Runnable action) {
        this.afterNextRead = action;
    }

    @Override
    public synchronized List<CartLine> getLines(String userId) {
        if (readFailure != null) {
            throw readFailure;
        }
        Runnable before = beforeNextRead;
        beforeNextRead = null;
        runOnce(before);
        List<CartLine> lines = new ArrayList<>();
        carts.getOrDefault(userId, new LinkedHashMap<>()).values().forEach(line -> lines.add(copy(line)));
        Runnable after = afterNextRead;
        afterNextRead = null;
        runOnce(after);
        return lines;
    }

    private static void runOnce(Runnable action) {
        if (action != null) {
            action.run();
        }
    }

    @Override
    public synchronized CartLine putLine(String userId, String productId, Integer quantity) {
        if (quantity == null || quantity < 1) {
            throw new InvalidQuantityException(quantity);
        }
        LocalDateTime now = TimeUtil.now(clock);
        LinkedHashMap<String, CartLine> cart = carts.computeIfAbsent(userId, k -> new LinkedHashMap<>());
        CartLine line = cart.get(productId);
        if (line == null) {
            line = CartLine.builder().userId(userId).productId(productId).createTime(now).build();
            cart.put(productId, line);
        }
        line.setQuantity(quantity);
        line.setUpdateTime(now);
        return copy(line);
    }

    @Override
    public synchronized void deleteLine(String userId, String productId) {
        checkDelete(productId);
        LinkedHashMap<String, CartLine> cart = carts.get(userId);
        if (cart != null) {
            cart.remove(productId);
        }
    }

    @Override
    public synchronized boolean deleteLineIfNotModifiedAfter(String userId, String productId, LocalDateTime cutoff) {
        checkDelete(productId);
        LinkedHashMap<String, CartLine> cart = carts.get(userId);
        if (cart == null) {
            return false;
        }
        CartLine line = cart.get(productId);
        if (line == null || line.getUpdateTime().isAfter(cutoff)) {
            return false;
        }
        cart.remove(productId);
        return true;
    }

    @Override
    public synchronized int deleteLinesNotModifiedAfter(String userId, LocalDateTime cutoff) {
        LinkedHashMap<String, CartLine> cart = carts.get(userId);
        if (cart == null) {
            return 0;
        }
        int before = cart.size();
        cart.values().removeIf(line -> !line.getUpdateTime().isAfter(cutoff));
        return before - cart.size();
    }

    private void checkDelete(String productId) {
        if (failingDeletes.contains(productId)) {
            throw new IllegalStateException("cart store unavailable for " + productId);
        }
    }

    private static CartLine copy(CartLine line) {
        return CartLine.builder()
                .userId(line.getUserId())
                .productId(line.getProductId())
                .quantity(line.getQuantity())
                .createTime(line.getCreateTime())
                .updateTime(line.getUpdateTime())
                .build();
    }
}
