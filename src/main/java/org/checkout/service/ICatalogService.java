package org.checkout.service;

import org.checkout.domain.Product;
import org.checkout.exception.NotFoundException;

import java.util.List;
import java.util.Optional;

/**
 * 商品目录服务接口（只读）
 */
public interface ICatalogService {

    /**
     * 列出全部商品
     */
    List<Product> listProducts();

    /**
     * 查询单个商品的当前快照
     *
     * @param productId 商品ID
     * @return 商品，不存在时为空
     */
    Optional<Product> findProduct(String productId);

    /**
     * 查询单个商品，不存在时抛出 NotFoundException
     */
    default Product getProduct(String productId) {
        return findProduct(productId)
                .orElseThrow(() -> new NotFoundException("商品", productId));
    }
}
