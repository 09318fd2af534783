package org.checkout.controller;

import lombok.extern.slf4j.Slf4j;
import org.checkout.domain.Product;
import org.checkout.service.ICatalogService;
import org.checkout.util.ResponseUtil;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 商品目录控制器（只读）
 *
 * API：
 * - GET /products - 商品列表
 * - GET /products/{productId} - 商品详情，不存在返回 404
 */
@Slf4j
@RestController
@RequestMapping("/products")
public class ProductController {

    private final ICatalogService catalogService;

    public ProductController(ICatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> listProducts() {
        List<Product> products = catalogService.listProducts();
        return ResponseEntity.ok(ResponseUtil.success("查询成功", products));
    }

    @GetMapping("/{productId}")
    public ResponseEntity<Map<String, Object>> getProduct(@PathVariable String productId) {
        return ResponseEntity.ok(ResponseUtil.success("查询成功", catalogService.getProduct(productId)));
    }
}
