package com.myorg.saga.fulfillment.inventory;

import com.myorg.saga.fulfillment.common.web.ApiResponse;
import com.myorg.saga.fulfillment.common.web.ValidationFailedException;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
public class ProductController {

    private final ProductRepository products;
    private final Clock clock;

    @GetMapping("/{productId}")
    public ApiResponse<Product> get(@PathVariable("productId") String productId) {
        return ApiResponse.ok(products.findById(productId).orElseThrow(() -> new ProductNotFoundException(productId)));
    }

    // stock administration; reservations never go through here
    @PutMapping("/{productId}")
    public ApiResponse<Product> put(@PathVariable("productId") String productId, @RequestBody StockRequest request) {
        List<String> errors = new ArrayList<>();
        if (!StringUtils.hasText(request.getName())) errors.add("name is required.");
        if (request.getStock() < 0) errors.add("stock must not be negative.");
        if (!errors.isEmpty()) throw new ValidationFailedException(errors);

        products.upsert(productId, request.getName(), request.getStock(), clock.instant());
        return ApiResponse.ok(products.findById(productId).orElseThrow(() -> new ProductNotFoundException(productId)),
                "Stock updated.");
    }

    @Data
    public static class StockRequest {
        private String name;
        private int stock;
    }
}
