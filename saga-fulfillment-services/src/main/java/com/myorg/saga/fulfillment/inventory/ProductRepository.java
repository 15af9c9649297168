package com.myorg.saga.fulfillment.inventory;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
@RequiredArgsConstructor
public class ProductRepository {

    private final JdbcTemplate jdbc;

    public Optional<Product> findById(String productId) {
        List<Product> rows = jdbc.query(
                "SELECT product_id, name, stock, updated_at FROM product WHERE product_id=?",
                (rs, i) -> new Product(
                        rs.getString("product_id"),
                        rs.getString("name"),
                        rs.getInt("stock"),
                        rs.getTimestamp("updated_at").toInstant()),
                productId);
        return rows.stream().findFirst();
    }

    public void upsert(String productId, String name, int stock, Instant now) {
        int updated = jdbc.update("UPDATE product SET name=?, stock=?, updated_at=? WHERE product_id=?",
                name, stock, Timestamp.from(now), productId);
        if (updated == 0) {
            jdbc.update("INSERT INTO product (product_id, name, stock, updated_at) VALUES (?, ?, ?, ?)",
                    productId, name, stock, Timestamp.from(now));
        }
    }

    /**
     * Row-locks the given products in ascending id order until the surrounding transaction ends.
     * Products that don't exist are absent from the result.
     */
    public Map<String, Integer> lockStock(Collection<String> sortedProductIds) {
        if (sortedProductIds.isEmpty()) return Map.of();

        String placeholders = sortedProductIds.stream().map(x -> "?").collect(Collectors.joining(","));
        String sql = """
                SELECT product_id, stock
                FROM product
                WHERE product_id IN (%s)
                ORDER BY product_id
                FOR UPDATE
                """.formatted(placeholders);

        Map<String, Integer> stock = new HashMap<>();
        jdbc.query(sql, (RowCallbackHandler) rs -> stock.put(rs.getString("product_id"), rs.getInt("stock")),
                sortedProductIds.toArray());
        return stock;
    }

    /** Guarded decrement. @return 0 when the stock is no longer sufficient */
    public int decrement(String productId, int quantity, Instant now) {
        return jdbc.update("""
                UPDATE product
                SET stock = stock - ?, updated_at=?
                WHERE product_id=? AND stock >= ?
                """, quantity, Timestamp.from(now), productId, quantity);
    }
}
