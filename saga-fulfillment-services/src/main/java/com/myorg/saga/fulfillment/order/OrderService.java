package com.myorg.saga.fulfillment.order;

import com.myorg.saga.contracts.fulfillment.FulfillmentEvent;
import com.myorg.saga.contracts.fulfillment.events.OrderLineItem;
import com.myorg.saga.contracts.fulfillment.events.OrderPlacedEvent;
import com.myorg.saga.fulfillment.common.FulfillmentEventEmitter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/** Order intake. Placing an order and emitting OrderPlaced is one transaction. */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderService {

    private static final DateTimeFormatter NUMBER_DATE = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final OrderRepository orders;
    private final FulfillmentEventEmitter emitter;
    private final TransactionTemplate tx;
    private final Clock clock;

    public Order placeOrder(PlaceOrderRequest request) {
        validate(request);

        Instant now = clock.instant();
        String orderId = UUID.randomUUID().toString();
        List<OrderLine> lines = request.getItems().stream()
                .map(i -> new OrderLine(i.getProductId(), i.getQuantity(), i.getUnitPrice()))
                .toList();
        BigDecimal total = lines.stream().map(OrderLine::lineTotal).reduce(BigDecimal.ZERO, BigDecimal::add);

        Order order = Order.builder()
                .orderId(orderId)
                .orderNumber(orderNumber(orderId, now))
                .userId(request.getUserId())
                .customerName(request.getCustomerName())
                .customerEmail(request.getCustomerEmail())
                .phoneNumber(request.getPhoneNumber())
                .totalAmount(total)
                .status(OrderStatus.PLACED)
                .changedBy(request.getUserId())
                .createdAt(now)
                .updatedAt(now)
                .lines(lines)
                .build();

        tx.executeWithoutResult(s -> {
            orders.insert(order);
            emitter.emit(FulfillmentEvent.ORDER_PLACED, orderId, OrderPlacedEvent.builder()
                    .orderId(orderId)
                    .orderNumber(order.getOrderNumber())
                    .userId(order.getUserId())
                    .customerName(order.getCustomerName())
                    .customerEmail(order.getCustomerEmail())
                    .phoneNumber(order.getPhoneNumber())
                    .totalAmount(total)
                    .items(lines.stream()
                            .map(l -> new OrderLineItem(l.productId(), l.quantity(), l.unitPrice()))
                            .toList())
                    .build());
        });

        log.info("Order {} ({}) placed by user {} total={}", orderId, order.getOrderNumber(), order.getUserId(), total);
        return order;
    }

    public Order getOrder(String orderId) {
        return orders.findById(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    private static void validate(PlaceOrderRequest request) {
        List<String> errors = new ArrayList<>();
        if (!StringUtils.hasText(request.getUserId())) {
            errors.add("userId is required.");
        }
        if (!StringUtils.hasText(request.getCustomerEmail())) {
            errors.add("customerEmail is required.");
        }
        if (request.getItems() == null || request.getItems().isEmpty()) {
            errors.add("At least one item is required.");
        } else {
            for (int i = 0; i < request.getItems().size(); i++) {
                PlaceOrderRequest.Item item = request.getItems().get(i);
                if (!StringUtils.hasText(item.getProductId())) {
                    errors.add("items[" + i + "].productId is required.");
                }
                if (item.getQuantity() <= 0) {
                    errors.add("items[" + i + "].quantity must be positive.");
                }
                if (item.getUnitPrice() == null || item.getUnitPrice().signum() < 0) {
                    errors.add("items[" + i + "].unitPrice must not be negative.");
                }
            }
        }
        if (!errors.isEmpty()) {
            throw new OrderValidationException(errors);
        }
    }

    // ORD-20260301-1A2B3C4D, unique because the suffix comes from the order id
    private static String orderNumber(String orderId, Instant now) {
        String suffix = orderId.replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
        return "ORD-" + NUMBER_DATE.format(now) + "-" + suffix;
    }
}
