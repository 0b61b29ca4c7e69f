package com.agentrelay.workers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Coffee farm worker. Answers yield queries in pounds, creates orders and reports order details.
 */
public class FarmAgent implements WorkerAgent {

    private static final Logger log = LoggerFactory.getLogger(FarmAgent.class);

    static final Pattern CREATE_ORDER = Pattern.compile(
            "create an order with price\\s+\\$?([0-9]+(?:\\.[0-9]+)?)\\s+and quantity\\s+([0-9]+)",
            Pattern.CASE_INSENSITIVE);
    static final Pattern ORDER_DETAILS = Pattern.compile("get details for order id\\s+(\\S+)",
            Pattern.CASE_INSENSITIVE);

    private final String name;
    private final int yieldLbs;
    private final Map<String, String> orders = new ConcurrentHashMap<>();

    public FarmAgent(String name, int yieldLbs) {
        this.name = name;
        this.yieldLbs = yieldLbs;
    }

    /** Default yields for the demo farms; unknown farms report 1000 lbs. */
    public static int defaultYield(String farm) {
        return switch (farm.toLowerCase(Locale.ROOT)) {
            case "brazil" -> 7500;
            case "colombia" -> 5000;
            case "vietnam" -> 6200;
            default -> 1000;
        };
    }

    @Override
    public String handle(String taskId, String payload) throws WorkerException {
        if (payload == null || payload.isBlank()) {
            throw new WorkerException("Farm " + name + " received an empty request");
        }
        Matcher order = CREATE_ORDER.matcher(payload);
        if (order.find()) {
            return createOrder(Double.parseDouble(order.group(1)), Integer.parseInt(order.group(2)));
        }
        Matcher details = ORDER_DETAILS.matcher(payload);
        if (details.find()) {
            return orderDetails(details.group(1));
        }
        log.debug("Farm {} reporting yield for {}", name, taskId);
        return yieldLbs + " lbs";
    }

    private String createOrder(double price, int quantity) throws WorkerException {
        if (price <= 0 || quantity <= 0) {
            throw new WorkerException("Price and quantity must be greater than zero");
        }
        if (quantity > yieldLbs) {
            throw new WorkerException("Farm " + name + " cannot fill " + quantity + " lbs; only "
                    + yieldLbs + " lbs available");
        }
        String orderId = UUID.randomUUID().toString().substring(0, 8);
        String summary = "farm: " + name + ", price: " + price + ", quantity: " + quantity + " lbs";
        orders.put(orderId, summary);
        log.info("Farm {} created order {}", name, orderId);
        return "Order created.\norder_id: " + orderId + "\n" + summary;
    }

    private String orderDetails(String orderId) throws WorkerException {
        String summary = orders.get(orderId);
        if (summary == null) {
            throw new WorkerException("Order " + orderId + " not found at farm " + name);
        }
        return "order_id: " + orderId + "\nstatus: CONFIRMED\n" + summary;
    }

    public String getName() {
        return name;
    }
}
