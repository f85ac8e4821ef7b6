package org.crmjobs.data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Customer and order store held in memory. Used for local runs without a database and in tests.
 * Staleness is decided per customer from its latest order, same as the SQL implementation.
 */
public class InMemoryCustomerRepository implements CustomerRepository, OrderRepository {

    private final Map<Long, Customer> customers = new LinkedHashMap<>();
    private final Map<Long, Order> orders = new LinkedHashMap<>();

    public synchronized InMemoryCustomerRepository addCustomer(Customer customer) {
        customers.put(customer.id(), customer);
        return this;
    }

    public synchronized InMemoryCustomerRepository addOrder(Order order) {
        if (!customers.containsKey(order.customerId())) {
            throw new IllegalArgumentException("Unknown customer " + order.customerId() + " for order " + order.id());
        }
        orders.put(order.id(), order);
        return this;
    }

    public synchronized Set<Long> customerIds() {
        return new LinkedHashSet<>(customers.keySet());
    }

    public synchronized List<Order> orders() {
        return new ArrayList<>(orders.values());
    }

    @Override
    public synchronized Set<Long> listCustomersWithNoOrders() {
        Set<Long> ids = new LinkedHashSet<>();
        for (Long id : customers.keySet()) {
            if (latestOrderDate(id).isEmpty()) {
                ids.add(id);
            }
        }
        return ids;
    }

    @Override
    public synchronized Set<Long> listCustomersWithStaleLatestOrder(Instant cutoff) {
        Set<Long> ids = new LinkedHashSet<>();
        for (Long id : customers.keySet()) {
            Optional<Instant> latest = latestOrderDate(id);
            if (latest.isPresent() && latest.get().isBefore(cutoff)) {
                ids.add(id);
            }
        }
        return ids;
    }

    @Override
    public synchronized int deleteByIds(Set<Long> customerIds) {
        int deleted = 0;
        for (Long id : customerIds) {
            if (customers.remove(id) != null) {
                deleted++;
            }
        }
        orders.values().removeIf(order -> customerIds.contains(order.customerId()));
        return deleted;
    }

    @Override
    public synchronized List<PendingOrder> listPendingOrdersSince(Instant since) {
        List<PendingOrder> pending = new ArrayList<>();
        orders.values().stream()
                .filter(Order::isPending)
                .filter(order -> !order.orderDate().isBefore(since))
                .sorted(Comparator.comparing(Order::orderDate).thenComparing(Order::id))
                .forEach(order -> pending.add(new PendingOrder(
                        order.id(),
                        customers.get(order.customerId()).email(),
                        order.orderDate())));
        return pending;
    }

    private Optional<Instant> latestOrderDate(long customerId) {
        return orders.values().stream()
                .filter(order -> order.customerId() == customerId)
                .map(Order::orderDate)
                .max(Comparator.naturalOrder());
    }
}
