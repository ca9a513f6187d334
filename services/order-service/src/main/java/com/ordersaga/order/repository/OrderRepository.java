package com.ordersaga.order.repository;

import com.ordersaga.order.entity.Order;
import com.ordersaga.order.entity.OrderStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface OrderRepository extends JpaRepository<Order, String> {

    List<Order> findByUserIdOrderByCreatedAtDesc(String userId);

    List<Order> findTop100ByStatusAndUpdatedAtBeforeOrderByUpdatedAtAsc(OrderStatus status, Instant cutoff);
}
