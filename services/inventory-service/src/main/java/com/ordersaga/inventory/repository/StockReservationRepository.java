package com.ordersaga.inventory.repository;

import com.ordersaga.inventory.entity.StockReservation;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface StockReservationRepository extends JpaRepository<StockReservation, UUID> {

    List<StockReservation> findByOrderId(String orderId);

    Optional<StockReservation> findByOrderIdAndProductId(String orderId, String productId);

    boolean existsByOrderId(String orderId);
}
