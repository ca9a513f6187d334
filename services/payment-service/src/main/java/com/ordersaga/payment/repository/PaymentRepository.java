package com.ordersaga.payment.repository;

import com.ordersaga.payment.entity.Payment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PaymentRepository extends JpaRepository<Payment, String> {

    boolean existsByOrderId(String orderId);

    Optional<Payment> findByOrderId(String orderId);
}
