package com.ordersaga.order;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = {"com.ordersaga.order", "com.ordersaga.messaging"})
@EntityScan(basePackages = {"com.ordersaga.order", "com.ordersaga.messaging"})
@EnableJpaRepositories(basePackages = {"com.ordersaga.order", "com.ordersaga.messaging"})
@EnableScheduling
public class OrderServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderServiceApplication.class, args);
    }
}
