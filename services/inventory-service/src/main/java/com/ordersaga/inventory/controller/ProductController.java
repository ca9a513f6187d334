package com.ordersaga.inventory.controller;

import com.ordersaga.inventory.dto.ProductResponse;
import com.ordersaga.inventory.repository.ProductRepository;
import jakarta.validation.constraints.Size;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/products")
public class ProductController {

    private final ProductRepository productRepository;

    public ProductController(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    @GetMapping("/{productId}")
    @Transactional(readOnly = true)
    public ResponseEntity<ProductResponse> getProduct(@PathVariable @Size(max = 64) String productId) {
        return productRepository.findById(productId)
                .map(ProductResponse::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Product not found"));
    }

    @GetMapping
    @Transactional(readOnly = true)
    public List<ProductResponse> listProducts() {
        return productRepository.findAll(Sort.by("productId")).stream()
                .map(ProductResponse::from)
                .toList();
    }
}
