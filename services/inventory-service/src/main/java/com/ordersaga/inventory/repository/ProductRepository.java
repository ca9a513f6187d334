package com.ordersaga.inventory.repository;

import com.ordersaga.inventory.entity.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface ProductRepository extends JpaRepository<Product, String> {

    /**
     * Reads stock and version straight from the database, bypassing any entity already loaded in
     * the persistence context.
     */
    @Query("""
            select new com.ordersaga.inventory.repository.StockSnapshot(p.productId, p.stock, p.version)
            from Product p where p.productId = :productId
            """)
    Optional<StockSnapshot> findStockSnapshot(@Param("productId") String productId);

    /**
     * Takes {@code quantity} units only if nobody changed the product since {@code expectedVersion}
     * was read.
     *
     * @return 1 if the row was updated, 0 on a version conflict
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Product p
            set p.stock = p.stock - :quantity, p.version = p.version + 1, p.updatedAt = :now
            where p.productId = :productId and p.version = :expectedVersion and p.stock >= :quantity
            """)
    int decrementStock(@Param("productId") String productId,
                       @Param("quantity") int quantity,
                       @Param("expectedVersion") long expectedVersion,
                       @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Product p
            set p.stock = p.stock + :quantity, p.version = p.version + 1, p.updatedAt = :now
            where p.productId = :productId
            """)
    int incrementStock(@Param("productId") String productId,
                       @Param("quantity") int quantity,
                       @Param("now") Instant now);
}
