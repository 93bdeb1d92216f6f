package com.printshop_voice_backend.repositories;

import com.printshop_voice_backend.models.Product;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ProductRepository extends JpaRepository<Product, Long> {

    Optional<Product> findFirstByActiveTrueAndItemNumberIgnoreCase(String itemNumber);

    Optional<Product> findFirstByActiveTrueAndNameIgnoreCase(String name);

    // Voice assistant catalog search by name, item number or brand
    @Query("SELECT p FROM Product p WHERE p.active = true AND (" +
            "LOWER(p.name) LIKE LOWER(CONCAT('%', :query, '%')) OR " +
            "LOWER(p.itemNumber) LIKE LOWER(CONCAT('%', :query, '%')) OR " +
            "LOWER(p.brand) LIKE LOWER(CONCAT('%', :query, '%'))) " +
            "ORDER BY p.createdAt DESC")
    List<Product> searchActive(@Param("query") String query, Pageable pageable);
}
