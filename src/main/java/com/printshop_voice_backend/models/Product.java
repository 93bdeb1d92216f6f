package com.printshop_voice_backend.models;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Catalog entry (blank garment or promotional item) with its base price.
 */
@Entity
@Table(name = "products")
@Data
@NoArgsConstructor
public class Product {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "item_number")
    private String itemNumber;

    private String brand;

    private String category;

    @Column(name = "base_price", precision = 10, scale = 2)
    private BigDecimal basePrice;

    private Boolean active = true;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
