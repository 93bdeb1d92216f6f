package com.printshop_voice_backend.models;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Entity
@Table(name = "line_items")
@Data
@NoArgsConstructor
public class LineItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "group_id")
    private LineItemGroup group;

    @Column(name = "item_number")
    private String itemNumber;

    private String description;

    private String color;

    private Integer quantity = 0;

    @Column(name = "unit_price", precision = 10, scale = 2)
    private BigDecimal unitPrice = BigDecimal.ZERO;

    private String decoration;

    @Column(name = "sort_order")
    private Integer sortOrder = 0;
}
