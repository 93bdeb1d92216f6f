package com.printshop_voice_backend.models;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Decoration record for a line item group: one print location with its setup fee
 * and per-piece price.
 */
@Entity
@Table(name = "imprints")
@Data
@NoArgsConstructor
public class Imprint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "group_id")
    private LineItemGroup group;

    private String location;

    @Column(name = "decoration_method")
    private String decorationMethod;

    private Integer colors = 1;

    @Column(name = "setup_fee", precision = 10, scale = 2)
    private BigDecimal setupFee = BigDecimal.ZERO;

    @Column(name = "unit_price", precision = 10, scale = 2)
    private BigDecimal unitPrice = BigDecimal.ZERO;

    @Column(name = "sort_order")
    private Integer sortOrder = 0;
}
