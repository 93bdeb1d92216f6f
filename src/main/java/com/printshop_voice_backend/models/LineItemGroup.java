package com.printshop_voice_backend.models;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Set of line items decorated the same way; imprints apply to every piece in the group.
 */
@Entity
@Table(name = "line_item_groups")
@Data
@NoArgsConstructor
public class LineItemGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "quote_id")
    private Quote quote;

    private String name;

    @Column(name = "decoration_method")
    private String decorationMethod;

    @Column(name = "sort_order")
    private Integer sortOrder = 0;
}
