package com.printshop_voice_backend.dto.quote;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Quote requested through the voice assistant: one customer, one group of line items
 * and the imprints applied to that group.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateQuoteRequest {
    private String customerName;
    private String notes;
    private String decorationMethod;

    @Builder.Default
    private List<LineItemRequest> lineItems = new ArrayList<>();

    @Builder.Default
    private List<ImprintRequest> imprints = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class LineItemRequest {
        private String productName;
        private String itemNumber;
        private String color;
        private Integer quantity;
        private BigDecimal unitPrice; // Optional, falls back to the catalog price
        private String decoration;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class ImprintRequest {
        private String location;
        private String method;
        private Integer colors;
        private BigDecimal setupFee;
        private BigDecimal perItemPrice;
    }
}
