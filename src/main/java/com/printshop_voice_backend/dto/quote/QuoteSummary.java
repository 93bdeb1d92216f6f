package com.printshop_voice_backend.dto.quote;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QuoteSummary {
    private Long quoteId;
    private String quoteNumber;
    private String customerName;
    private int itemCount;
    private BigDecimal subtotal;
    private BigDecimal tax;
    private BigDecimal total;
}
