package com.printshop_voice_backend.dto.quote;

import com.printshop_voice_backend.models.Imprint;
import com.printshop_voice_backend.models.LineItem;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

@Data
@AllArgsConstructor
public class QuoteTotals {

    private BigDecimal subtotal;
    private BigDecimal tax;
    private BigDecimal total;

    public static QuoteTotals zero() {
        return new QuoteTotals(money(BigDecimal.ZERO), money(BigDecimal.ZERO), money(BigDecimal.ZERO));
    }

    /**
     * Adds one line item group: each item contributes quantity x unit price, each imprint
     * contributes its setup fee plus its per-piece price times the group's total quantity.
     */
    public QuoteTotals plusGroup(List<LineItem> items, List<Imprint> imprints, BigDecimal taxRate) {
        BigDecimal groupTotal = BigDecimal.ZERO;
        int groupQuantity = 0;

        for (LineItem item : items) {
            int quantity = item.getQuantity() != null ? item.getQuantity() : 0;
            groupQuantity += quantity;
            groupTotal = groupTotal.add(valueOrZero(item.getUnitPrice()).multiply(BigDecimal.valueOf(quantity)));
        }

        for (Imprint imprint : imprints) {
            groupTotal = groupTotal
                    .add(valueOrZero(imprint.getSetupFee()))
                    .add(valueOrZero(imprint.getUnitPrice()).multiply(BigDecimal.valueOf(groupQuantity)));
        }

        BigDecimal newSubtotal = money(subtotal.add(groupTotal));
        BigDecimal newTax = money(newSubtotal.multiply(taxRate));
        return new QuoteTotals(newSubtotal, newTax, money(newSubtotal.add(newTax)));
    }

    private static BigDecimal valueOrZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
