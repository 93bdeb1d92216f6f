package com.printshop_voice_backend.services.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.printshop_voice_backend.dto.quote.CreateQuoteRequest;
import com.printshop_voice_backend.dto.quote.QuoteSummary;
import com.printshop_voice_backend.services.QuoteService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class CreateQuoteTool implements VoiceTool {

    private final QuoteService quoteService;

    @Override
    public String getName() {
        return "create_quote";
    }

    @Override
    public String getDescription() {
        return "Create a draft quote for a customer once you know the products, quantities and decoration";
    }

    @Override
    public String getParameterSchema() {
        return """
            {"customer_name": string, "line_items": [{"product_name": string, "quantity": number, \
            "unit_price": number (optional, catalog price used when omitted), "item_number": string (optional), \
            "color": string (optional), "decoration": string (optional)}], \
            "imprints": [{"location": string, "method": string, "colors": number, "setup_fee": number, \
            "per_item_price": number}] (optional), "decoration_method": string (optional), "notes": string (optional)}""";
    }

    @Override
    public Map<String, Object> execute(ObjectNode params) {
        QuoteSummary summary = quoteService.createQuote(toRequest(params));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("quote_id", summary.getQuoteId());
        result.put("quote_number", summary.getQuoteNumber());
        result.put("customer", summary.getCustomerName());
        result.put("item_count", summary.getItemCount());
        result.put("subtotal", summary.getSubtotal());
        result.put("tax", summary.getTax());
        result.put("total", summary.getTotal());
        result.put("message", "Quote " + summary.getQuoteNumber() + " created for " + summary.getCustomerName());
        return result;
    }

    CreateQuoteRequest toRequest(JsonNode params) {
        CreateQuoteRequest request = CreateQuoteRequest.builder()
                .customerName(ToolParams.text(params, "customer_name"))
                .notes(ToolParams.text(params, "notes"))
                .decorationMethod(ToolParams.text(params, "decoration_method"))
                .build();

        JsonNode lineItems = params.path("line_items");
        if (lineItems.isArray()) {
            for (JsonNode item : lineItems) {
                request.getLineItems().add(CreateQuoteRequest.LineItemRequest.builder()
                        .productName(ToolParams.text(item, "product_name"))
                        .itemNumber(ToolParams.text(item, "item_number"))
                        .color(ToolParams.text(item, "color"))
                        .quantity(ToolParams.integer(item, "quantity"))
                        .unitPrice(ToolParams.decimal(item, "unit_price"))
                        .decoration(ToolParams.text(item, "decoration"))
                        .build());
            }
        }

        JsonNode imprints = params.path("imprints");
        if (imprints.isArray()) {
            for (JsonNode imprint : imprints) {
                request.getImprints().add(CreateQuoteRequest.ImprintRequest.builder()
                        .location(ToolParams.text(imprint, "location"))
                        .method(ToolParams.text(imprint, "method"))
                        .colors(ToolParams.integer(imprint, "colors"))
                        .setupFee(ToolParams.decimal(imprint, "setup_fee"))
                        .perItemPrice(ToolParams.decimal(imprint, "per_item_price"))
                        .build());
            }
        }

        return request;
    }
}
