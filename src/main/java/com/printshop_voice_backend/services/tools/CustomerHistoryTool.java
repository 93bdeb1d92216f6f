package com.printshop_voice_backend.services.tools;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.printshop_voice_backend.exceptions.VoicePipelineExceptionHandler.ToolExecutionException;
import com.printshop_voice_backend.models.Customer;
import com.printshop_voice_backend.models.Quote;
import com.printshop_voice_backend.services.QuoteService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class CustomerHistoryTool implements VoiceTool {

    private final QuoteService quoteService;

    @Override
    public String getName() {
        return "get_customer_history";
    }

    @Override
    public String getDescription() {
        return "Look up a customer's five most recent quotes";
    }

    @Override
    public String getParameterSchema() {
        return "{\"customer_name\": string}";
    }

    @Override
    public Map<String, Object> execute(ObjectNode params) {
        String customerName = ToolParams.text(params, "customer_name");
        if (customerName == null) {
            throw new ToolExecutionException("A customer name is required", getName());
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);

        Optional<Customer> customer = quoteService.findCustomer(customerName);
        if (customer.isEmpty()) {
            result.put("found", false);
            result.put("message", "No customer named " + customerName);
            return result;
        }

        List<Map<String, Object>> quotes = quoteService.recentQuotes(customer.get()).stream()
                .map(this::describe)
                .collect(Collectors.toList());

        result.put("found", true);
        result.put("customer", customer.get().getName());
        result.put("quotes", quotes);
        return result;
    }

    private Map<String, Object> describe(Quote quote) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("quote_number", QuoteService.formatQuoteNumber(quote.getQuoteNumber()));
        entry.put("status", quote.getStatus());
        entry.put("total", quote.getTotalAmount());
        entry.put("created_at", quote.getCreatedAt() != null ? quote.getCreatedAt().toString() : null);
        return entry;
    }
}
