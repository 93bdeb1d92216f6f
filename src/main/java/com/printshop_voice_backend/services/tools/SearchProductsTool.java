package com.printshop_voice_backend.services.tools;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.printshop_voice_backend.exceptions.VoicePipelineExceptionHandler.ToolExecutionException;
import com.printshop_voice_backend.models.Product;
import com.printshop_voice_backend.services.QuoteService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class SearchProductsTool implements VoiceTool {

    private final QuoteService quoteService;

    @Override
    public String getName() {
        return "search_products";
    }

    @Override
    public String getDescription() {
        return "Search the product catalog by name, item number or brand";
    }

    @Override
    public String getParameterSchema() {
        return "{\"query\": string}";
    }

    @Override
    public Map<String, Object> execute(ObjectNode params) {
        String query = ToolParams.text(params, "query");
        if (query == null) {
            throw new ToolExecutionException("A search query is required", getName());
        }

        List<Map<String, Object>> products = quoteService.searchProducts(query).stream()
                .map(this::describe)
                .collect(Collectors.toList());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("count", products.size());
        result.put("products", products);
        return result;
    }

    private Map<String, Object> describe(Product product) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", product.getName());
        entry.put("item_number", product.getItemNumber());
        entry.put("brand", product.getBrand());
        entry.put("category", product.getCategory());
        entry.put("base_price", product.getBasePrice());
        return entry;
    }
}
