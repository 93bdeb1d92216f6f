package com.printshop_voice_backend.services;

import com.printshop_voice_backend.dto.quote.CreateQuoteRequest;
import com.printshop_voice_backend.dto.quote.CreateQuoteRequest.ImprintRequest;
import com.printshop_voice_backend.dto.quote.CreateQuoteRequest.LineItemRequest;
import com.printshop_voice_backend.dto.quote.QuoteSummary;
import com.printshop_voice_backend.dto.quote.QuoteTotals;
import com.printshop_voice_backend.exceptions.VoicePipelineExceptionHandler.ToolExecutionException;
import com.printshop_voice_backend.models.Customer;
import com.printshop_voice_backend.models.Imprint;
import com.printshop_voice_backend.models.LineItem;
import com.printshop_voice_backend.models.LineItemGroup;
import com.printshop_voice_backend.models.Product;
import com.printshop_voice_backend.models.Quote;
import com.printshop_voice_backend.models.QuoteStatus;
import com.printshop_voice_backend.repositories.CustomerRepository;
import com.printshop_voice_backend.repositories.ImprintRepository;
import com.printshop_voice_backend.repositories.LineItemGroupRepository;
import com.printshop_voice_backend.repositories.LineItemRepository;
import com.printshop_voice_backend.repositories.ProductRepository;
import com.printshop_voice_backend.repositories.QuoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Business operations the voice assistant's tools call into.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuoteService {

    public static final BigDecimal TAX_RATE = new BigDecimal("0.08");
    public static final String DEFAULT_GROUP_NAME = "Main Items";
    private static final int MAX_SEARCH_RESULTS = 10;

    private final CustomerRepository customerRepository;
    private final ProductRepository productRepository;
    private final QuoteRepository quoteRepository;
    private final LineItemGroupRepository lineItemGroupRepository;
    private final LineItemRepository lineItemRepository;
    private final ImprintRepository imprintRepository;

    /**
     * Create a draft quote with a single line item group, pricing items from the catalog
     * where the caller gave no usable price.
     */
    @Transactional
    public QuoteSummary createQuote(CreateQuoteRequest request) {
        validateRequest(request);

        Customer customer = findOrCreateCustomer(request.getCustomerName().trim());

        Quote quote = new Quote();
        quote.setQuoteNumber(nextQuoteNumber());
        quote.setCustomer(customer);
        quote.setStatus(QuoteStatus.DRAFT);
        quote.setNotes(request.getNotes());
        quote.setCreatedAt(LocalDateTime.now());
        quote.setUpdatedAt(LocalDateTime.now());
        quote = quoteRepository.save(quote);

        LineItemGroup group = new LineItemGroup();
        group.setQuote(quote);
        group.setName(DEFAULT_GROUP_NAME);
        group.setDecorationMethod(request.getDecorationMethod());
        group.setSortOrder(0);
        group = lineItemGroupRepository.save(group);

        List<LineItem> items = new ArrayList<>();
        int sortOrder = 0;
        for (LineItemRequest itemRequest : request.getLineItems()) {
            LineItem item = new LineItem();
            item.setGroup(group);
            item.setDescription(itemRequest.getProductName());
            item.setItemNumber(itemRequest.getItemNumber());
            item.setColor(itemRequest.getColor());
            item.setQuantity(itemRequest.getQuantity());
            item.setUnitPrice(resolveUnitPrice(itemRequest));
            item.setDecoration(itemRequest.getDecoration());
            item.setSortOrder(sortOrder++);
            items.add(lineItemRepository.save(item));
        }

        List<Imprint> imprints = new ArrayList<>();
        sortOrder = 0;
        for (ImprintRequest imprintRequest : request.getImprints()) {
            Imprint imprint = new Imprint();
            imprint.setGroup(group);
            imprint.setLocation(imprintRequest.getLocation());
            imprint.setDecorationMethod(imprintRequest.getMethod() != null
                    ? imprintRequest.getMethod() : request.getDecorationMethod());
            imprint.setColors(imprintRequest.getColors() != null ? imprintRequest.getColors() : 1);
            imprint.setSetupFee(nonNegative(imprintRequest.getSetupFee()));
            imprint.setUnitPrice(nonNegative(imprintRequest.getPerItemPrice()));
            imprint.setSortOrder(sortOrder++);
            imprints.add(imprintRepository.save(imprint));
        }

        QuoteTotals totals = QuoteTotals.zero().plusGroup(items, imprints, TAX_RATE);
        applyTotals(quote, totals);
        quote = quoteRepository.save(quote);

        log.info("Created quote {} for customer '{}' with {} line items, total {}",
                formatQuoteNumber(quote.getQuoteNumber()), customer.getName(), items.size(), totals.getTotal());

        return QuoteSummary.builder()
                .quoteId(quote.getId())
                .quoteNumber(formatQuoteNumber(quote.getQuoteNumber()))
                .customerName(customer.getName())
                .itemCount(items.size())
                .subtotal(totals.getSubtotal())
                .tax(totals.getTax())
                .total(totals.getTotal())
                .build();
    }

    /**
     * Recompute subtotal, tax and total of a stored quote from its groups.
     */
    @Transactional
    public QuoteTotals recalculateQuoteTotal(Long quoteId) {
        Quote quote = quoteRepository.findById(quoteId)
                .orElseThrow(() -> new IllegalArgumentException("Quote not found: " + quoteId));

        QuoteTotals totals = QuoteTotals.zero();
        for (LineItemGroup group : lineItemGroupRepository.findByQuoteIdOrderBySortOrderAsc(quoteId)) {
            totals = totals.plusGroup(
                    lineItemRepository.findByGroupIdOrderBySortOrderAsc(group.getId()),
                    imprintRepository.findByGroupIdOrderBySortOrderAsc(group.getId()),
                    TAX_RATE);
        }

        applyTotals(quote, totals);
        quoteRepository.save(quote);
        return totals;
    }

    @Transactional
    public Customer findOrCreateCustomer(String name) {
        return customerRepository.findFirstByName(name).orElseGet(() -> {
            Customer customer = new Customer();
            customer.setName(name);
            customer.setEmail(emailSlug(name) + "@example.com");
            customer.setCreatedAt(LocalDateTime.now());
            log.info("Creating customer '{}' from voice quote request", name);
            return customerRepository.save(customer);
        });
    }

    public int nextQuoteNumber() {
        Integer max = quoteRepository.findMaxQuoteNumber();
        return (max != null ? max : 0) + 1;
    }

    public List<Product> searchProducts(String query) {
        return productRepository.searchActive(query.trim(), PageRequest.of(0, MAX_SEARCH_RESULTS));
    }

    public Optional<Customer> findCustomer(String name) {
        return customerRepository.findFirstByName(name.trim());
    }

    public List<Quote> recentQuotes(Customer customer) {
        return quoteRepository.findTop5ByCustomerOrderByCreatedAtDesc(customer);
    }

    public static String formatQuoteNumber(Integer quoteNumber) {
        return String.format("Q-%05d", quoteNumber);
    }

    private void validateRequest(CreateQuoteRequest request) {
        if (request.getCustomerName() == null || request.getCustomerName().isBlank()) {
            throw new ToolExecutionException("Customer name is required", "create_quote");
        }
        if (request.getLineItems() == null || request.getLineItems().isEmpty()) {
            throw new ToolExecutionException("At least one line item is required", "create_quote");
        }
        for (LineItemRequest item : request.getLineItems()) {
            if (item.getProductName() == null || item.getProductName().isBlank()) {
                throw new ToolExecutionException("Each line item needs a product name", "create_quote");
            }
            if (item.getQuantity() == null || item.getQuantity() <= 0) {
                throw new ToolExecutionException(
                        "Quantity for " + item.getProductName() + " must be positive", "create_quote");
            }
        }
    }

    private BigDecimal resolveUnitPrice(LineItemRequest item) {
        if (item.getUnitPrice() != null && item.getUnitPrice().signum() > 0) {
            return item.getUnitPrice();
        }

        Optional<Product> product = Optional.empty();
        if (item.getItemNumber() != null && !item.getItemNumber().isBlank()) {
            product = productRepository.findFirstByActiveTrueAndItemNumberIgnoreCase(item.getItemNumber().trim());
        }
        if (product.isEmpty()) {
            product = productRepository.findFirstByActiveTrueAndNameIgnoreCase(item.getProductName().trim());
        }

        return product
                .map(Product::getBasePrice)
                .filter(price -> price != null && price.signum() > 0)
                .orElseThrow(() -> new ToolExecutionException(
                        "No price given and no catalog price found for " + item.getProductName(), "create_quote"));
    }

    private void applyTotals(Quote quote, QuoteTotals totals) {
        quote.setSubtotal(totals.getSubtotal());
        quote.setTax(totals.getTax());
        quote.setTotalAmount(totals.getTotal());
        quote.setUpdatedAt(LocalDateTime.now());
    }

    private static BigDecimal nonNegative(BigDecimal value) {
        return value != null && value.signum() > 0 ? value : BigDecimal.ZERO;
    }

    private static String emailSlug(String name) {
        String slug = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", ".").replaceAll("^\\.|\\.$", "");
        return slug.isEmpty() ? "customer" : slug;
    }
}
