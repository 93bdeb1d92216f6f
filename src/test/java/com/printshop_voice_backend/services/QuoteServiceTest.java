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
import com.printshop_voice_backend.repositories.CustomerRepository;
import com.printshop_voice_backend.repositories.ImprintRepository;
import com.printshop_voice_backend.repositories.LineItemGroupRepository;
import com.printshop_voice_backend.repositories.LineItemRepository;
import com.printshop_voice_backend.repositories.ProductRepository;
import com.printshop_voice_backend.repositories.QuoteRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QuoteServiceTest {

    @Mock
    private CustomerRepository customerRepository;
    @Mock
    private ProductRepository productRepository;
    @Mock
    private QuoteRepository quoteRepository;
    @Mock
    private LineItemGroupRepository lineItemGroupRepository;
    @Mock
    private LineItemRepository lineItemRepository;
    @Mock
    private ImprintRepository imprintRepository;

    private QuoteService quoteService;

    @BeforeEach
    void setUp() {
        quoteService = new QuoteService(customerRepository, productRepository, quoteRepository,
                lineItemGroupRepository, lineItemRepository, imprintRepository);

        lenient().when(customerRepository.save(any(Customer.class))).thenAnswer(inv -> {
            Customer customer = inv.getArgument(0);
            customer.setId(7L);
            return customer;
        });
        lenient().when(quoteRepository.save(any(Quote.class))).thenAnswer(inv -> {
            Quote quote = inv.getArgument(0);
            if (quote.getId() == null) {
                quote.setId(100L);
            }
            return quote;
        });
        lenient().when(lineItemGroupRepository.save(any(LineItemGroup.class))).thenAnswer(inv -> {
            LineItemGroup group = inv.getArgument(0);
            group.setId(10L);
            return group;
        });
        lenient().when(lineItemRepository.save(any(LineItem.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(imprintRepository.save(any(Imprint.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void createsQuoteWithTotalsIncludingImprintsAndTax() {
        when(customerRepository.findFirstByName("Acme Sports")).thenReturn(Optional.empty());
        when(quoteRepository.findMaxQuoteNumber()).thenReturn(41);

        CreateQuoteRequest request = CreateQuoteRequest.builder()
                .customerName("Acme Sports")
                .lineItems(List.of(
                        LineItemRequest.builder().productName("Gildan 5000").quantity(24)
                                .unitPrice(new BigDecimal("5.00")).build(),
                        LineItemRequest.builder().productName("Bella 3001").quantity(12)
                                .unitPrice(new BigDecimal("6.50")).build()))
                .imprints(List.of(
                        ImprintRequest.builder().location("Front").method("screen print").colors(2)
                                .setupFee(new BigDecimal("30.00")).perItemPrice(new BigDecimal("1.50")).build()))
                .build();

        QuoteSummary summary = quoteService.createQuote(request);

        assertThat(summary.getQuoteNumber()).isEqualTo("Q-00042");
        assertThat(summary.getCustomerName()).isEqualTo("Acme Sports");
        assertThat(summary.getItemCount()).isEqualTo(2);
        assertThat(summary.getSubtotal()).isEqualByComparingTo("282.00");
        assertThat(summary.getTax()).isEqualByComparingTo("22.56");
        assertThat(summary.getTotal()).isEqualByComparingTo("304.56");

        ArgumentCaptor<Customer> customer = ArgumentCaptor.forClass(Customer.class);
        verify(customerRepository).save(customer.capture());
        assertThat(customer.getValue().getEmail()).isEqualTo("acme.sports@example.com");
    }

    @Test
    void usesCatalogPriceWhenNoPriceGiven() {
        Customer existing = new Customer();
        existing.setId(3L);
        existing.setName("Bob");
        when(customerRepository.findFirstByName("Bob")).thenReturn(Optional.of(existing));
        when(quoteRepository.findMaxQuoteNumber()).thenReturn(0);

        Product hoodie = new Product();
        hoodie.setName("Hoodie");
        hoodie.setBasePrice(new BigDecimal("18.00"));
        when(productRepository.findFirstByActiveTrueAndNameIgnoreCase("Hoodie")).thenReturn(Optional.of(hoodie));

        QuoteSummary summary = quoteService.createQuote(CreateQuoteRequest.builder()
                .customerName("Bob")
                .lineItems(List.of(LineItemRequest.builder().productName("Hoodie").quantity(10)
                        .unitPrice(BigDecimal.ZERO).build()))
                .build());

        assertThat(summary.getQuoteNumber()).isEqualTo("Q-00001");
        assertThat(summary.getSubtotal()).isEqualByComparingTo("180.00");
        verify(customerRepository, never()).save(any(Customer.class));
    }

    @Test
    void rejectsUnknownProductWithoutPrice() {
        when(customerRepository.findFirstByName("Bob")).thenReturn(Optional.empty());
        when(quoteRepository.findMaxQuoteNumber()).thenReturn(5);
        when(productRepository.findFirstByActiveTrueAndNameIgnoreCase("Mystery Shirt")).thenReturn(Optional.empty());

        CreateQuoteRequest request = CreateQuoteRequest.builder()
                .customerName("Bob")
                .lineItems(List.of(LineItemRequest.builder().productName("Mystery Shirt").quantity(5).build()))
                .build();

        assertThatThrownBy(() -> quoteService.createQuote(request))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("Mystery Shirt");
    }

    @Test
    void rejectsMissingCustomerAndEmptyItems() {
        assertThatThrownBy(() -> quoteService.createQuote(CreateQuoteRequest.builder()
                .lineItems(List.of(LineItemRequest.builder().productName("Tee").quantity(1).build()))
                .build()))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("Customer name");

        assertThatThrownBy(() -> quoteService.createQuote(CreateQuoteRequest.builder().customerName("Bob").build()))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("line item");
    }

    @Test
    void rejectsNonPositiveQuantity() {
        CreateQuoteRequest request = CreateQuoteRequest.builder()
                .customerName("Bob")
                .lineItems(List.of(LineItemRequest.builder().productName("Tee").quantity(0)
                        .unitPrice(BigDecimal.TEN).build()))
                .build();

        assertThatThrownBy(() -> quoteService.createQuote(request))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("must be positive");
    }

    @Test
    void nextQuoteNumberStartsAtOne() {
        when(quoteRepository.findMaxQuoteNumber()).thenReturn(null);

        assertThat(quoteService.nextQuoteNumber()).isEqualTo(1);
    }

    @Test
    void recalculatesStoredQuoteAcrossGroups() {
        Quote quote = new Quote();
        quote.setId(100L);
        when(quoteRepository.findById(100L)).thenReturn(Optional.of(quote));

        LineItemGroup front = new LineItemGroup();
        front.setId(1L);
        LineItemGroup back = new LineItemGroup();
        back.setId(2L);
        when(lineItemGroupRepository.findByQuoteIdOrderBySortOrderAsc(100L)).thenReturn(List.of(front, back));

        when(lineItemRepository.findByGroupIdOrderBySortOrderAsc(1L)).thenReturn(List.of(item(10, "4.00")));
        when(imprintRepository.findByGroupIdOrderBySortOrderAsc(1L)).thenReturn(List.of(imprint("25.00", "1.00")));
        when(lineItemRepository.findByGroupIdOrderBySortOrderAsc(2L)).thenReturn(List.of(item(5, "10.00")));
        when(imprintRepository.findByGroupIdOrderBySortOrderAsc(2L)).thenReturn(List.of());

        QuoteTotals totals = quoteService.recalculateQuoteTotal(100L);

        // (10 * 4 + 25 + 1 * 10) + (5 * 10) = 125
        assertThat(totals.getSubtotal()).isEqualByComparingTo("125.00");
        assertThat(totals.getTax()).isEqualByComparingTo("10.00");
        assertThat(quote.getTotalAmount()).isEqualByComparingTo("135.00");
    }

    @Test
    void formatsQuoteNumbers() {
        assertThat(QuoteService.formatQuoteNumber(42)).isEqualTo("Q-00042");
        assertThat(QuoteService.formatQuoteNumber(123456)).isEqualTo("Q-123456");
    }

    private static LineItem item(int quantity, String unitPrice) {
        LineItem item = new LineItem();
        item.setQuantity(quantity);
        item.setUnitPrice(new BigDecimal(unitPrice));
        return item;
    }

    private static Imprint imprint(String setupFee, String perItem) {
        Imprint imprint = new Imprint();
        imprint.setSetupFee(new BigDecimal(setupFee));
        imprint.setUnitPrice(new BigDecimal(perItem));
        return imprint;
    }
}
