package com.printshop_voice_backend.repositories;

import com.printshop_voice_backend.models.Customer;
import com.printshop_voice_backend.models.Quote;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface QuoteRepository extends JpaRepository<Quote, Long> {

    @Query("SELECT COALESCE(MAX(q.quoteNumber), 0) FROM Quote q")
    Integer findMaxQuoteNumber();

    List<Quote> findTop5ByCustomerOrderByCreatedAtDesc(Customer customer);
}
