package com.printshop_voice_backend.repositories;

import com.printshop_voice_backend.models.LineItemGroup;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LineItemGroupRepository extends JpaRepository<LineItemGroup, Long> {
    List<LineItemGroup> findByQuoteIdOrderBySortOrderAsc(Long quoteId);
}
