package com.printshop_voice_backend.repositories;

import com.printshop_voice_backend.models.LineItem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LineItemRepository extends JpaRepository<LineItem, Long> {
    List<LineItem> findByGroupIdOrderBySortOrderAsc(Long groupId);
}
