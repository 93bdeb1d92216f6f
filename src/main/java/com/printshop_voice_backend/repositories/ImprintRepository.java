package com.printshop_voice_backend.repositories;

import com.printshop_voice_backend.models.Imprint;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ImprintRepository extends JpaRepository<Imprint, Long> {
    List<Imprint> findByGroupIdOrderBySortOrderAsc(Long groupId);
}
