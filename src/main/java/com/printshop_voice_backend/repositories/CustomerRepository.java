package com.printshop_voice_backend.repositories;

import com.printshop_voice_backend.models.Customer;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CustomerRepository extends JpaRepository<Customer, Long> {
    Optional<Customer> findFirstByName(String name);
}
