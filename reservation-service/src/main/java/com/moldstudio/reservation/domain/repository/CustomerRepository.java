package com.moldstudio.reservation.domain.repository;

import com.moldstudio.reservation.domain.model.Customer;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface CustomerRepository extends JpaRepository<Customer, String> {

    /**
     * Find customer with pessimistic lock (SELECT FOR UPDATE), used by upsert so that
     * two merges into the same record are applied one after the other.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Customer c WHERE c.customerId = :customerId")
    Optional<Customer> findByIdForUpdate(@Param("customerId") String customerId);

    List<Customer> findAllByOrderByCreatedAtDesc();

    @Query("""
           SELECT c FROM Customer c
           WHERE LOWER(c.customerId) LIKE LOWER(CONCAT('%', :term, '%'))
              OR LOWER(c.parentName) LIKE LOWER(CONCAT('%', :term, '%'))
              OR LOWER(c.childName) LIKE LOWER(CONCAT('%', :term, '%'))
              OR c.phoneNumber LIKE CONCAT('%', :term, '%')
           ORDER BY c.createdAt DESC
           """)
    List<Customer> search(@Param("term") String term);
}
