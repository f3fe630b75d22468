package com.moldstudio.reservation.domain.repository;

import com.moldstudio.reservation.domain.model.StaffAccount;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface StaffAccountRepository extends JpaRepository<StaffAccount, String> {
    Optional<StaffAccount> findByUsername(String username);

    boolean existsByUsername(String username);

    List<StaffAccount> findAllByOrderByCreatedAtAsc();
}
