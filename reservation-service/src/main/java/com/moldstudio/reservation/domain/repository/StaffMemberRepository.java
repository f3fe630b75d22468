package com.moldstudio.reservation.domain.repository;

import com.moldstudio.reservation.domain.model.StaffMember;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface StaffMemberRepository extends JpaRepository<StaffMember, String> {
    boolean existsByName(String name);

    List<StaffMember> findAllByOrderByCreatedAtAsc();
}
