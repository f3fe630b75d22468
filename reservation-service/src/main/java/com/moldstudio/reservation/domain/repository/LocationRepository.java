package com.moldstudio.reservation.domain.repository;

import com.moldstudio.reservation.domain.model.Location;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LocationRepository extends JpaRepository<Location, String> {
    boolean existsByName(String name);

    List<Location> findAllByOrderByCreatedAtAsc();
}
