package com.moldstudio.reservation.domain.service;

import com.moldstudio.common.exception.ConflictException;
import com.moldstudio.common.exception.ResourceNotFoundException;
import com.moldstudio.common.util.Constants;
import com.moldstudio.common.util.IdGenerator;
import com.moldstudio.reservation.api.dto.MasterDataRequest;
import com.moldstudio.reservation.api.dto.MasterDataResponse;
import com.moldstudio.reservation.domain.model.Location;
import com.moldstudio.reservation.domain.model.StaffMember;
import com.moldstudio.reservation.domain.repository.LocationRepository;
import com.moldstudio.reservation.domain.repository.StaffMemberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Staff and location lists. Removing an entry leaves existing reservations and the ledger untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MasterDataService {

    private final StaffMemberRepository staffMemberRepository;
    private final LocationRepository locationRepository;

    @Transactional(readOnly = true)
    public List<MasterDataResponse> listStaff() {
        return staffMemberRepository.findAllByOrderByCreatedAtAsc().stream()
                .map(MasterDataResponse::from)
                .toList();
    }

    @Transactional
    public MasterDataResponse createStaff(MasterDataRequest request) {
        String name = request.name().trim();
        if (staffMemberRepository.existsByName(name)) {
            throw new ConflictException("Staff member", name);
        }
        StaffMember saved = staffMemberRepository.save(StaffMember.builder()
                .id(resolveId(request))
                .name(name)
                .build());
        log.info("Created staff member {} ({})", saved.getName(), saved.getId());
        return MasterDataResponse.from(saved);
    }

    @Transactional
    public void deleteStaff(String id) {
        StaffMember staffMember = staffMemberRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Staff member", id));
        staffMemberRepository.delete(staffMember);
        log.info("Deleted staff member {}", id);
    }

    @Transactional(readOnly = true)
    public List<MasterDataResponse> listLocations() {
        return locationRepository.findAllByOrderByCreatedAtAsc().stream()
                .map(MasterDataResponse::from)
                .toList();
    }

    @Transactional
    public MasterDataResponse createLocation(MasterDataRequest request) {
        String name = request.name().trim();
        if (locationRepository.existsByName(name)) {
            throw new ConflictException("Location", name);
        }
        Location saved = locationRepository.save(Location.builder()
                .id(resolveId(request))
                .name(name)
                .build());
        log.info("Created location {} ({})", saved.getName(), saved.getId());
        return MasterDataResponse.from(saved);
    }

    @Transactional
    public void deleteLocation(String id) {
        Location location = locationRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Location", id));
        locationRepository.delete(location);
        log.info("Deleted location {}", id);
    }

    private String resolveId(MasterDataRequest request) {
        return StringUtils.hasText(request.id())
                ? request.id().trim()
                : IdGenerator.newId(Constants.MASTER_ID_PREFIX);
    }
}
