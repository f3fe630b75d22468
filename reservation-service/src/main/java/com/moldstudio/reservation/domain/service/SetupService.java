package com.moldstudio.reservation.domain.service;

import com.moldstudio.common.util.Constants;
import com.moldstudio.common.util.IdGenerator;
import com.moldstudio.reservation.api.dto.SetupResponse;
import com.moldstudio.reservation.domain.model.Location;
import com.moldstudio.reservation.domain.model.StaffAccount;
import com.moldstudio.reservation.domain.model.StaffMember;
import com.moldstudio.reservation.domain.repository.LocationRepository;
import com.moldstudio.reservation.domain.repository.StaffAccountRepository;
import com.moldstudio.reservation.domain.repository.StaffMemberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * First-run bootstrap: seeds the manager account and sample master data into an empty store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SetupService {

    static final String MANAGER_USERNAME = "manager";
    static final List<String> DEFAULT_LOCATIONS = List.of("東京本店", "横浜店", "大阪店");
    static final List<String> DEFAULT_STAFF = List.of("佐藤", "鈴木", "高橋");

    private final StaffAccountRepository staffAccountRepository;
    private final StaffMemberRepository staffMemberRepository;
    private final LocationRepository locationRepository;
    private final PasswordEncoder passwordEncoder;

    @Value("${studio.setup.default-manager-password:ChangeMe123!}")
    private String defaultManagerPassword;

    /**
     * Does nothing once any account exists.
     */
    @Transactional
    public SetupResponse setup() {
        if (staffAccountRepository.count() > 0) {
            log.info("Setup skipped: accounts already exist");
            return SetupResponse.skippedSetup();
        }

        staffAccountRepository.save(StaffAccount.builder()
                .id(MANAGER_USERNAME)
                .username(MANAGER_USERNAME)
                .passwordHash(passwordEncoder.encode(defaultManagerPassword))
                .name("管理者")
                .role(StaffAccount.Role.MANAGER)
                .requirePasswordChange(true)
                .build());

        int locations = 0;
        for (String name : DEFAULT_LOCATIONS) {
            if (!locationRepository.existsByName(name)) {
                locationRepository.save(Location.builder()
                        .id(IdGenerator.newId(Constants.MASTER_ID_PREFIX))
                        .name(name)
                        .build());
                locations++;
            }
        }

        int staff = 0;
        for (String name : DEFAULT_STAFF) {
            if (!staffMemberRepository.existsByName(name)) {
                staffMemberRepository.save(StaffMember.builder()
                        .id(IdGenerator.newId(Constants.MASTER_ID_PREFIX))
                        .name(name)
                        .build());
                staff++;
            }
        }

        log.info("Setup completed: manager account, {} locations, {} staff members", locations, staff);
        return new SetupResponse(false, 1, locations, staff);
    }
}
