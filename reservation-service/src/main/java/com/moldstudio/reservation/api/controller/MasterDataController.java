package com.moldstudio.reservation.api.controller;

import com.moldstudio.common.dto.BaseResponse;
import com.moldstudio.reservation.api.dto.MasterDataRequest;
import com.moldstudio.reservation.api.dto.MasterDataResponse;
import com.moldstudio.reservation.domain.service.MasterDataService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Staff names and studio locations offered on the reservation form.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class MasterDataController {

    private final MasterDataService masterDataService;

    @GetMapping("/staff")
    public ResponseEntity<BaseResponse<List<MasterDataResponse>>> listStaff() {
        return ResponseEntity.ok(BaseResponse.success(masterDataService.listStaff()));
    }

    @PostMapping("/staff")
    @PreAuthorize("hasRole('MANAGER')")
    public ResponseEntity<BaseResponse<MasterDataResponse>> createStaff(
            @Valid @RequestBody MasterDataRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Staff member created", masterDataService.createStaff(request)));
    }

    @DeleteMapping("/staff/{id}")
    @PreAuthorize("hasRole('MANAGER')")
    public ResponseEntity<BaseResponse<Void>> deleteStaff(@PathVariable String id) {
        masterDataService.deleteStaff(id);
        return ResponseEntity.ok(BaseResponse.success("Staff member deleted", null));
    }

    @GetMapping("/locations")
    public ResponseEntity<BaseResponse<List<MasterDataResponse>>> listLocations() {
        return ResponseEntity.ok(BaseResponse.success(masterDataService.listLocations()));
    }

    @PostMapping("/locations")
    @PreAuthorize("hasRole('MANAGER')")
    public ResponseEntity<BaseResponse<MasterDataResponse>> createLocation(
            @Valid @RequestBody MasterDataRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Location created", masterDataService.createLocation(request)));
    }

    @DeleteMapping("/locations/{id}")
    @PreAuthorize("hasRole('MANAGER')")
    public ResponseEntity<BaseResponse<Void>> deleteLocation(@PathVariable String id) {
        masterDataService.deleteLocation(id);
        return ResponseEntity.ok(BaseResponse.success("Location deleted", null));
    }
}
