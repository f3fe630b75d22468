package com.moldstudio.reservation.api.controller;

import com.moldstudio.common.dto.BaseResponse;
import com.moldstudio.reservation.api.dto.CustomerRequest;
import com.moldstudio.reservation.api.dto.CustomerResponse;
import com.moldstudio.reservation.api.dto.ReservationResponse;
import com.moldstudio.reservation.domain.service.CustomerRegistryService;
import com.moldstudio.reservation.domain.service.ReservationLifecycleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/customers")
@RequiredArgsConstructor
public class CustomerController {

    private final CustomerRegistryService customerRegistry;
    private final ReservationLifecycleService lifecycleService;

    @GetMapping
    public ResponseEntity<BaseResponse<List<CustomerResponse>>> listCustomers(
            @RequestParam(required = false) String search) {
        return ResponseEntity.ok(BaseResponse.success(customerRegistry.list(search)));
    }

    @GetMapping("/{customerId}")
    public ResponseEntity<BaseResponse<CustomerResponse>> getCustomer(@PathVariable String customerId) {
        return ResponseEntity.ok(BaseResponse.success(customerRegistry.get(customerId)));
    }

    @GetMapping("/{customerId}/reservations")
    public ResponseEntity<BaseResponse<List<ReservationResponse>>> getCustomerReservations(
            @PathVariable String customerId) {
        return ResponseEntity.ok(BaseResponse.success(lifecycleService.listByCustomer(customerId)));
    }

    @PostMapping
    public ResponseEntity<BaseResponse<CustomerResponse>> createCustomer(
            @Valid @RequestBody CustomerRequest request) {
        CustomerResponse response = customerRegistry.create(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Customer created successfully", response));
    }

    @PutMapping("/{customerId}")
    public ResponseEntity<BaseResponse<CustomerResponse>> updateCustomer(
            @PathVariable String customerId,
            @Valid @RequestBody CustomerRequest request) {
        CustomerResponse response = customerRegistry.update(customerId, request);
        return ResponseEntity.ok(BaseResponse.success("Customer updated successfully", response));
    }

    /**
     * Reservations referencing the customer are kept and show "customer unavailable".
     */
    @DeleteMapping("/{customerId}")
    public ResponseEntity<BaseResponse<Void>> deleteCustomer(@PathVariable String customerId) {
        customerRegistry.delete(customerId);
        return ResponseEntity.ok(BaseResponse.success("Customer deleted successfully", null));
    }
}
