package com.moldstudio.reservation.domain.service;

import com.moldstudio.common.exception.ConflictException;
import com.moldstudio.common.exception.ResourceNotFoundException;
import com.moldstudio.common.util.Constants;
import com.moldstudio.common.util.IdGenerator;
import com.moldstudio.reservation.api.dto.CustomerRequest;
import com.moldstudio.reservation.api.dto.CustomerResponse;
import com.moldstudio.reservation.domain.model.Customer;
import com.moldstudio.reservation.domain.model.CustomerFields;
import com.moldstudio.reservation.domain.repository.CustomerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Customer registry: one record per customerId, updated by per-field merge.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CustomerRegistryService {

    private final CustomerRepository customerRepository;

    /**
     * Creates the record if absent, otherwise overwrites only the fields present in {@code fields}.
     * The row is locked for the rest of the caller's transaction.
     */
    @Transactional
    public Customer upsert(String customerId, CustomerFields fields) {
        Optional<Customer> existing = customerRepository.findByIdForUpdate(customerId);
        if (existing.isPresent()) {
            Customer customer = existing.get();
            if (customer.merge(fields)) {
                log.debug("Merged fields into customer {}", customerId);
            }
            return customer;
        }
        Customer created = customerRepository.save(Customer.newCustomer(customerId, fields));
        log.info("Created customer {}", customerId);
        return created;
    }

    /**
     * Creates the record only if no record exists for {@code customerId}.
     *
     * @return true if a record was created
     */
    @Transactional
    public boolean createIfAbsent(String customerId, CustomerFields fields) {
        if (customerRepository.existsById(customerId)) {
            return false;
        }
        customerRepository.save(Customer.newCustomer(customerId, fields));
        return true;
    }

    @Transactional
    public CustomerResponse create(CustomerRequest request) {
        String customerId = StringUtils.hasText(request.customerId())
                ? request.customerId().trim()
                : IdGenerator.newId(Constants.CUSTOMER_ID_PREFIX);
        if (customerRepository.existsById(customerId)) {
            throw new ConflictException("Customer", customerId);
        }
        Customer customer = customerRepository.save(Customer.newCustomer(customerId, request.toFields()));
        log.info("Created customer {}", customerId);
        return CustomerResponse.from(customer);
    }

    @Transactional
    public CustomerResponse update(String customerId, CustomerRequest request) {
        Customer customer = customerRepository.findByIdForUpdate(customerId)
                .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
        customer.merge(request.toFields());
        Customer saved = customerRepository.saveAndFlush(customer);
        log.info("Updated customer {}", customerId);
        return CustomerResponse.from(saved);
    }

    /**
     * Removes the record. Reservations referencing it are left as they are.
     */
    @Transactional
    public void delete(String customerId) {
        Customer customer = customerRepository.findById(customerId)
                .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
        customerRepository.delete(customer);
        log.info("Deleted customer {}", customerId);
    }

    @Transactional(readOnly = true)
    public CustomerResponse get(String customerId) {
        return customerRepository.findById(customerId)
                .map(CustomerResponse::from)
                .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
    }

    @Transactional(readOnly = true)
    public Optional<Customer> find(String customerId) {
        if (!StringUtils.hasText(customerId)) {
            return Optional.empty();
        }
        return customerRepository.findById(customerId);
    }

    @Transactional(readOnly = true)
    public List<CustomerResponse> list(String search) {
        List<Customer> customers = StringUtils.hasText(search)
                ? customerRepository.search(search.trim())
                : customerRepository.findAllByOrderByCreatedAtDesc();
        return customers.stream().map(CustomerResponse::from).toList();
    }

    @Transactional(readOnly = true)
    public Map<String, Customer> findAllById(Collection<String> customerIds) {
        return customerRepository.findAllById(customerIds).stream()
                .collect(Collectors.toMap(Customer::getCustomerId, Function.identity()));
    }
}
