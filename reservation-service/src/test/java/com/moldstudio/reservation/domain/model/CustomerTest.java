package com.moldstudio.reservation.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CustomerTest {

    private static CustomerFields phone(String phoneNumber) {
        return new CustomerFields(null, null, null, null, phoneNumber, null, null, null, null, null);
    }

    private static CustomerFields note(String note) {
        return new CustomerFields(null, null, null, null, null, null, null, note, null, null);
    }

    @Test
    @DisplayName("new customer gets defaults for every omitted field")
    void newCustomer_appliesDefaults() {
        Customer customer = Customer.newCustomer("CUST1",
                CustomerFields.personal("山田花子", null, null, null, null, null, null));

        assertThat(customer.getParentName()).isEqualTo("山田花子");
        assertThat(customer.getChildName()).isEmpty();
        assertThat(customer.getAge()).isZero();
        assertThat(customer.getAgeMonths()).isZero();
        assertThat(customer.getNote()).isEmpty();
        assertThat(customer.getPaymentStatus()).isEqualTo(PaymentStatus.UNPAID);
        assertThat(customer.getReservationStatus()).isEqualTo(CustomerReservationStatus.NONE);
    }

    @Test
    @DisplayName("merging fields one call at a time equals merging them together")
    void merge_isPerFieldAndOrderIndependent() {
        Customer stepwise = Customer.newCustomer("CUST1", CustomerFields.personal("山田花子", "太郎", 0, 6, null, null, null));
        Customer together = Customer.newCustomer("CUST1", CustomerFields.personal("山田花子", "太郎", 0, 6, null, null, null));

        stepwise.merge(phone("090-1234-5678"));
        stepwise.merge(note("x"));
        together.merge(new CustomerFields(null, null, null, null, "090-1234-5678", null, null, "x", null, null));

        assertThat(stepwise).usingRecursiveComparison().isEqualTo(together);
        assertThat(stepwise.getChildName()).isEqualTo("太郎");
        assertThat(stepwise.getAgeMonths()).isEqualTo(6);
    }

    @Test
    @DisplayName("merging an empty field set changes nothing")
    void merge_emptyFields_isNoOp() {
        Customer customer = Customer.newCustomer("CUST1", CustomerFields.personal("山田花子", null, 1, 0, null, null, null));

        boolean changed = customer.merge(CustomerFields.empty());

        assertThat(changed).isFalse();
        assertThat(customer.getParentName()).isEqualTo("山田花子");
        assertThat(customer.getAge()).isEqualTo(1);
    }

    @Test
    @DisplayName("age in months uses months only for infants under one year")
    void ageInMonths() {
        Customer infant = Customer.newCustomer("C1", CustomerFields.personal("A", null, 0, 7, null, null, null));
        Customer toddler = Customer.newCustomer("C2", CustomerFields.personal("B", null, 2, 7, null, null, null));

        assertThat(infant.getAgeInMonths()).isEqualTo(7);
        assertThat(toddler.getAgeInMonths()).isEqualTo(24);
    }
}
