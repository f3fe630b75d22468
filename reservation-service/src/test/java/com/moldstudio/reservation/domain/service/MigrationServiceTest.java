package com.moldstudio.reservation.domain.service;

import com.moldstudio.common.exception.InvalidInputException;
import com.moldstudio.reservation.api.dto.MigrationReport;
import com.moldstudio.reservation.domain.model.Customer;
import com.moldstudio.reservation.domain.model.CustomerFields;
import com.moldstudio.reservation.domain.model.LegacyPersonalInfo;
import com.moldstudio.reservation.domain.model.Reservation;
import com.moldstudio.reservation.domain.model.ReservationInput;
import com.moldstudio.reservation.domain.repository.CustomerRepository;
import com.moldstudio.reservation.domain.repository.ReservationRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Each reservation is migrated in its own transaction, so the test itself runs without one
 * and cleans up after every case.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({MigrationService.class, LegacyReservationMigrator.class, CustomerRegistryService.class,
        ReservationRecordService.class})
class MigrationServiceTest {

    @Autowired
    private MigrationService migrationService;

    @Autowired
    private ReservationRecordService reservationRecords;

    @Autowired
    private ReservationRepository reservationRepository;

    @Autowired
    private CustomerRepository customerRepository;

    @BeforeEach
    @AfterEach
    void cleanUp() {
        reservationRepository.deleteAll();
        customerRepository.deleteAll();
    }

    private void legacyReservation(String id, String customerId, LegacyPersonalInfo legacy) {
        reservationRepository.save(Reservation.builder()
                .id(id)
                .customerId(customerId)
                .date(LocalDate.of(2024, 5, 1))
                .timeSlot("10:00")
                .moldCount(1)
                .staffInCharge("佐藤")
                .legacyPersonalInfo(legacy)
                .build());
    }

    private static LegacyPersonalInfo legacy(String parentName, String phoneNumber) {
        return LegacyPersonalInfo.builder()
                .parentName(parentName)
                .childName(parentName == null ? null : "太郎")
                .age(1)
                .phoneNumber(phoneNumber)
                .build();
    }

    private static ReservationInput personalUpdate(CustomerFields fields) {
        return new ReservationInput(null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null, fields);
    }

    @Test
    @DisplayName("migrateCustomers() moves inline fields into the registry and a second run changes nothing")
    void migrateCustomers_isIdempotent() {
        // given: two rows of one customer and one row without customerId
        legacyReservation("RSV-1", "CUST-A", legacy("山田花子", "090-1111-1111"));
        legacyReservation("RSV-2", "CUST-A", legacy("山田花子", "090-1111-1111"));
        legacyReservation("RSV-3", null, legacy("鈴木一郎", "090-2222-2222"));

        // when
        MigrationReport first = migrationService.migrateCustomers();

        // then
        assertThat(first.scanned()).isEqualTo(3);
        assertThat(first.customersMigrated()).isEqualTo(2);
        assertThat(first.reservationsUpdated()).isEqualTo(3);
        assertThat(first.errors()).isEmpty();

        Customer migrated = customerRepository.findById("CUST-A").orElseThrow();
        assertThat(migrated.getParentName()).isEqualTo("山田花子");
        assertThat(migrated.getPhoneNumber()).isEqualTo("090-1111-1111");

        Reservation generated = reservationRepository.findById("RSV-3").orElseThrow();
        assertThat(generated.getCustomerId()).startsWith("CUST");
        assertThat(customerRepository.findById(generated.getCustomerId())).isPresent();
        assertThat(reservationRepository.findAll()).noneMatch(Reservation::hasLegacyPersonalInfo);

        // when
        MigrationReport second = migrationService.migrateCustomers();

        // then
        assertThat(second.scanned()).isEqualTo(3);
        assertThat(second.customersMigrated()).isZero();
        assertThat(second.reservationsUpdated()).isZero();
        assertThat(second.errors()).isEmpty();
        assertThat(customerRepository.count()).isEqualTo(2);
        assertThat(reservationRepository.findById("RSV-3").orElseThrow().getCustomerId())
                .isEqualTo(generated.getCustomerId());
    }

    @Test
    @DisplayName("migrateCustomers() never overwrites an existing customer record")
    void migrateCustomers_keepsExistingCustomer() {
        // given
        customerRepository.save(Customer.newCustomer("CUST-B",
                CustomerFields.personal("山田花子", "太郎", 1, 0, "080-9999-9999", "東京都", null)));
        legacyReservation("RSV-1", "CUST-B", legacy("山田花子", "090-1111-1111"));

        // when
        MigrationReport report = migrationService.migrateCustomers();

        // then
        assertThat(report.customersMigrated()).isZero();
        assertThat(report.reservationsUpdated()).isEqualTo(1);
        assertThat(customerRepository.findById("CUST-B").orElseThrow().getPhoneNumber()).isEqualTo("080-9999-9999");
        assertThat(reservationRepository.findById("RSV-1").orElseThrow().hasLegacyPersonalInfo()).isFalse();
    }

    @Test
    @DisplayName("a row with neither customerId nor a name is reported and does not stop the batch")
    void migrateCustomers_collectsRecordErrors() {
        // given
        legacyReservation("RSV-1", null, legacy(null, "090-3333-3333"));
        legacyReservation("RSV-2", "CUST-C", legacy("高橋次郎", null));

        // when
        MigrationReport report = migrationService.migrateCustomers();

        // then
        assertThat(report.errors()).singleElement()
                .satisfies(error -> assertThat(error.reservationId()).isEqualTo("RSV-1"));
        assertThat(report.customersMigrated()).isEqualTo(1);
        assertThat(report.reservationsUpdated()).isEqualTo(1);
        assertThat(reservationRepository.findById("RSV-1").orElseThrow().hasLegacyPersonalInfo()).isTrue();
    }

    @Test
    @DisplayName("updating personal fields of an unmigrated row keeps its inline names through a later migration")
    void update_legacyRow_keepsNamesThroughMigration() {
        // given
        legacyReservation("RSV-L", null, legacy("山田花子", "090-1111-1111"));

        // when
        ReservationWrite write = reservationRecords.update("RSV-L",
                personalUpdate(CustomerFields.personal(null, null, null, null, "090-1234-5678", null, null)));

        // then: the new record starts from the inline fields, the update wins where present
        Customer customer = write.customer();
        assertThat(customer.getParentName()).isEqualTo("山田花子");
        assertThat(customer.getChildName()).isEqualTo("太郎");
        assertThat(customer.getAge()).isEqualTo(1);
        assertThat(customer.getPhoneNumber()).isEqualTo("090-1234-5678");
        Reservation updated = reservationRepository.findById("RSV-L").orElseThrow();
        assertThat(updated.getCustomerId()).isEqualTo(customer.getCustomerId());
        assertThat(updated.hasLegacyPersonalInfo()).isFalse();

        // when
        MigrationReport report = migrationService.migrateCustomers();

        // then
        assertThat(report.customersMigrated()).isZero();
        assertThat(report.errors()).isEmpty();
        Customer afterMigration = customerRepository.findById(customer.getCustomerId()).orElseThrow();
        assertThat(afterMigration.getParentName()).isEqualTo("山田花子");
        assertThat(afterMigration.getChildName()).isEqualTo("太郎");
    }

    @Test
    @DisplayName("updating contact fields of a row with no customer and no names is rejected")
    void update_withoutAnyIdentity_isRejected() {
        // given
        legacyReservation("RSV-N", "CUST-GONE", null);

        // when & then
        assertThatThrownBy(() -> reservationRecords.update("RSV-N",
                personalUpdate(CustomerFields.personal(null, null, null, null, "090-1234-5678", null, null))))
                .isInstanceOf(InvalidInputException.class);
        assertThat(customerRepository.existsById("CUST-GONE")).isFalse();
    }
}
