package com.moldstudio.reservation.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.util.StringUtils;

import java.util.stream.Stream;

/**
 * Personal fields that older reservation rows carry inline instead of through a customer record.
 * New writes never populate these columns; the customer migration moves them into the registry
 * and clears them.
 */
@Embeddable
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LegacyPersonalInfo {

    @Column(name = "legacy_parent_name", length = 100)
    private String parentName;

    @Column(name = "legacy_child_name", length = 100)
    private String childName;

    @Column(name = "legacy_age_years")
    private Integer age;

    @Column(name = "legacy_age_months")
    private Integer ageMonths;

    @Column(name = "legacy_phone_number", length = 30)
    private String phoneNumber;

    @Column(name = "legacy_address", length = 255)
    private String address;

    @Column(name = "legacy_line_url", length = 255)
    private String lineUrl;

    public boolean isEmpty() {
        return Stream.of(parentName, childName, age, ageMonths, phoneNumber, address, lineUrl)
                .allMatch(value -> value == null || (value instanceof String s && s.isEmpty()));
    }

    public boolean hasIdentity() {
        return StringUtils.hasText(parentName) || StringUtils.hasText(childName);
    }

    public CustomerFields toCustomerFields() {
        return CustomerFields.personal(parentName, childName, age, ageMonths, phoneNumber, address, lineUrl);
    }
}
