package com.moldstudio.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class IdGeneratorTest {

    @Test
    @DisplayName("newId is prefix + timestamp + underscore + 6 base-36 characters")
    void newId_format() {
        String id = IdGenerator.newId("CUST", 1761523200000L);

        assertThat(id).matches("CUST1761523200000_[0-9a-z]{6}");
    }

    @Test
    @DisplayName("ids generated in the same millisecond still differ")
    void newId_randomSuffixDistinguishesSameTimestamp() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            ids.add(IdGenerator.newId("RSV", 1L));
        }

        assertThat(ids).hasSizeGreaterThan(190);
    }
}
