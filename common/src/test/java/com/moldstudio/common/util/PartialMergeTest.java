package com.moldstudio.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class PartialMergeTest {

    @Test
    @DisplayName("present values overwrite, absent values keep the current one")
    void field_appliesOnlyPresentValues() {
        AtomicReference<String> phone = new AtomicReference<>("090-0000-0000");
        AtomicReference<String> note = new AtomicReference<>("first visit");

        boolean changed = PartialMerge.start()
                .field("080-1111-2222", phone::set)
                .field((String) null, note::set)
                .anyApplied();

        assertThat(phone.get()).isEqualTo("080-1111-2222");
        assertThat(note.get()).isEqualTo("first visit");
        assertThat(changed).isTrue();
    }

    @Test
    @DisplayName("empty string is a present value and overwrites")
    void field_emptyStringOverwrites() {
        AtomicReference<String> note = new AtomicReference<>("x");

        PartialMerge.start().field("", note::set);

        assertThat(note.get()).isEmpty();
    }

    @Test
    @DisplayName("resolve prefers the incoming value and falls back to the current one")
    void resolve_coalesces() {
        assertThat(PartialMerge.resolve("B", "A")).isEqualTo("B");
        assertThat(PartialMerge.resolve(null, "A")).isEqualTo("A");
        assertThat(PartialMerge.start().anyApplied()).isFalse();
    }
}
