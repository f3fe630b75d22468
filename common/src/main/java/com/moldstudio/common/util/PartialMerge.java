package com.moldstudio.common.util;

import java.util.function.Consumer;

/**
 * Field-by-field partial update: a present (non-null) incoming value overwrites,
 * an absent one keeps the current value. Shared by every patch-style update so
 * that omitted fields never null out stored data.
 *
 * <pre>
 * boolean changed = PartialMerge.start()
 *         .field(patch.phoneNumber(), customer::setPhoneNumber)
 *         .field(patch.note(), customer::setNote)
 *         .anyApplied();
 * </pre>
 */
public final class PartialMerge {

    private int applied;

    private PartialMerge() {
    }

    public static PartialMerge start() {
        return new PartialMerge();
    }

    public <T> PartialMerge field(T incoming, Consumer<? super T> setter) {
        if (incoming != null) {
            setter.accept(incoming);
            applied++;
        }
        return this;
    }

    public boolean anyApplied() {
        return applied > 0;
    }

    /**
     * The value a merge would leave behind, without applying it.
     */
    public static <T> T resolve(T incoming, T current) {
        return incoming != null ? incoming : current;
    }
}
