package com.browseflow.browseflow_backend.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerSlotsTest {

    @Test
    void shouldTrackGlobalAndPerBatchUsage() {
        WorkerSlots slots = new WorkerSlots(2);

        slots.acquire("e1", "b1");
        assertThat(slots.hasBatchCapacity("b1", 1)).isFalse();
        assertThat(slots.hasBatchCapacity("b2", 1)).isTrue();

        slots.acquire("e2", "b2");
        assertThat(slots.hasGlobalCapacity()).isFalse();
        assertThatThrownBy(() -> slots.acquire("e3", "b2")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldReleaseEachSlotOnlyOnce() {
        WorkerSlots slots = new WorkerSlots(3);
        slots.acquire("e1", "b1");
        slots.acquire("e2", "b1");

        assertThat(slots.release("e1")).isTrue();
        assertThat(slots.release("e1")).isFalse();
        assertThat(slots.activeFor("b1")).isEqualTo(1);
        assertThat(slots.activeCount()).isEqualTo(1);
    }

    @Test
    void shouldRejectDoubleAcquireAndInvalidLimit() {
        WorkerSlots slots = new WorkerSlots(1);
        slots.acquire("e1", "b1");

        assertThatThrownBy(() -> slots.acquire("e1", "b1")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new WorkerSlots(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
