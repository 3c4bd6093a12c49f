package com.tpcc.gateway.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for the protocol phase tracker.
 */
class TransactionPlanTest {

    @Test
    void forwardTransitions_ShouldReachWritesComplete() {
        // Given
        TransactionPlan plan = TransactionPlan.start("payment");

        // When
        plan.step("read customer");
        plan.readsComplete();
        plan.validated();
        plan.step("update customer");
        plan.writesComplete();

        // Then
        assertThat(plan.phase()).isEqualTo(TransactionPhase.WRITES_COMPLETE);
        assertThat(plan.steps()).containsExactly("read customer", "update customer");
    }

    @Test
    void outOfOrderTransition_ShouldThrow() {
        TransactionPlan plan = TransactionPlan.start("delivery");

        assertThatThrownBy(plan::validated)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("VALIDATED from STARTED");
    }

    @Test
    void abort_AfterWritesComplete_ShouldBeAllowed() {
        // Given
        TransactionPlan plan = TransactionPlan.start("new_order");
        plan.readsComplete();
        plan.validated();
        plan.writesComplete();

        // When
        plan.abort("commit failed");

        // Then
        assertThat(plan.phase()).isEqualTo(TransactionPhase.ABORTED);
        assertThat(plan.abortReason()).isEqualTo("commit failed");
    }

    @Test
    void abort_Twice_ShouldThrow() {
        TransactionPlan plan = TransactionPlan.start("stock_level");
        plan.abort("invalid threshold");

        assertThatThrownBy(() -> plan.abort("again")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> plan.step("read")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void restart_ShouldClearStepsAndPhase() {
        // Given
        TransactionPlan plan = TransactionPlan.start("payment");
        plan.step("read warehouse");
        plan.readsComplete();

        // When
        plan.restart();

        // Then
        assertThat(plan.phase()).isEqualTo(TransactionPhase.STARTED);
        assertThat(plan.steps()).isEmpty();
    }
}
