package com.ryuqq.provisioning.testkit.contract;

import com.ryuqq.provisioning.adapter.runner.BootstrapSagaRunner;
import com.ryuqq.provisioning.core.event.OrganizationEventType;
import com.ryuqq.provisioning.core.model.BootstrapId;
import com.ryuqq.provisioning.core.saga.BootstrapSagaState;
import com.ryuqq.provisioning.core.statemachine.BootstrapStage;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for durable execution across runner crashes.
 *
 * <p>A runner that dies keeps its lease until it expires. After that any runner sharing the
 * saga store picks the saga up from the last persisted stage and re-runs the pending step,
 * which must not repeat side effects already recorded in the event log.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
class CrashRecoveryContractTest extends AbstractProvisioningContractTest {

    private static final Duration LEASE = Duration.ofSeconds(60);

    @Test
    void testCrash_LeaseHeldByDeadRunner_BlocksUntilExpiry() {
        // Given: another process claimed the saga and died
        BootstrapId id = runner.start(request("Crash", null, "owner@crash.test"));
        List<BootstrapSagaState> claimed = sagaStore.claimDue(clock.instant(), LEASE, 10);
        assertEquals(1, claimed.size());

        // When
        runner.pump();

        // Then: still leased, nothing happened
        assertEquals(BootstrapStage.CREATED, saga(id).currentStage());
        assertEquals(0, count(saga(id).orgId(), OrganizationEventType.CREATED));

        // When: the lease expires
        clock.advance(LEASE.plusSeconds(1));
        runner.pump();

        // Then
        assertEquals(BootstrapStage.ORG_CREATED, saga(id).currentStage());
    }

    @Test
    void testCrash_AfterSideEffectBeforeCheckpoint_DoesNotRepeatIt() {
        // Given: the dead runner created the organization but never saved the new stage
        propagate("resume", 2);
        BootstrapId id = runner.start(request("Resume", "resume", "owner@resume.test"));
        BootstrapSagaState claimed = sagaStore.claimDue(clock.instant(), LEASE, 10).get(0);
        executor.execute(claimed);
        assertEquals(1, count(claimed.orgId(), OrganizationEventType.CREATED));
        assertEquals(BootstrapStage.CREATED, saga(id).currentStage());

        // When
        clock.advance(LEASE.plusSeconds(1));
        assertStage(pumpUntilTerminal(id), BootstrapStage.ACTIVATED);

        // Then
        assertEquals(1, count(claimed.orgId(), OrganizationEventType.CREATED));
        assertEquals(1, dnsProvider.createCallCount());
        assertEquals(1, emailSender.outbox().size());
    }

    @Test
    void testCrash_SecondRunnerFinishesSaga() {
        // Given: the first runner completes one step and then stops for good
        propagate("handover", 2);
        BootstrapId id = runner.start(request("Handover", "handover", "owner@handover.test"));
        runner.pump();
        assertEquals(BootstrapStage.ORG_CREATED, saga(id).currentStage());

        // When
        BootstrapSagaRunner successor = newRunner();
        for (int i = 0; i < MAX_PUMPS && !saga(id).isTerminal(); i++) {
            clock.advance(PUMP_INTERVAL);
            successor.pump();
        }

        // Then
        assertEquals(BootstrapStage.ACTIVATED, saga(id).currentStage());
        assertEquals(1, count(saga(id).orgId(), OrganizationEventType.CREATED));
        assertEquals(1, count(saga(id).orgId(), OrganizationEventType.ACTIVATED));
        assertAllProjected();
    }

    @Test
    void testCrash_TwoRunnersPumpingTogether_RunEachStepOnce() throws InterruptedException {
        // Given
        propagate("race", 3);
        BootstrapId id = runner.start(request("Race", "race", "owner@race.test"));
        BootstrapSagaRunner other = newRunner();

        // When
        for (int i = 0; i < MAX_PUMPS && !saga(id).isTerminal(); i++) {
            Thread first = new Thread(runner::pump);
            Thread second = new Thread(other::pump);
            first.start();
            second.start();
            first.join();
            second.join();
            clock.advance(PUMP_INTERVAL);
        }

        // Then
        assertEquals(BootstrapStage.ACTIVATED, saga(id).currentStage());
        assertEquals(1, count(saga(id).orgId(), OrganizationEventType.CREATED));
        assertEquals(1, dnsProvider.createCallCount());
        assertEquals(1, emailSender.outbox().size());
    }
}
