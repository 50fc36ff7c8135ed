/**
 * Contract test support for the provisioning saga.
 *
 * <p>{@link com.ryuqq.provisioning.testkit.contract.AbstractProvisioningContractTest} wires the real
 * runner, activities and projection router to the in-memory adapters. Adapter modules can extend it
 * to run the same scenarios against their own stores.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
package com.ryuqq.provisioning.testkit.contract;
