package com.ryuqq.provisioning.core.exception;

import com.ryuqq.provisioning.core.model.BootstrapId;

/**
 * 존재하지 않는 bootstrap saga 조회.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class SagaNotFoundException extends ProvisioningException {

    public SagaNotFoundException(BootstrapId bootstrapId) {
        super("Bootstrap saga not found: " + bootstrapId);
    }

    @Override
    public String errorCode() {
        return "SAGA-404";
    }
}
