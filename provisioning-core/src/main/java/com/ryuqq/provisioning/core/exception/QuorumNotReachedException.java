package com.ryuqq.provisioning.core.exception;

/**
 * DNS 전파가 아직 quorum에 도달하지 않음.
 *
 * <p>예상된 상태이며 단계의 시간 예산이 남아 있는 동안 재시도됩니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class QuorumNotReachedException extends TransientProviderException {

    private final int successCount;
    private final int requiredCount;

    public QuorumNotReachedException(String domain, int successCount, int requiredCount) {
        super("DNS propagation quorum not reached for " + domain
            + " (" + successCount + "/" + requiredCount + " resolvers)");
        this.successCount = successCount;
        this.requiredCount = requiredCount;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getRequiredCount() {
        return requiredCount;
    }

    @Override
    public String errorCode() {
        return "DNS-QUORUM";
    }
}
