package com.ryuqq.provisioning.application.dns;

import java.util.List;

/**
 * DNS 전파 검증 결과.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public sealed interface PropagationResult permits PropagationResult.Verified, PropagationResult.NotYetPropagated {

    String METHOD_QUORUM = "dns_quorum";
    String METHOD_BYPASS = "bypass";

    String domain();

    int successCount();

    /**
     * quorum 이상 resolver가 A 레코드를 반환함 (또는 bypass).
     */
    record Verified(String domain, String method, int successCount, List<ResolverAnswer> answers)
        implements PropagationResult {

        public Verified {
            answers = answers == null ? List.of() : List.copyOf(answers);
        }
    }

    /**
     * 아직 quorum 미달. 호출자가 재시도합니다.
     */
    record NotYetPropagated(String domain, int successCount, int requiredCount, List<ResolverAnswer> answers)
        implements PropagationResult {

        public NotYetPropagated {
            answers = answers == null ? List.of() : List.copyOf(answers);
        }
    }
}
