package com.ryuqq.provisioning.core.email;

import java.util.List;

/**
 * 이메일 발송 결과.
 *
 * @param messageId provider message id (거부된 경우 null 가능)
 * @param accepted 수락된 수신자
 * @param rejected 거부된 수신자
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record SendResult(String messageId, List<String> accepted, List<String> rejected) {

    public SendResult {
        accepted = accepted == null ? List.of() : List.copyOf(accepted);
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
    }

    public static SendResult accepted(String messageId, String recipient) {
        return new SendResult(messageId, List.of(recipient), List.of());
    }

    public static SendResult rejected(String recipient) {
        return new SendResult(null, List.of(), List.of(recipient));
    }

    public boolean isAccepted(String recipient) {
        return accepted.stream().anyMatch(recipient::equalsIgnoreCase);
    }
}
