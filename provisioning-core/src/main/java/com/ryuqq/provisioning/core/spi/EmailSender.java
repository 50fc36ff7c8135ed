package com.ryuqq.provisioning.core.spi;

import com.ryuqq.provisioning.core.email.EmailTemplate;
import com.ryuqq.provisioning.core.email.SendResult;

import java.util.Map;

/**
 * Email provider capability SPI.
 *
 * <p>Best-effort: a rejected recipient is reported in {@link SendResult#rejected()}, while
 * provider outages throw {@link com.ryuqq.provisioning.core.exception.TransientProviderException}.
 * Neither fails the saga.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface EmailSender {

    /**
     * Sends one templated email.
     *
     * @param to recipient address
     * @param template the template
     * @param data template values ({@code from} selects the sender address)
     * @return the send result
     */
    SendResult send(String to, EmailTemplate template, Map<String, String> data);
}
