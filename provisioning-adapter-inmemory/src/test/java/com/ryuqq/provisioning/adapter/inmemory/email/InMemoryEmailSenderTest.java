package com.ryuqq.provisioning.adapter.inmemory.email;

import com.ryuqq.provisioning.core.email.EmailTemplate;
import com.ryuqq.provisioning.core.email.SendResult;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryEmailSenderTest {

    private static final EmailTemplate TEMPLATE =
        new EmailTemplate("t", "Hi {{name}}", "Hello {{name}}", "<p>Hello {{name}}</p>");

    @Test
    void send_outbox에_렌더링된_메일_기록() {
        InMemoryEmailSender sender = new InMemoryEmailSender();

        SendResult result = sender.send("jane@example.com", TEMPLATE, Map.of("name", "Jane"));

        assertThat(result.isAccepted("jane@example.com")).isTrue();
        assertThat(sender.outbox()).hasSize(1);
        assertThat(sender.outbox().get(0).subject()).isEqualTo("Hi Jane");
    }

    @Test
    void rejectRecipient_거부() {
        InMemoryEmailSender sender = new InMemoryEmailSender();
        sender.rejectRecipient("Bounce@Example.com");

        SendResult result = sender.send("bounce@example.com", TEMPLATE, Map.of("name", "B"));

        assertThat(result.isAccepted("bounce@example.com")).isFalse();
        assertThat(sender.outbox()).isEmpty();
    }
}
