package com.ryuqq.provisioning.adapter.inmemory.email;

import com.ryuqq.provisioning.core.email.EmailTemplate;
import com.ryuqq.provisioning.core.email.SendResult;
import com.ryuqq.provisioning.core.spi.EmailSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link EmailSender} that records rendered messages in an outbox.
 *
 * <p>Recipients registered with {@link #rejectRecipient(String)} are reported as rejected
 * instead of delivered.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class InMemoryEmailSender implements EmailSender {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEmailSender.class);

    private final List<SentEmail> outbox = new CopyOnWriteArrayList<>();
    private final Set<String> rejected = ConcurrentHashMap.newKeySet();

    @Override
    public SendResult send(String to, EmailTemplate template, Map<String, String> data) {
        if (to == null || to.isBlank()) {
            throw new IllegalArgumentException("to cannot be null or blank");
        }
        if (template == null) {
            throw new IllegalArgumentException("template cannot be null");
        }
        if (rejected.contains(to.toLowerCase(Locale.ROOT))) {
            log.info("Rejecting email to {}", to);
            return SendResult.rejected(to);
        }
        EmailTemplate.RenderedEmail rendered = template.render(data);
        String messageId = "<" + UUID.randomUUID() + "@inmemory>";
        outbox.add(new SentEmail(messageId, to, data.get("sender"), rendered.subject(), rendered.text(), rendered.html()));
        log.info("Recorded email {} to {}: {}", messageId, to, rendered.subject());
        return SendResult.accepted(messageId, to);
    }

    public void rejectRecipient(String email) {
        rejected.add(email.toLowerCase(Locale.ROOT));
    }

    public List<SentEmail> outbox() {
        return List.copyOf(outbox);
    }

    /**
     * A delivered message.
     */
    public record SentEmail(String messageId, String to, String from, String subject, String text, String html) {
    }
}
