package com.ryuqq.provisioning.application.activity;

import com.ryuqq.provisioning.core.email.SendResult;
import com.ryuqq.provisioning.core.event.InvitationEventType;
import com.ryuqq.provisioning.core.event.StreamType;
import com.ryuqq.provisioning.core.model.InvitationRecipient;
import com.ryuqq.provisioning.core.projection.InvitationStatus;
import com.ryuqq.provisioning.core.projection.InvitationView;
import com.ryuqq.provisioning.core.saga.IssuedInvitation;
import com.ryuqq.provisioning.core.spi.EmailSender;
import com.ryuqq.provisioning.core.statemachine.SagaStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * 초대 생성 / 메일 발송 activity 테스트.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
class InvitationActivitiesTest {

    private ActivityFixture fixture;
    private GenerateInvitationsActivity generate;
    private SendInvitationEmailsActivity send;
    private UUID orgId;

    @BeforeEach
    void setUp() {
        fixture = new ActivityFixture();
        generate = new GenerateInvitationsActivity(fixture.projectionStore, fixture.appender,
            new InvitationTokenGenerator(), fixture.config, fixture.clock);
        send = new SendInvitationEmailsActivity(fixture.emailSender, fixture.history, fixture.appender,
            fixture.config, fixture.clock);
        orgId = fixture.createOrganization(fixture.request("Acme Health", null));
    }

    // ============================================================
    // GenerateInvitations
    // ============================================================

    @Nested
    class Generate {

        @Test
        void 수신자별_초대와_토큰_생성() {
            // given
            List<InvitationRecipient> recipients = List.of(
                new InvitationRecipient("Admin@Acme.com", "Ada", "Lovelace", List.of("provider_admin")),
                InvitationRecipient.of("ops@acme.com", "clinician"));

            // when
            List<IssuedInvitation> issued =
                generate.execute(orgId, recipients, fixture.context(SagaStep.GENERATE_INVITATIONS));

            // then
            assertThat(issued).hasSize(2);
            assertThat(issued).extracting(IssuedInvitation::email).containsExactly("admin@acme.com", "ops@acme.com");
            assertThat(issued).extracting(IssuedInvitation::token).doesNotHaveDuplicates()
                .allSatisfy(token -> assertThat(token).hasSize(43).doesNotContain("=", "+", "/"));
            assertThat(issued).extracting(IssuedInvitation::expiresAt)
                .containsOnly(ActivityFixture.NOW.plus(Duration.ofDays(7)));

            InvitationView view = fixture.projectionStore.findInvitation(issued.get(0).invitationId()).orElseThrow();
            assertThat(view.orgId()).isEqualTo(orgId);
            assertThat(view.firstName()).isEqualTo("Ada");
            assertThat(view.status()).isEqualTo(InvitationStatus.PENDING);
        }

        @Test
        void 재실행시_살아있는_초대를_재사용() {
            // given
            List<InvitationRecipient> recipients = List.of(InvitationRecipient.of("admin@acme.com", "provider_admin"));
            List<IssuedInvitation> first = generate.execute(orgId, recipients, fixture.context(SagaStep.GENERATE_INVITATIONS));

            // when
            List<IssuedInvitation> second = generate.execute(orgId, recipients, fixture.context(SagaStep.GENERATE_INVITATIONS));

            // then
            assertThat(second).isEqualTo(first);
            assertThat(fixture.projectionStore.findInvitations(orgId)).hasSize(1);
        }

        @Test
        void 수신자가_없으면_빈_결과() {
            assertThat(generate.execute(orgId, List.of(), fixture.context(SagaStep.GENERATE_INVITATIONS))).isEmpty();
        }
    }

    // ============================================================
    // SendInvitationEmails
    // ============================================================

    @Nested
    class Send {

        @Test
        void 발송_성공시_email_sent_기록() {
            // given
            List<IssuedInvitation> issued = issue("admin@acme.com");

            // when
            SendInvitationEmailsActivity.Result result =
                send.execute(orgId, "Acme Health", issued, fixture.context(SagaStep.SEND_INVITATION_EMAILS));

            // then
            assertThat(result.sentCount()).isEqualTo(1);
            assertThat(result.failures()).isEmpty();
            assertThat(fixture.emailSender.outbox()).singleElement().satisfies(email -> {
                assertThat(email.from()).isEqualTo("noreply@firstovertheline.com");
                assertThat(email.subject()).isEqualTo("Invitation to join Acme Health");
                assertThat(email.text())
                    .contains("https://a4c.firstovertheline.com/accept-invitation?token=" + issued.get(0).token());
            });
            UUID invitationId = issued.get(0).invitationId();
            assertThat(fixture.count(invitationId, StreamType.INVITATION, InvitationEventType.EMAIL_SENT)).isEqualTo(1);
            assertThat(fixture.projectionStore.findInvitation(invitationId).orElseThrow().emailSentAt())
                .isEqualTo(ActivityFixture.NOW);
        }

        @Test
        void 거부된_수신자는_실패로_집계하고_나머지는_계속() {
            // given
            fixture.emailSender.rejectRecipient("bounce@acme.com");
            List<IssuedInvitation> issued = issue("bounce@acme.com", "admin@acme.com");

            // when
            SendInvitationEmailsActivity.Result result =
                send.execute(orgId, "Acme Health", issued, fixture.context(SagaStep.SEND_INVITATION_EMAILS));

            // then
            assertThat(result.sentCount()).isEqualTo(1);
            assertThat(result.failures()).extracting(SendInvitationEmailsActivity.Failure::email)
                .containsExactly("bounce@acme.com");
            assertThat(fixture.count(issued.get(0).invitationId(), StreamType.INVITATION,
                InvitationEventType.EMAIL_SENT)).isZero();
        }

        @Test
        void sender_예외도_실패로_집계() {
            // given
            EmailSender broken = mock(EmailSender.class);
            when(broken.send(eq("admin@acme.com"), any(), anyMap()))
                .thenThrow(new IllegalStateException("SMTP unavailable"));
            SendInvitationEmailsActivity brokenSend = new SendInvitationEmailsActivity(broken,
                fixture.history, fixture.appender, fixture.config, fixture.clock);
            List<IssuedInvitation> issued = issue("admin@acme.com");

            // when
            SendInvitationEmailsActivity.Result result =
                brokenSend.execute(orgId, "Acme Health", issued, fixture.context(SagaStep.SEND_INVITATION_EMAILS));

            // then
            assertThat(result.sentCount()).isZero();
            assertThat(result.failures()).singleElement()
                .satisfies(failure -> assertThat(failure.reason()).isEqualTo("SMTP unavailable"));
        }

        @Test
        void 이미_발송된_초대는_다시_보내지_않음() {
            // given
            List<IssuedInvitation> issued = issue("admin@acme.com");
            send.execute(orgId, "Acme Health", issued, fixture.context(SagaStep.SEND_INVITATION_EMAILS));

            // when
            SendInvitationEmailsActivity.Result again =
                send.execute(orgId, "Acme Health", issued, fixture.context(SagaStep.SEND_INVITATION_EMAILS));

            // then
            assertThat(again.sentCount()).isEqualTo(1);
            assertThat(fixture.emailSender.outbox()).hasSize(1);
        }

        @Test
        void 메시지_id를_받은_발송만_기록() {
            EmailSender accepting = mock(EmailSender.class);
            when(accepting.send(eq("admin@acme.com"), any(), anyMap()))
                .thenReturn(SendResult.accepted("<msg-1@test>", "admin@acme.com"));
            SendInvitationEmailsActivity mockedSend = new SendInvitationEmailsActivity(accepting,
                fixture.history, fixture.appender, fixture.config, fixture.clock);
            List<IssuedInvitation> issued = issue("admin@acme.com");

            mockedSend.execute(orgId, "Acme Health", issued, fixture.context(SagaStep.SEND_INVITATION_EMAILS));

            assertThat(fixture.eventStore.readStream(issued.get(0).invitationId(), StreamType.INVITATION))
                .filteredOn(event -> event.is(InvitationEventType.EMAIL_SENT))
                .singleElement()
                .satisfies(event -> assertThat(event.data().text("message_id")).isEqualTo("<msg-1@test>"));
        }

        private List<IssuedInvitation> issue(String... emails) {
            List<InvitationRecipient> recipients = Arrays.stream(emails)
                .map(email -> InvitationRecipient.of(email, "provider_admin"))
                .toList();
            return generate.execute(orgId, recipients, fixture.context(SagaStep.GENERATE_INVITATIONS));
        }
    }
}
