package com.driftsentinel.core.alerting.channel;

import com.driftsentinel.core.error.ChannelDeliveryException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EmailChannel}. SMTP transport is replaced in-process.
 */
class EmailChannelTest {

    private final Session session = Session.getInstance(new Properties());

    @Test
    @DisplayName("Should address every recipient with a severity-tagged subject")
    void shouldBuildMessage() throws MessagingException, IOException {
        List<MimeMessage> sent = new ArrayList<>();
        EmailChannel channel = new EmailChannel("mail", session, "sentinel@example.com",
                List.of("dev@example.com", "ops@example.com"), "[drift]") {
            @Override
            void transport(MimeMessage message) {
                sent.add(message);
            }
        };

        assertThat(channel.send(ChannelTestSupport.alert("a-1")).isSuccess()).isTrue();

        MimeMessage message = sent.get(0);
        assertThat(message.getSubject()).isEqualTo("[drift] ERROR: SIGNATURE_MISMATCH in src/calc.py");
        assertThat(message.getRecipients(Message.RecipientType.TO))
                .extracting(Object::toString)
                .containsExactly("dev@example.com", "ops@example.com");
        assertThat(message.getContent().toString())
                .contains("Alert id: a-1")
                .contains("Specification: calc-spec@docs/calc.md")
                .contains("elements: calc");
    }

    @Test
    @DisplayName("Should wrap transport failures in a delivery exception")
    void shouldWrapTransportFailure() {
        EmailChannel channel = new EmailChannel("mail", session, "sentinel@example.com",
                List.of("dev@example.com"), null) {
            @Override
            void transport(MimeMessage message) throws MessagingException {
                throw new MessagingException("Connection refused");
            }
        };

        assertThatThrownBy(() -> channel.send(ChannelTestSupport.alert("a-1")))
                .isInstanceOf(ChannelDeliveryException.class)
                .hasMessageContaining("Connection refused");
    }

    @Test
    @DisplayName("Should require at least one recipient")
    void shouldRequireRecipient() {
        assertThatThrownBy(() -> new EmailChannel("mail", session, "sentinel@example.com", List.of(), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
