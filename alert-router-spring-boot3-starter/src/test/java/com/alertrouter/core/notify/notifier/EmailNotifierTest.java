package com.alertrouter.core.notify.notifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.then;

import com.alertrouter.model.Destination;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

@ExtendWith(MockitoExtension.class)
class EmailNotifierTest {

    @Mock
    private JavaMailSender mailSender;

    @Test
    void shouldSendBatchTitleAsSubject() {
        // given
        EmailNotifier notifier = new EmailNotifier(mailSender, "alert-router@example.com", "[alert-router] ");
        Destination dest = Destination.email(List.of("oncall@example.com", "dba@example.com"));

        // when
        notifier.send(dest, "*2 alert(s) severity=critical*\n- disk full\n- lag\n");

        // then
        ArgumentCaptor<SimpleMailMessage> captor = ArgumentCaptor.forClass(SimpleMailMessage.class);
        then(mailSender).should().send(captor.capture());
        SimpleMailMessage msg = captor.getValue();
        assertThat(msg.getSubject()).isEqualTo("[alert-router] 2 alert(s) severity=critical");
        assertThat(msg.getTo()).containsExactly("oncall@example.com", "dba@example.com");
        assertThat(msg.getFrom()).isEqualTo("alert-router@example.com");
        assertThat(msg.getText()).contains("- disk full");
    }

    @Test
    void shouldDeriveSubjectFromFirstLine() {
        assertThat(EmailNotifier.subjectOf("plain title\nbody")).isEqualTo("plain title");
        assertThat(EmailNotifier.subjectOf("")).isEqualTo("alerts");
    }

    @Test
    void shouldOnlySupportEmailWithRecipients() {
        EmailNotifier notifier = new EmailNotifier(mailSender, "a@example.com", null);
        assertThat(notifier.supports(Destination.email(List.of("x@example.com")))).isTrue();
        assertThat(notifier.supports(Destination.email(List.of()))).isFalse();
        assertThat(notifier.supports(Destination.chat("https://h", "#c"))).isFalse();
    }
}
