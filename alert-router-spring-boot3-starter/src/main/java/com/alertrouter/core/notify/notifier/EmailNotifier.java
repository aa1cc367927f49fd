package com.alertrouter.core.notify.notifier;

import com.alertrouter.core.spi.notify.Notifier;
import com.alertrouter.model.Destination;
import com.alertrouter.model.enums.DestinationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

/**
 * 邮件通知
 * 主题取正文首行(批次标题)
 */
public class EmailNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(EmailNotifier.class);

    private final JavaMailSender mailSender;

    private final String from;

    private final String subjectPrefix;

    public EmailNotifier(JavaMailSender mailSender, String from, String subjectPrefix) {
        this.mailSender = mailSender;
        this.from = from;
        this.subjectPrefix = subjectPrefix == null ? "" : subjectPrefix;
    }

    @Override
    public String name() {
        return "email";
    }

    @Override
    public boolean supports(Destination destination) {
        return destination.getType() == DestinationType.EMAIL
                && destination.getRecipients() != null
                && !destination.getRecipients().isEmpty();
    }

    @Override
    public void send(Destination destination, String text) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(from);
        message.setTo(destination.getRecipients().toArray(new String[0]));
        message.setSubject(subjectPrefix + subjectOf(text));
        message.setText(text);
        mailSender.send(message);
        log.debug("[Notify-email] sent to={}", destination.getRecipients());
    }

    static String subjectOf(String text) {
        if (text == null || text.isEmpty()) {
            return "alerts";
        }
        int nl = text.indexOf('\n');
        String first = (nl < 0 ? text : text.substring(0, nl)).trim();
        if (first.length() >= 2 && first.startsWith("*") && first.endsWith("*")) {
            first = first.substring(1, first.length() - 1);
        }
        return first.isEmpty() ? "alerts" : first;
    }
}
