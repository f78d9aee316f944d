package com.contactbook.backend.modules.auth.infrastructure.mail;

import com.contactbook.backend.modules.auth.application.VerificationMailer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Sends the confirmation mail over SMTP on the mail executor. Delivery failures are logged only.
 */
@Component
@ConditionalOnProperty(value = "contactbook.mail.enabled", havingValue = "true")
public class SmtpVerificationMailer implements VerificationMailer {

    private static final Logger log = LoggerFactory.getLogger(SmtpVerificationMailer.class);
    private static final String SUBJECT = "Confirm your email on Contact-App";

    private final JavaMailSender mailSender;
    private final String fromAddress;

    public SmtpVerificationMailer(
            JavaMailSender mailSender,
            @Value("${contactbook.mail.from}") String fromAddress
    ) {
        this.mailSender = mailSender;
        this.fromAddress = fromAddress;
    }

    @Override
    @Async("mailExecutor")
    public void sendVerificationEmail(String toAddress, String displayName, String verificationLink) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(fromAddress);
        message.setTo(toAddress);
        message.setSubject(SUBJECT);
        message.setText(renderBody(displayName, verificationLink));
        try {
            mailSender.send(message);
            log.info("Verification mail sent to={}", toAddress);
        } catch (MailException ex) {
            log.warn("Verification mail to={} failed: {}", toAddress, ex.getMessage());
        }
    }

    static String renderBody(String displayName, String verificationLink) {
        return """
                Hello %s,

                Thanks for signing up for Contact-App. Please confirm your email address by opening the link below:

                %s

                If you did not create an account, you can ignore this message.
                """.formatted(displayName, verificationLink);
    }
}
