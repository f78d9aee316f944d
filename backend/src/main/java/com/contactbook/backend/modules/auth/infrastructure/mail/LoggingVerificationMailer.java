package com.contactbook.backend.modules.auth.infrastructure.mail;

import com.contactbook.backend.modules.auth.application.VerificationMailer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Development mailer: records the verification link in the log instead of sending it.
 */
@Component
@ConditionalOnProperty(value = "contactbook.mail.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingVerificationMailer implements VerificationMailer {

    private static final Logger log = LoggerFactory.getLogger(LoggingVerificationMailer.class);

    @Override
    public void sendVerificationEmail(String toAddress, String displayName, String verificationLink) {
        log.info("Verification mail to={} name={} link={}", toAddress, displayName, verificationLink);
    }
}
