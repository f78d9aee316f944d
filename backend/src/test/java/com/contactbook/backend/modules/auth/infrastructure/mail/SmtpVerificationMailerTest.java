package com.contactbook.backend.modules.auth.infrastructure.mail;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

@ExtendWith(MockitoExtension.class)
class SmtpVerificationMailerTest {

    private static final String LINK = "https://contacts.example.com/api/auth/confirmed_email/abc.def.ghi";

    @Mock
    private JavaMailSender mailSender;

    @Test
    void sendsLinkToRecipient() {
        new SmtpVerificationMailer(mailSender, "no-reply@contactbook.local")
                .sendVerificationEmail("ada@example.com", "ada.lovelace", LINK);

        ArgumentCaptor<SimpleMailMessage> message = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(message.capture());
        assertThat(message.getValue().getTo()).containsExactly("ada@example.com");
        assertThat(message.getValue().getFrom()).isEqualTo("no-reply@contactbook.local");
        assertThat(message.getValue().getText()).contains("Hello ada.lovelace").contains(LINK);
    }

    @Test
    void deliveryFailureIsNotPropagated() {
        doThrow(new MailSendException("relay refused")).when(mailSender).send(any(SimpleMailMessage.class));

        assertDoesNotThrow(() -> new SmtpVerificationMailer(mailSender, "no-reply@contactbook.local")
                .sendVerificationEmail("ada@example.com", "ada.lovelace", LINK));
    }
}
