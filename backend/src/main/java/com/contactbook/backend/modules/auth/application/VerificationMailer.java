package com.contactbook.backend.modules.auth.application;

/**
 * Outbound mail collaborator. Sending is fire-and-forget: implementations log failures
 * instead of raising them into the calling flow.
 */
public interface VerificationMailer {

    void sendVerificationEmail(String toAddress, String displayName, String verificationLink);
}
