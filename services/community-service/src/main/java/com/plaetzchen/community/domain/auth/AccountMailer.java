package com.plaetzchen.community.domain.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Delivers account mails. There is no SMTP integration yet, so delivery is only recorded in the
 * log. Tokens never appear in log output.
 */
@Component
public class AccountMailer {

    private static final Logger log = LoggerFactory.getLogger(AccountMailer.class);

    public void sendVerification(String email, String token) {
        log.info("Verification mail queued for {} (link /verify-email, {} char token)", email, token.length());
    }

    public void sendPasswordReset(String email, String token) {
        log.info("Password reset mail queued for {} (link /reset-password, {} char token)", email, token.length());
    }
}
