package com.soulsense.backend.modules.auth.infrastructure.otp;

import com.soulsense.backend.modules.auth.application.OtpDeliveryGateway;
import com.soulsense.backend.modules.auth.domain.OtpType;
import com.soulsense.backend.modules.auth.domain.UserAccount;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default gateway until a mail provider is wired in. Records the dispatch, never the code.
 */
@Component
public class LoggingOtpDeliveryGateway implements OtpDeliveryGateway {

    private static final Logger log = LoggerFactory.getLogger(LoggingOtpDeliveryGateway.class);

    @Override
    public void deliver(UserAccount user, String email, OtpType type, String code) {
        log.info("One-time code dispatched userId={} type={} to={}", user.getId(), type, mask(email));
    }

    static String mask(String email) {
        if (email == null) {
            return "-";
        }
        int at = email.indexOf('@');
        if (at <= 1) {
            return "***" + (at >= 0 ? email.substring(at) : "");
        }
        return email.charAt(0) + "***" + email.substring(at);
    }
}
