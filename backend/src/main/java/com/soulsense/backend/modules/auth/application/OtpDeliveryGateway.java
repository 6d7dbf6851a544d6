package com.soulsense.backend.modules.auth.application;

import com.soulsense.backend.modules.auth.domain.OtpType;
import com.soulsense.backend.modules.auth.domain.UserAccount;

/**
 * Out-of-band delivery of one-time codes (mail, SMS). Implementations must not log the code.
 */
public interface OtpDeliveryGateway {

    void deliver(UserAccount user, String email, OtpType type, String code);
}
