package com.weatherdash.backend.auth.notify;

import com.weatherdash.backend.auth.otp.OtpPurpose;

/**
 * Out-of-band delivery of a freshly issued one-time code.
 */
public interface OtpNotificationSender {

    /**
     * @param destination   email address the code proves control of
     * @param purpose       why the code was issued (selects subject and wording)
     * @param plaintextCode the 6-digit code; never persisted anywhere
     * @param displayName   greeting name
     * @return true when the message was handed to the transport; false when delivery is
     *         disabled or failed. Failure never invalidates the issued code.
     */
    boolean send(String destination, OtpPurpose purpose, String plaintextCode, String displayName);
}
