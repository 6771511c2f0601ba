package com.eyelevel.watermarks.service.session;

import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Issues the opaque owner identity attached to every job submitted from one browser session.
 */
@Service
public class SessionIdentityService {

    public static final String OWNER_COOKIE = "owner_id";
    private static final int TOKEN_BYTES = 32;
    private static final int MIN_VALID_LENGTH = 10;

    private final SecureRandom random = new SecureRandom();

    /**
     * @return A new URL-safe token built from 32 random bytes.
     */
    public String generate() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Keeps a presented identity if it looks like one we issued, otherwise issues a new one.
     */
    public String resolve(final String presented) {
        return isValid(presented) ? presented : generate();
    }

    public boolean isValid(final String ownerId) {
        return ownerId != null && ownerId.length() > MIN_VALID_LENGTH;
    }
}
