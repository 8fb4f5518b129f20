package com.binauditor.core.crypto;

import java.security.GeneralSecurityException;

/**
 * Signals malformed CMS/DER structures or a failed signature verification.
 */
public class CmsException extends GeneralSecurityException {

    public CmsException(String message) {
        super(message);
    }

    public CmsException(String message, Throwable cause) {
        super(message, cause);
    }
}
