package com.wafsentinel.engine.hardening;

import com.wafsentinel.engine.SentinelException;

/**
 * A journal entry does not carry a valid signature.
 *
 * @author WAF Sentinel Team
 */
public class JournalIntegrityException extends SentinelException {

    public JournalIntegrityException(String message) {
        super(message);
    }
}
