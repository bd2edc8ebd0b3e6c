package com.indigententerprises.telemetry.common.serviceinterfaces;

public interface IntegrityAuthority {

    /**
     * @return true when the authority knows the digest, false when it explicitly does not
     * @throws IntegrityCheckException on any other answer, or when the authority cannot be reached
     */
    boolean isRecognized(final String digest) throws IntegrityCheckException;
}
