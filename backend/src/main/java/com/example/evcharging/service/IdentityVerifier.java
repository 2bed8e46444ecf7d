package com.example.evcharging.service;

/**
 * Turns a request credential into the id of the user it authenticates.
 */
public interface IdentityVerifier {

    /**
     * @param credential raw {@code Authorization} header value, possibly null
     * @throws com.example.evcharging.exception.NotAuthenticatedException when the credential is missing or unknown
     */
    String verify(String credential);
}
