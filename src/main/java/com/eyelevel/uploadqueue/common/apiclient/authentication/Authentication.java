package com.eyelevel.uploadqueue.common.apiclient.authentication;

import java.util.Map;

/**
 * Defines the contract for applying authentication to an API request.
 */
public interface Authentication {

    /**
     * Adds the scheme's headers to the request headers.
     *
     * @param headers mutable header map of the outgoing request
     */
    void applyAuthentication(Map<String, String> headers);
}
