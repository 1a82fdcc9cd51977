package com.netintel.wigle.model;

/**
 * API name and token, sent as HTTP Basic credentials.
 */
public record ApiCredentials(String name, String token) {

    @Override
    public String toString() {
        return "ApiCredentials[name=" + name + ", token=****]";
    }
}
