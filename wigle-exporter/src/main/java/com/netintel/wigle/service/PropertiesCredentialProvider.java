package com.netintel.wigle.service;

import com.netintel.wigle.config.WigleExporterProperties;
import com.netintel.wigle.model.ApiCredentials;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads the API name and token from wigle-exporter.credentials.* (usually bound from
 * WIGLE_API_NAME / WIGLE_API_TOKEN).
 */
@Component
@RequiredArgsConstructor
public class PropertiesCredentialProvider implements CredentialProvider {

    private final WigleExporterProperties properties;

    @Override
    public Optional<ApiCredentials> credentials() {
        WigleExporterProperties.Credentials c = properties.getCredentials();
        if (isBlank(c.getApiName()) || isBlank(c.getApiToken())) {
            return Optional.empty();
        }
        return Optional.of(new ApiCredentials(c.getApiName().trim(), c.getApiToken().trim()));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
