package com.netintel.wigle.service;

import com.netintel.wigle.config.WigleExporterProperties;
import com.netintel.wigle.model.ApiCredentials;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PropertiesCredentialProviderTest {

    @Test
    void shouldBeReadyOnlyWhenBothValuesAreSet() {
        WigleExporterProperties properties = new WigleExporterProperties();
        PropertiesCredentialProvider provider = new PropertiesCredentialProvider(properties);

        assertThat(provider.ready()).isFalse();

        properties.getCredentials().setApiName("AIDuser");
        properties.getCredentials().setApiToken("  ");
        assertThat(provider.ready()).isFalse();

        properties.getCredentials().setApiToken(" s3cret ");
        assertThat(provider.credentials()).contains(new ApiCredentials("AIDuser", "s3cret"));
    }

    @Test
    void shouldMaskTokenInToString() {
        assertThat(new ApiCredentials("AIDuser", "s3cret").toString()).doesNotContain("s3cret");
    }
}
