package com.devportal.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.devportal.health.model.Component;
import com.devportal.health.model.Landscape;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EndpointResolver")
class EndpointResolverTest {

    private final Component accounts = Component.of("c1", "Accounts-Service");
    private final Landscape eu10 = new Landscape("eu10", "sap.hana.ondemand.com");

    @Test
    @DisplayName("builds the health URL from the lower-cased component name and route")
    void buildsHealthUrl() {
        assertThat(EndpointResolver.healthUrl(accounts, eu10))
                .isEqualTo("https://accounts-service.cfapps.sap.hana.ondemand.com/health");
    }

    @Test
    @DisplayName("prefixes the subdomain before the component host")
    void buildsSubdomainHealthUrl() {
        assertThat(EndpointResolver.healthUrl(accounts, eu10, "sap-provisioning"))
                .isEqualTo("https://sap-provisioning.accounts-service.cfapps.sap.hana.ondemand.com/health");
    }

    @Test
    @DisplayName("appends arbitrary paths for system info endpoints")
    void appendsPaths() {
        assertThat(EndpointResolver.probeUrl(accounts, eu10, EndpointResolver.SYSTEM_INFO_PATH))
                .isEqualTo("https://accounts-service.cfapps.sap.hana.ondemand.com/systemInformation/public");
        assertThat(EndpointResolver.probeUrl(accounts, eu10, "sap-x", EndpointResolver.VERSION_PATH))
                .isEqualTo("https://sap-x.accounts-service.cfapps.sap.hana.ondemand.com/version");
    }

    @Test
    @DisplayName("rejects missing arguments")
    void rejectsMissingArguments() {
        assertThatThrownBy(() -> EndpointResolver.healthUrl(null, eu10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("component");
        assertThatThrownBy(() -> EndpointResolver.healthUrl(accounts, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("landscape");
        assertThatThrownBy(() -> EndpointResolver.healthUrl(accounts, eu10, " "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("subdomain");
    }
}
