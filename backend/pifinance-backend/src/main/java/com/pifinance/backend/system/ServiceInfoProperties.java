package com.pifinance.backend.system;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pifinance.app")
public class ServiceInfoProperties {

    private String name = "Pi Finance API";
    private String version = "1.0.0";

    public String getName() {
        return name;
    }

    public void setName(String name) {
        if (name != null && !name.isBlank()) {
            this.name = name;
        }
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        if (version != null && !version.isBlank()) {
            this.version = version;
        }
    }
}
