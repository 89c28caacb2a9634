package com.pifinance.backend.system;

import java.time.OffsetDateTime;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@EnableConfigurationProperties(ServiceInfoProperties.class)
public class ServiceInfoController {

    private final ServiceInfoProperties properties;

    public ServiceInfoController(ServiceInfoProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/")
    public ServiceInfo getServiceInfo() {
        return new ServiceInfo(
                properties.getName(),
                properties.getVersion(),
                "running",
                "Required - Use X-API-Key header");
    }

    @GetMapping("/health")
    public HealthStatus getHealth() {
        return new HealthStatus("healthy", OffsetDateTime.now());
    }
}
