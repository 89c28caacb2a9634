package com.pifinance.backend.system;

import java.time.OffsetDateTime;

public record HealthStatus(String status, OffsetDateTime timestamp) {}
