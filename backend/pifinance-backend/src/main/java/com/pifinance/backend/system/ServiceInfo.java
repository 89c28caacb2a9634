package com.pifinance.backend.system;

public record ServiceInfo(String name, String version, String status, String authentication) {}
