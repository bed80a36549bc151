package com.sdclogin.auth.controller;

import com.sdclogin.auth.bootstrap.DemoAccountSeeder;
import com.sdclogin.auth.config.AuthProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Landing endpoint describing how to use the service.
 */
@RestController
@RequiredArgsConstructor
public class ServiceInfoController {

    private final AuthProperties properties;

    @GetMapping("/")
    public Map<String, Object> serviceInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", "sdc-login");
        info.put("endpoints", List.of(
                "POST /login with {\"email\": ..., \"password\": ...}",
                "GET /profile",
                "POST /profile with {\"name\": ...}"));
        info.put("tokenHeader", "Pass the token returned by /login in a \"token\" header for /profile requests.");
        if (properties.getDemoAccounts().isEnabled()) {
            info.put("demoEmails", DemoAccountSeeder.DEMO_ACCOUNTS.stream()
                    .map(DemoAccountSeeder.DemoAccount::email)
                    .toList());
        }
        return info;
    }
}
