package com.sdclogin.auth.bootstrap;

import com.sdclogin.auth.config.AuthProperties;
import com.sdclogin.auth.entity.User;
import com.sdclogin.auth.service.CredentialStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Startup runner that provisions the demo accounts.
 *
 * On application startup, this component:
 * 1. Provisions each demo user that does not exist yet (matched by user_id)
 * 2. Sets its password to auth.demo-accounts.password, only if no password is stored yet
 *
 * Existing accounts are left alone, so restarting never resets a changed name or password.
 * Disabled with auth.demo-accounts.enabled=false.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "auth.demo-accounts", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DemoAccountSeeder implements ApplicationRunner {

    public record DemoAccount(String userId, String email, String name) {
    }

    public static final List<DemoAccount> DEMO_ACCOUNTS = List.of(
            new DemoAccount("101", "nick.gravgaard@example.com", "Nick Gravgaard"),
            new DemoAccount("102", "shane.edwards@example.com", "Shane Edwards"),
            new DemoAccount("103", "david.carboni@example.com", "David Carboni"),
            new DemoAccount("104", "nic.price@example.com", "Nic Price"),
            new DemoAccount("105", "rich.ingram@example.com", "Rich Ingram"),
            new DemoAccount("106", "tom.underwood@example.com", "Tom Underwood"),
            new DemoAccount("107", "rachel.williams@example.com", "Rachel Williams"),
            new DemoAccount("108", "nige.sedgwich@example.com", "Nige Sedgwick"),
            new DemoAccount("109", "simon.houghton@example.com", "Simon Houghton"),
            new DemoAccount("110", "rob.kent@example.com", "Rob Kent"));

    private final CredentialStore credentialStore;
    private final AuthProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        log.info("=== Seeding demo accounts ===");
        int seeded = 0;
        for (DemoAccount account : DEMO_ACCOUNTS) {
            User user = credentialStore.provision(account.userId(), account.name(), account.email());
            if (!user.hasPassword()) {
                credentialStore.setPassword(account.userId(), properties.getDemoAccounts().getPassword());
                seeded++;
            }
        }
        log.info("Demo accounts ready: {} of {} newly given a password", seeded, DEMO_ACCOUNTS.size());
    }
}
