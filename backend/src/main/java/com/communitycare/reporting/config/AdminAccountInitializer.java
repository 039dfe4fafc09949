package com.communitycare.reporting.config;

import com.communitycare.reporting.model.UserAccount;
import com.communitycare.reporting.model.UserRole;
import com.communitycare.reporting.repository.UserAccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

/** Seeds an administrator on startup when the store has none, so a fresh install can be managed. */
@Component
public class AdminAccountInitializer implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(AdminAccountInitializer.class);

    private final UserAccountRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    @Value("${communitycare.bootstrap.admin.enabled:true}")
    private boolean enabled;

    @Value("${communitycare.bootstrap.admin.username:admin}")
    private String username;

    @Value("${communitycare.bootstrap.admin.email:admin@community.com}")
    private String email;

    @Value("${communitycare.bootstrap.admin.password:}")
    private String password;

    public AdminAccountInitializer(UserAccountRepository userRepository, PasswordEncoder passwordEncoder) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (!enabled) {
            return;
        }
        if (userRepository.existsByRole(UserRole.ADMIN)) {
            log.debug("[BOOTSTRAP] Administrator present, nothing to seed");
            return;
        }
        if (password == null || password.length() < 6) {
            log.warn("[BOOTSTRAP] No administrator exists and communitycare.bootstrap.admin.password is unset or shorter than 6 characters; skipping");
            return;
        }
        String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);
        UserAccount admin = new UserAccount(username, normalizedEmail, passwordEncoder.encode(password), null, UserRole.ADMIN);
        userRepository.save(admin);
        log.info("[BOOTSTRAP] Seeded administrator '{}' <{}>", username, normalizedEmail);
    }
}
