package com.communitycare.reporting.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Startup guard for the report store.
 *
 * The schema is owned by Flyway, so Hibernate must never create or drop tables outside a test profile:
 * doing so would wipe reports, notifications and the admin audit trail. Startup is aborted in that case.
 * An in-memory datasource or disabled Flyway is allowed but logged as a warning.
 */
@Configuration
public class DatabaseSafetyConfig {
    private static final Logger log = LoggerFactory.getLogger(DatabaseSafetyConfig.class);

    @Value("${spring.profiles.active:default}")
    private String activeProfiles;

    @Value("${spring.jpa.hibernate.ddl-auto:none}")
    private String ddlAuto;

    @Value("${spring.datasource.url:}")
    private String datasourceUrl;

    @Value("${spring.flyway.enabled:true}")
    private boolean flywayEnabled;

    @PostConstruct
    public void verifySchemaSafety() {
        String profiles = safeLower(activeProfiles);
        String ddl = safeLower(ddlAuto).replace('_', '-');
        String dsUrl = datasourceUrl == null ? "" : datasourceUrl;

        log.info("[DB_SAFETY] profiles='{}', ddl-auto='{}', flyway={}, datasource='{}'",
                activeProfiles, ddlAuto, flywayEnabled, dsUrl);

        boolean destructive = "create".equals(ddl) || "create-drop".equals(ddl);
        if (destructive && !profiles.contains("test")) {
            throw new IllegalStateException("ddl-auto=" + ddlAuto + " would drop the report store outside a test profile; refusing to start");
        }
        if (!flywayEnabled) {
            log.warn("[DB_SAFETY] Flyway disabled: the schema must already match V1__community_care_schema.sql");
        }
        if (dsUrl.toLowerCase().contains("mem:")) {
            log.warn("[DB_SAFETY] In-memory database: reports and audit history are lost on restart");
        }
    }

    private static String safeLower(String s) {
        return s == null ? "" : s.trim().toLowerCase();
    }
}
