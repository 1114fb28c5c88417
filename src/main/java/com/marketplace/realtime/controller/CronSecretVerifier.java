package com.marketplace.realtime.controller;

import com.marketplace.realtime.config.CronProperties;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the {@code Authorization: Bearer <secret>} header of cron calls. Under
 * the {@code production} profile a secret is always required; elsewhere the
 * check only applies once a secret is configured.
 */
@Component
public class CronSecretVerifier {

    static final String PRODUCTION_PROFILE = "production";

    private final CronProperties properties;
    private final Environment environment;

    public CronSecretVerifier(CronProperties properties, Environment environment) {
        this.properties = properties;
        this.environment = environment;
    }

    public boolean isAuthorized(String authorizationHeader) {
        boolean production = environment.acceptsProfiles(Profiles.of(PRODUCTION_PROFILE));
        if (!properties.hasSecret()) {
            return !production;
        }
        if (authorizationHeader == null) {
            return false;
        }
        byte[] expected = ("Bearer " + properties.getSecret()).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, authorizationHeader.getBytes(StandardCharsets.UTF_8));
    }
}
