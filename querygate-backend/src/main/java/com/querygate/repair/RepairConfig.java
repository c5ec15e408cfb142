package com.querygate.repair;

import com.querygate.config.EnvironmentValues;
import org.springframework.core.env.Environment;

import java.util.Locale;

/**
 * Repair gateway configuration resolved from properties or environment variables.
 *
 * <p>Values may be scoped by profile: with {@code PORTKEY_PROFILE=PROD}, {@code PORTKEY_MODEL_PROD}
 * takes precedence over {@code PORTKEY_MODEL}.
 *
 * @param baseUrl gateway base URL
 * @param apiKey gateway API key
 * @param provider virtual key selecting the upstream provider
 * @param model model name
 * @param timeoutMs request timeout for one repair call
 */
public record RepairConfig(
        String baseUrl,
        String apiKey,
        String provider,
        String model,
        int timeoutMs
) {
    static final String DEFAULT_BASE_URL = "https://api.portkey.ai";
    static final int DEFAULT_TIMEOUT_MS = 20000;

    public static RepairConfig fromEnvironment(Environment environment) {
        String profile = EnvironmentValues.getTrimmed(environment, "querygate.repair.profile", "PORTKEY_PROFILE");
        String apiKey = EnvironmentValues.getTrimmed(environment, "querygate.repair.api-key", "PORTKEY_API_KEY");

        String baseUrl = resolveProfileValue(environment, "querygate.repair.base-url", "PORTKEY_BASE_URL", profile);
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_BASE_URL;
        }
        String provider = resolveProfileValue(environment, "querygate.repair.virtual-key", "PORTKEY_VIRTUAL_KEY", profile);
        String model = resolveProfileValue(environment, "querygate.repair.model", "PORTKEY_MODEL", profile);
        int timeoutMs = EnvironmentValues.getInt(environment, "querygate.repair.timeout-ms", "PORTKEY_TIMEOUT_MS", DEFAULT_TIMEOUT_MS);

        return new RepairConfig(stripTrailingSlash(baseUrl), apiKey, provider, model, timeoutMs);
    }

    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank()
                && provider != null && !provider.isBlank()
                && model != null && !model.isBlank();
    }

    private static String resolveProfileValue(Environment environment, String propKey, String envKey, String profile) {
        if (profile != null && !profile.isBlank()) {
            String suffix = profile.toUpperCase(Locale.ROOT);
            String profiled = EnvironmentValues.getTrimmed(environment, propKey + "." + suffix, envKey + "_" + suffix);
            if (profiled != null && !profiled.isBlank()) {
                return profiled;
            }
        }
        return EnvironmentValues.getTrimmed(environment, propKey, envKey);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
