package dumb.kleis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.kleis.util.Json;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static dumb.kleis.Log.message;

/** Verifier settings, read from {@code kleis.json}. Missing keys take their defaults. */
public record Config(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("timeoutMs") int timeoutMs,
        @JsonProperty("checkConsistency") boolean checkConsistency,
        @JsonProperty("maxPowerExpansion") int maxPowerExpansion,
        @JsonProperty("capabilities") String capabilities
) {
    public static final String RESOURCE = "/kleis.json";

    public static final boolean DEFAULT_ENABLED = true;
    public static final int DEFAULT_TIMEOUT_MS = 5000;
    public static final boolean DEFAULT_CHECK_CONSISTENCY = true;
    public static final int DEFAULT_MAX_POWER_EXPANSION = 16;
    public static final String DEFAULT_CAPABILITIES = "z3";

    @JsonCreator
    public Config(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("timeoutMs") Integer timeoutMs,
            @JsonProperty("checkConsistency") Boolean checkConsistency,
            @JsonProperty("maxPowerExpansion") Integer maxPowerExpansion,
            @JsonProperty("capabilities") String capabilities
    ) {
        this(
                enabled != null ? enabled : DEFAULT_ENABLED,
                timeoutMs != null ? timeoutMs : DEFAULT_TIMEOUT_MS,
                checkConsistency != null ? checkConsistency : DEFAULT_CHECK_CONSISTENCY,
                maxPowerExpansion != null ? maxPowerExpansion : DEFAULT_MAX_POWER_EXPANSION,
                capabilities != null ? capabilities : DEFAULT_CAPABILITIES
        );
    }

    public Config() {
        this(DEFAULT_ENABLED, DEFAULT_TIMEOUT_MS, DEFAULT_CHECK_CONSISTENCY, DEFAULT_MAX_POWER_EXPANSION, DEFAULT_CAPABILITIES);
    }

    public Config(boolean enabled, int timeoutMs, boolean checkConsistency, int maxPowerExpansion, String capabilities) {
        if (timeoutMs <= 0) throw new IllegalArgumentException("timeoutMs must be positive: " + timeoutMs);
        if (maxPowerExpansion < 0) throw new IllegalArgumentException("maxPowerExpansion must not be negative: " + maxPowerExpansion);
        this.enabled = enabled;
        this.timeoutMs = timeoutMs;
        this.checkConsistency = checkConsistency;
        this.maxPowerExpansion = maxPowerExpansion;
        this.capabilities = capabilities;
    }

    /** Classpath {@code kleis.json}, or the defaults when there is none. */
    public static Config load() {
        try (var in = Config.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                message("No " + RESOURCE + " on the classpath, using defaults");
                return new Config();
            }
            return Json.obj(in, Config.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Unreadable " + RESOURCE, e);
        }
    }

    public static Config load(Path file) throws IOException {
        return parse(Files.readString(file));
    }

    public static Config parse(String json) throws JsonProcessingException {
        return Json.obj(json, Config.class);
    }

    public Config withEnabled(boolean enabled) {
        return new Config(enabled, timeoutMs, checkConsistency, maxPowerExpansion, capabilities);
    }

    public Config withTimeoutMs(int timeoutMs) {
        return new Config(enabled, timeoutMs, checkConsistency, maxPowerExpansion, capabilities);
    }

    public Config withCheckConsistency(boolean checkConsistency) {
        return new Config(enabled, timeoutMs, checkConsistency, maxPowerExpansion, capabilities);
    }
}
