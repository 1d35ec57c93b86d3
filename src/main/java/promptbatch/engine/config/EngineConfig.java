package promptbatch.engine.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration holder for the batch engine.
 * All settings have sensible defaults; an INI file and then environment
 * variables override them.
 */
public final class EngineConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/promptbatch;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";
    private String cronSecret = null; // If set, /internal/v1/* requires X-Cron-Secret

    // Driver settings
    private int sliceSize = 5;
    private Duration slicePause = Duration.ofSeconds(2);
    private Duration providerTimeout = Duration.ofSeconds(60);
    private int maxTaskAttempts = 3;
    private Duration leaseLivenessWindow = Duration.ofSeconds(30);
    private Duration driverCeiling = Duration.ofHours(2);
    private int driverThreads = 4;
    private int providerCallThreads = 16;

    // Reconciler settings
    private Duration staleThreshold = Duration.ofMinutes(2);
    private int reconcileScanLimit = 50;
    private Duration reconcileInterval = Duration.ofMinutes(2);

    // Trigger settings
    private Duration triggerCheckInterval = Duration.ofMinutes(15);
    private ZoneId runZone = ZoneId.of("America/New_York");
    private int windowStartHour = 3;
    private int windowEndHour = 6;

    // Providers
    private final Map<String, String> providerKeys = new HashMap<>();
    private final Map<String, String> providerBaseUrls = new HashMap<>();

    private Clock clock = Clock.systemUTC();

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        return defaults().applyEnv(System.getenv());
    }

    /**
     * Defaults, overridden by the INI file (if given) and then by the environment.
     */
    public static EngineConfig load(File iniFile) throws IOException {
        EngineConfig config = defaults();
        if (iniFile != null) {
            config.applyIni(new Ini(iniFile));
        }
        return config.applyEnv(System.getenv());
    }

    EngineConfig applyIni(Ini ini) {
        Profile.Section db = ini.get("database");
        if (db != null) {
            databaseUrl = str(db, "url", databaseUrl);
            databasePoolSize = integer(db, "pool_size", databasePoolSize);
        }

        Profile.Section server = ini.get("server");
        if (server != null) {
            serverPort = integer(server, "port", serverPort);
            serverHost = str(server, "host", serverHost);
            cronSecret = str(server, "cron_secret", cronSecret);
        }

        Profile.Section driver = ini.get("driver");
        if (driver != null) {
            sliceSize = integer(driver, "slice_size", sliceSize);
            slicePause = duration(driver, "slice_pause_ms", slicePause);
            providerTimeout = duration(driver, "provider_timeout_ms", providerTimeout);
            maxTaskAttempts = integer(driver, "max_task_attempts", maxTaskAttempts);
            leaseLivenessWindow = duration(driver, "lease_liveness_ms", leaseLivenessWindow);
            driverCeiling = duration(driver, "ceiling_ms", driverCeiling);
            driverThreads = integer(driver, "threads", driverThreads);
            providerCallThreads = integer(driver, "provider_threads", providerCallThreads);
        }

        Profile.Section reconciler = ini.get("reconciler");
        if (reconciler != null) {
            staleThreshold = duration(reconciler, "stale_threshold_ms", staleThreshold);
            reconcileScanLimit = integer(reconciler, "scan_limit", reconcileScanLimit);
            reconcileInterval = duration(reconciler, "interval_ms", reconcileInterval);
        }

        Profile.Section scheduler = ini.get("scheduler");
        if (scheduler != null) {
            triggerCheckInterval = duration(scheduler, "trigger_check_interval_ms", triggerCheckInterval);
            runZone = ZoneId.of(str(scheduler, "zone", runZone.getId()));
            windowStartHour = integer(scheduler, "window_start_hour", windowStartHour);
            windowEndHour = integer(scheduler, "window_end_hour", windowEndHour);
        }

        Profile.Section providers = ini.get("providers");
        if (providers != null) {
            for (String key : providers.keySet()) {
                String value = providers.get(key);
                if (value == null || value.isBlank()) {
                    continue;
                }
                if (key.endsWith("_api_key")) {
                    providerKeys.put(key.substring(0, key.length() - "_api_key".length()), value.trim());
                } else if (key.endsWith("_base_url")) {
                    providerBaseUrls.put(key.substring(0, key.length() - "_base_url".length()), value.trim());
                }
            }
        }
        return this;
    }

    EngineConfig applyEnv(Map<String, String> env) {
        String dbUrl = env.get("PROMPTBATCH_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            databaseUrl = dbUrl;
        }

        String port = env.get("PROMPTBATCH_PORT");
        if (port != null && !port.isBlank()) {
            serverPort = Integer.parseInt(port);
        }

        String secret = env.get("PROMPTBATCH_CRON_SECRET");
        if (secret != null && !secret.isBlank()) {
            cronSecret = secret;
        }

        String maxAttempts = env.get("PROMPTBATCH_MAX_ATTEMPTS");
        if (maxAttempts != null && !maxAttempts.isBlank()) {
            maxTaskAttempts = Integer.parseInt(maxAttempts);
        }

        String slice = env.get("PROMPTBATCH_SLICE_SIZE");
        if (slice != null && !slice.isBlank()) {
            sliceSize = Integer.parseInt(slice);
        }

        for (String provider : new String[] { "openai", "perplexity", "gemini", "anthropic" }) {
            String key = env.get(provider.toUpperCase(Locale.ROOT) + "_API_KEY");
            if (key != null && !key.isBlank()) {
                providerKeys.put("anthropic".equals(provider) ? "claude" : provider, key);
            }
        }
        return this;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String cronSecret() {
        return cronSecret;
    }

    public boolean hasCronSecret() {
        return cronSecret != null && !cronSecret.isBlank();
    }

    public int sliceSize() {
        return sliceSize;
    }

    public Duration slicePause() {
        return slicePause;
    }

    public Duration providerTimeout() {
        return providerTimeout;
    }

    public int maxTaskAttempts() {
        return maxTaskAttempts;
    }

    public Duration leaseLivenessWindow() {
        return leaseLivenessWindow;
    }

    public Duration driverCeiling() {
        return driverCeiling;
    }

    public int driverThreads() {
        return driverThreads;
    }

    public int providerCallThreads() {
        return providerCallThreads;
    }

    public Duration staleThreshold() {
        return staleThreshold;
    }

    public int reconcileScanLimit() {
        return reconcileScanLimit;
    }

    public Duration reconcileInterval() {
        return reconcileInterval;
    }

    public Duration triggerCheckInterval() {
        return triggerCheckInterval;
    }

    public ZoneId runZone() {
        return runZone;
    }

    public int windowStartHour() {
        return windowStartHour;
    }

    public int windowEndHour() {
        return windowEndHour;
    }

    public String providerKey(String provider) {
        return providerKeys.get(provider);
    }

    public String providerBaseUrl(String provider, String fallback) {
        return providerBaseUrls.getOrDefault(provider, fallback);
    }

    public Clock clock() {
        return clock;
    }

    // Fluent setters for testing/customization
    public EngineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public EngineConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public EngineConfig withCronSecret(String secret) {
        this.cronSecret = secret;
        return this;
    }

    public EngineConfig withSliceSize(int size) {
        this.sliceSize = size;
        return this;
    }

    public EngineConfig withSlicePause(Duration pause) {
        this.slicePause = pause;
        return this;
    }

    public EngineConfig withProviderTimeout(Duration timeout) {
        this.providerTimeout = timeout;
        return this;
    }

    public EngineConfig withMaxTaskAttempts(int attempts) {
        this.maxTaskAttempts = attempts;
        return this;
    }

    public EngineConfig withLeaseLivenessWindow(Duration window) {
        this.leaseLivenessWindow = window;
        return this;
    }

    public EngineConfig withDriverCeiling(Duration ceiling) {
        this.driverCeiling = ceiling;
        return this;
    }

    public EngineConfig withStaleThreshold(Duration threshold) {
        this.staleThreshold = threshold;
        return this;
    }

    public EngineConfig withReconcileInterval(Duration interval) {
        this.reconcileInterval = interval;
        return this;
    }

    public EngineConfig withTriggerCheckInterval(Duration interval) {
        this.triggerCheckInterval = interval;
        return this;
    }

    public EngineConfig withRunZone(ZoneId zone) {
        this.runZone = zone;
        return this;
    }

    public EngineConfig withExecutionWindow(int startHour, int endHour) {
        this.windowStartHour = startHour;
        this.windowEndHour = endHour;
        return this;
    }

    public EngineConfig withProviderKey(String provider, String key) {
        this.providerKeys.put(provider, key);
        return this;
    }

    public EngineConfig withProviderBaseUrl(String provider, String baseUrl) {
        this.providerBaseUrls.put(provider, baseUrl);
        return this;
    }

    public EngineConfig withClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    private static String str(Profile.Section section, String key, String fallback) {
        String value = section.get(key);
        return value != null && !value.isBlank() ? value.trim() : fallback;
    }

    private static int integer(Profile.Section section, String key, int fallback) {
        String value = section.get(key);
        return value != null && !value.isBlank() ? Integer.parseInt(value.trim()) : fallback;
    }

    private static Duration duration(Profile.Section section, String key, Duration fallback) {
        String value = section.get(key);
        return value != null && !value.isBlank() ? Duration.ofMillis(Long.parseLong(value.trim())) : fallback;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", sliceSize=" + sliceSize +
                ", maxTaskAttempts=" + maxTaskAttempts +
                ", zone=" + runZone +
                ", providersConfigured=" + providerKeys.keySet() +
                ", cronSecretSet=" + hasCronSecret() +
                '}';
    }
}
