package promptbatch.engine.config;

import org.ini4j.Ini;
import promptbatch.engine.provider.OpenAiCompatibleAdapter;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    private static final String INI = String.join("\n",
            "[database]",
            "url = jdbc:h2:mem:from-ini",
            "pool_size = 3",
            "",
            "[server]",
            "port = 9090",
            "cron_secret = s3cret",
            "",
            "[driver]",
            "slice_size = 8",
            "slice_pause_ms = 500",
            "max_task_attempts = 5",
            "",
            "[reconciler]",
            "stale_threshold_ms = 60000",
            "",
            "[scheduler]",
            "zone = UTC",
            "window_start_hour = 1",
            "window_end_hour = 2",
            "",
            "[providers]",
            "openai_api_key = sk-ini",
            "gemini_base_url = http://localhost:1234/gemini",
            "claude_api_key =",
            "");

    @Test
    void defaultsMatchDocumentedValues() {
        EngineConfig config = EngineConfig.defaults();
        assertEquals(5, config.sliceSize());
        assertEquals(Duration.ofSeconds(2), config.slicePause());
        assertEquals(3, config.maxTaskAttempts());
        assertEquals(ZoneId.of("America/New_York"), config.runZone());
        assertEquals(3, config.windowStartHour());
        assertEquals(6, config.windowEndHour());
        assertFalse(config.hasCronSecret());
    }

    @Test
    void iniOverridesDefaults() throws Exception {
        EngineConfig config = EngineConfig.defaults().applyIni(new Ini(new StringReader(INI)));

        assertEquals("jdbc:h2:mem:from-ini", config.databaseUrl());
        assertEquals(3, config.databasePoolSize());
        assertEquals(9090, config.serverPort());
        assertTrue(config.hasCronSecret());
        assertEquals(8, config.sliceSize());
        assertEquals(Duration.ofMillis(500), config.slicePause());
        assertEquals(5, config.maxTaskAttempts());
        assertEquals(Duration.ofMinutes(1), config.staleThreshold());
        assertEquals(ZoneId.of("UTC"), config.runZone());
        assertEquals("sk-ini", config.providerKey("openai"));
        assertNull(config.providerKey("claude"), "Blank keys are ignored");
        assertEquals("http://localhost:1234/gemini", config.providerBaseUrl("gemini", "fallback"));
        assertEquals("fallback", config.providerBaseUrl("openai", "fallback"));
    }

    @Test
    void environmentWinsOverIni() throws Exception {
        EngineConfig config = EngineConfig.defaults()
                .applyIni(new Ini(new StringReader(INI)))
                .applyEnv(Map.of(
                        "PROMPTBATCH_PORT", "7070",
                        "PROMPTBATCH_SLICE_SIZE", "2",
                        "OPENAI_API_KEY", "sk-env",
                        "ANTHROPIC_API_KEY", "sk-ant"));

        assertEquals(7070, config.serverPort());
        assertEquals(2, config.sliceSize());
        assertEquals(5, config.maxTaskAttempts());
        assertEquals("sk-env", config.providerKey("openai"));
        assertEquals("sk-ant", config.providerKey("claude"));
    }

    @Test
    void fluentSettersOverrideDefaults() {
        EngineConfig config = EngineConfig.defaults()
                .withMaxTaskAttempts(1)
                .withLeaseLivenessWindow(Duration.ofSeconds(5))
                .withStaleThreshold(Duration.ofSeconds(20))
                .withReconcileInterval(Duration.ofSeconds(30))
                .withTriggerCheckInterval(Duration.ofMinutes(1))
                .withRunZone(ZoneId.of("Europe/Berlin"))
                .withExecutionWindow(0, 24)
                .withProviderBaseUrl("openai", "http://localhost:9/v1");

        assertEquals(1, config.maxTaskAttempts());
        assertEquals(Duration.ofSeconds(5), config.leaseLivenessWindow());
        assertEquals(Duration.ofSeconds(20), config.staleThreshold());
        assertEquals(Duration.ofSeconds(30), config.reconcileInterval());
        assertEquals(Duration.ofMinutes(1), config.triggerCheckInterval());
        assertEquals(ZoneId.of("Europe/Berlin"), config.runZone());
        assertEquals(0, config.windowStartHour());
        assertEquals(24, config.windowEndHour());
        assertEquals("http://localhost:9/v1", config.providerBaseUrl("openai", OpenAiCompatibleAdapter.OPENAI_URL));
    }

    @Test
    void toStringHidesSecrets() {
        String text = EngineConfig.defaults()
                .withCronSecret("hunter2")
                .withProviderKey("openai", "sk-private")
                .toString();
        assertFalse(text.contains("hunter2"));
        assertFalse(text.contains("sk-private"));
        assertTrue(text.contains("cronSecretSet=true"));
    }
}
