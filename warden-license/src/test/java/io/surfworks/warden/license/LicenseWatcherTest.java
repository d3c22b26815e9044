package io.surfworks.warden.license;

import io.surfworks.warden.license.engine.TestLicenses;
import io.surfworks.warden.license.metrics.MetricsSink;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link LicenseWatcher}.
 */
class LicenseWatcherTest {

    static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    static final Instant BUILD_DATE = Instant.parse("2025-12-01T00:00:00Z");
    static final MetricsSink NO_METRICS = (key, value) -> { };

    static final String LICENSE_A = TestLicenses.blob(
        "lic-a", NOW.plus(Duration.ofDays(90)), "AUDIT_LOGGING", "Multiregion Deployments");
    static final String LICENSE_B = TestLicenses.blob(
        "lic-b", NOW.plus(Duration.ofDays(365)), "RESOURCE_QUOTAS");

    private MutableClock clock;
    private FakeValidationEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        engine = new FakeValidationEngine(clock);
    }

    private LicenseWatcher newWatcher(String blob) {
        return new LicenseWatcher(blob, BUILD_DATE, engine, clock, NO_METRICS);
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("empty blob fails with guidance on all three license sources")
        void emptyBlob_failsWithConfigError() {
            var error = assertThrows(LicenseConfigException.class, () -> newWatcher(""));

            assertEquals(LicenseException.ErrorCode.CONFIG, error.errorCode());
            assertTrue(error.getMessage().contains(LicenseConfig.LICENSE_PATH_SETTING));
            assertTrue(error.getMessage().contains(LicenseConfig.ENV_LICENSE + " "));
            assertTrue(error.getMessage().contains(LicenseConfig.ENV_LICENSE_PATH));
            assertEquals(0, engine.newValidatorCalls.get());
            assertEquals(0, engine.newWatcherCalls.get());
        }

        @Test
        @DisplayName("null or blank blob fails with config error")
        void nullOrBlankBlob_failsWithConfigError() {
            assertThrows(LicenseConfigException.class, () -> newWatcher(null));
            assertThrows(LicenseConfigException.class, () -> newWatcher("  \n"));
            assertEquals(0, engine.newWatcherCalls.get());
        }

        @Test
        @DisplayName("unset build date fails without calling the engine")
        void unsetBuildDate_failsWithConfigError() {
            assertThrows(LicenseConfigException.class,
                () -> new LicenseWatcher(LICENSE_A, null, engine, clock, NO_METRICS));
            assertThrows(LicenseConfigException.class,
                () -> new LicenseWatcher(LICENSE_A, Instant.EPOCH, engine, clock, NO_METRICS));

            assertEquals(0, engine.newValidatorCalls.get());
            assertEquals(0, engine.newWatcherCalls.get());
        }

        @Test
        @DisplayName("invalid blob fails with validation error")
        void invalidBlob_failsWithValidationError() {
            var error = assertThrows(LicenseValidationException.class, () -> newWatcher("garbage"));

            assertEquals(LicenseException.ErrorCode.VALIDATION, error.errorCode());
            assertTrue(error.getMessage().startsWith("failed to initialize license"));
        }

        @Test
        @DisplayName("valid blob produces a watcher holding that license")
        void validBlob_storesSnapshot() {
            var watcher = newWatcher(LICENSE_A);

            assertEquals("lic-a", watcher.currentLicense().licenseId());
            assertEquals(LICENSE_A, watcher.currentBlob());
            assertEquals(LICENSE_A, watcher.fileLicense());
            assertEquals(BUILD_DATE, engine.lastBuildDate.get());
            assertEquals(EnumSet.of(Feature.AUDIT_LOGGING, Feature.MULTIREGION_DEPLOYMENTS), watcher.features());
        }

        @Test
        @DisplayName("create resolves the blob from config")
        void create_usesConfig() {
            var config = LicenseConfig.builder()
                .license(LICENSE_B)
                .buildDate(BUILD_DATE)
                .env(name -> null)
                .build();

            var watcher = LicenseWatcher.create(config, engine);

            assertEquals("lic-b", watcher.currentLicense().licenseId());
        }

        @Test
        @DisplayName("monitor is not started by construction")
        void construction_doesNotStartMonitor() {
            var watcher = newWatcher(LICENSE_A);

            assertEquals(0, engine.watcher().stopCalls.get());
            try (LicenseMonitor monitor = watcher.start()) {
                assertTrue(monitor.isRunning());
                assertThrows(IllegalStateException.class, watcher::start);
            }
        }
    }

    @Nested
    @DisplayName("setLicense")
    class SetLicense {

        @Test
        @DisplayName("applies the new license and its blob together")
        void validBlob_replacesSnapshot() {
            var watcher = newWatcher(LICENSE_A);

            watcher.setLicense(LICENSE_B);

            assertEquals("lic-b", watcher.currentLicense().licenseId());
            assertEquals(LICENSE_B, watcher.currentBlob());
            assertEquals(Set.of(Feature.RESOURCE_QUOTAS), watcher.currentLicense().features());
            assertEquals(LICENSE_A, watcher.fileLicense());
        }

        @Test
        @DisplayName("trailing line terminators are removed")
        void trailingNewlines_areTrimmed() {
            var watcher = newWatcher(LICENSE_A);

            watcher.setLicense(LICENSE_B + "\r\n\n");

            assertEquals(LICENSE_B, watcher.currentBlob());
        }

        @Test
        @DisplayName("invalid blob leaves the snapshot untouched")
        void invalidBlob_keepsSnapshot() {
            var watcher = newWatcher(LICENSE_A);
            var before = watcher.snapshot();

            var error = assertThrows(LicenseValidationException.class, () -> watcher.setLicense("{}"));

            assertTrue(error.getMessage().startsWith("error validating license"));
            assertSame(before, watcher.snapshot());
        }

        @Test
        @DisplayName("expired blob is rejected")
        void expiredBlob_isRejected() {
            var watcher = newWatcher(LICENSE_A);
            var expired = TestLicenses.blob("lic-old", NOW.minus(Duration.ofDays(1)), "AUDIT_LOGGING");

            assertThrows(LicenseValidationException.class, () -> watcher.setLicense(expired));
            assertEquals("lic-a", watcher.currentLicense().licenseId());
        }

        @Test
        @DisplayName("persistence failure leaves the snapshot untouched and is logged")
        void persistFailure_keepsSnapshot() {
            var watcher = newWatcher(LICENSE_A);
            var before = watcher.snapshot();
            engine.watcher().failPersist = true;

            try (LogCapture logs = LogCapture.attach(LicenseWatcher.class)) {
                var error = assertThrows(LicenseValidationException.class, () -> watcher.setLicense(LICENSE_B));

                assertTrue(error.getMessage().startsWith("failed to persist license"));
                assertEquals(1, logs.messages(Level.SEVERE).size());
            }
            assertSame(before, watcher.snapshot());
        }

        @Test
        @DisplayName("retrieval failure leaves the snapshot untouched")
        void retrieveFailure_keepsSnapshot() {
            var watcher = newWatcher(LICENSE_A);
            var before = watcher.snapshot();
            engine.watcher().failRetrieve = true;

            var error = assertThrows(LicenseValidationException.class, () -> watcher.setLicense(LICENSE_B));

            assertTrue(error.getMessage().startsWith("failed to retrieve license"));
            assertSame(before, watcher.snapshot());
        }

        @Test
        @DisplayName("unknown feature fails conversion and leaves the snapshot untouched")
        void conversionFailure_keepsSnapshot() {
            var watcher = newWatcher(LICENSE_A);
            var before = watcher.snapshot();
            var unknown = TestLicenses.blob("lic-x", NOW.plus(Duration.ofDays(10)), "Time Travel");

            var error = assertThrows(LicenseValidationException.class, () -> watcher.setLicense(unknown));

            assertTrue(error.getMessage().startsWith("failed to convert license"));
            assertSame(before, watcher.snapshot());
        }
    }

    @Nested
    @DisplayName("reload")
    class Reload {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("no configured license keeps the current one")
        void emptySource_isNoOp() {
            var watcher = newWatcher(LICENSE_A);
            var before = watcher.snapshot();

            watcher.reload(LicenseConfig.builder().buildDate(BUILD_DATE).env(name -> null).build());

            assertSame(before, watcher.snapshot());
        }

        @Test
        @DisplayName("license file is applied")
        void licenseFile_isApplied() throws IOException {
            var watcher = newWatcher(LICENSE_A);
            Path file = tempDir.resolve("warden.license");
            Files.writeString(file, LICENSE_B + "\n");

            watcher.reload(LicenseConfig.builder()
                .licensePath(file)
                .buildDate(BUILD_DATE)
                .env(name -> null)
                .build());

            assertEquals("lic-b", watcher.currentLicense().licenseId());
            assertEquals(LICENSE_B, watcher.currentBlob());
        }

        @Test
        @DisplayName("invalid license is rejected")
        void invalidLicense_isRejected() {
            var watcher = newWatcher(LICENSE_A);

            assertThrows(LicenseValidationException.class, () -> watcher.reload(LicenseConfig.builder()
                .env(Map.of(LicenseConfig.ENV_LICENSE, "not-a-license")::get)
                .build()));
            assertEquals("lic-a", watcher.currentLicense().licenseId());
        }

        @Test
        @DisplayName("missing license file is a config error")
        void missingFile_isConfigError() {
            var watcher = newWatcher(LICENSE_A);

            assertThrows(LicenseConfigException.class, () -> watcher.reload(LicenseConfig.builder()
                .licensePath(tempDir.resolve("absent.license"))
                .env(name -> null)
                .build()));
        }
    }

    @Nested
    @DisplayName("Entitlement")
    class Entitlement {

        @Test
        @DisplayName("licensed feature passes the check")
        void licensedFeature_passes() {
            var watcher = newWatcher(LICENSE_A);

            watcher.featureCheck(Feature.AUDIT_LOGGING, true);
            assertTrue(watcher.hasFeature(Feature.MULTIREGION_DEPLOYMENTS));
        }

        @Test
        @DisplayName("unlicensed feature fails with the feature named")
        void unlicensedFeature_fails() {
            var watcher = newWatcher(LICENSE_A);

            var error = assertThrows(UnlicensedFeatureException.class,
                () -> watcher.featureCheck(Feature.RESOURCE_QUOTAS, false));

            assertEquals(Feature.RESOURCE_QUOTAS, error.feature());
            assertEquals(LicenseException.ErrorCode.UNLICENSED_FEATURE, error.errorCode());
            assertEquals("Feature \"Resource Quotas\" is unlicensed", error.getMessage());
        }

        @Test
        @DisplayName("expired license reports no features but stays current")
        void expiredLicense_hasNoFeatures() {
            var watcher = newWatcher(LICENSE_A);

            clock.advance(Duration.ofDays(91));

            assertTrue(watcher.features().isEmpty());
            assertEquals("lic-a", watcher.currentLicense().licenseId());
            assertTrue(watcher.currentLicense().hasFeature(Feature.AUDIT_LOGGING));
            assertThrows(UnlicensedFeatureException.class,
                () -> watcher.featureCheck(Feature.AUDIT_LOGGING, false));
        }

        @Test
        @DisplayName("features follow the applied license while the file license is valid")
        void appliedLicense_providesFeatures() {
            var watcher = newWatcher(LICENSE_A);
            watcher.setLicense(LICENSE_B);

            assertEquals(Set.of(Feature.RESOURCE_QUOTAS), watcher.features());
        }

        @Test
        @DisplayName("expired file license empties features even if the applied license is valid")
        void expiredFileLicense_emptiesFeatures() {
            var watcher = newWatcher(LICENSE_A);
            watcher.setLicense(LICENSE_B);

            clock.advance(Duration.ofDays(91));

            assertTrue(watcher.features().isEmpty());
            assertEquals("lic-b", watcher.currentLicense().licenseId());
        }

        @Test
        @DisplayName("features set is unmodifiable")
        void features_areUnmodifiable() {
            var watcher = newWatcher(LICENSE_A);

            assertThrows(UnsupportedOperationException.class,
                () -> watcher.features().add(Feature.RESOURCE_QUOTAS));
        }

        @Test
        @DisplayName("unlicensed warning is throttled per feature")
        void unlicensedWarning_isThrottled() {
            var watcher = newWatcher(LICENSE_A);

            try (LogCapture logs = LogCapture.attach(LicenseWatcher.class)) {
                for (int i = 0; i < 10; i++) {
                    assertThrows(UnlicensedFeatureException.class,
                        () -> watcher.featureCheck(Feature.RESOURCE_QUOTAS, true));
                    clock.advance(Duration.ofSeconds(10));
                }
                assertEquals(1, logs.messages(Level.WARNING).size());

                assertThrows(UnlicensedFeatureException.class,
                    () -> watcher.featureCheck(Feature.AUTOMATED_BACKUPS, true));
                assertEquals(2, logs.messages(Level.WARNING).size());

                clock.advance(Duration.ofMinutes(5));
                for (int i = 0; i < 3; i++) {
                    assertThrows(UnlicensedFeatureException.class,
                        () -> watcher.featureCheck(Feature.RESOURCE_QUOTAS, true));
                }
                assertEquals(3, logs.messages(Level.WARNING).size());
                assertEquals("Feature \"Resource Quotas\" is unlicensed", logs.messages(Level.WARNING).get(2));
            }
        }

        @Test
        @DisplayName("no warning is logged without emitLog")
        void noEmitLog_logsNothing() {
            var watcher = newWatcher(LICENSE_A);

            try (LogCapture logs = LogCapture.attach(LicenseWatcher.class)) {
                assertThrows(UnlicensedFeatureException.class,
                    () -> watcher.featureCheck(Feature.RESOURCE_QUOTAS, false));

                assertTrue(logs.messages(Level.WARNING).isEmpty());
            }
            assertFalse(watcher.hasFeature(Feature.RESOURCE_QUOTAS));
        }
    }
}
