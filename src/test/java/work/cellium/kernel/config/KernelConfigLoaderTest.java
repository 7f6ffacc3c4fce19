package work.cellium.kernel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.cellium.kernel.api.KernelConfiguration;
import work.cellium.kernel.api.LoadPolicy;

class KernelConfigLoaderTest {
    private static final Path FIXTURES = Path.of("src", "test", "resources", "config");

    @Test
    void readsToml() {
        var config = KernelConfigLoader.load(FIXTURES.resolve("kernel.toml"));

        assertEquals(List.of("work.cellium.kernel.demo.GreeterCell", "work.cellium.kernel.demo.JsonTestCell"), config.cells());
        assertEquals(LoadPolicy.LENIENT, config.loadPolicy());
        assertEquals(false, config.builtinCells());
        assertEquals(2, config.workers());
        assertEquals(8, config.queueCapacity());
        assertEquals(Duration.ofMillis(1500), config.defaultTimeout());
        assertEquals(Duration.ofSeconds(2), config.shutdownGrace());
        assertEquals(List.of("-Xmx64m"), config.workerJvmOptions());
    }

    @Test
    void yamlAndTomlAreEquivalent() {
        assertEquals(
            KernelConfigLoader.load(FIXTURES.resolve("kernel.toml")),
            KernelConfigLoader.load(FIXTURES.resolve("kernel.yaml"))
        );
    }

    @Test
    void absentKeysKeepDefaults(@TempDir Path dir) throws Exception {
        var file = dir.resolve("minimal.toml");
        Files.writeString(file, "cells = [\"a.B\"]\n");

        var config = KernelConfigLoader.load(file);

        assertEquals(List.of("a.B"), config.cells());
        assertEquals(LoadPolicy.STRICT, config.loadPolicy());
        assertEquals(KernelConfiguration.DEFAULT_QUEUE_CAPACITY, config.queueCapacity());
        assertEquals(KernelConfiguration.DEFAULT_TIMEOUT, config.defaultTimeout());
        assertTrue(config.builtinCells());
    }

    @Test
    void acceptsJson(@TempDir Path dir) throws Exception {
        var file = dir.resolve("kernel.json");
        Files.writeString(file, "{\"cells\": [\"a.B\"], \"process\": {\"workers\": 0, \"default_timeout\": 250}}");

        var config = KernelConfigLoader.load(file);

        assertEquals(0, config.workers());
        assertEquals(Duration.ofMillis(250), config.defaultTimeout());
    }

    @Test
    void invalidValuesNameTheKey() {
        var ex = assertThrows(IllegalArgumentException.class,
            () -> KernelConfigLoader.load(FIXTURES.resolve("invalid-workers.toml")));
        assertTrue(ex.getMessage().contains("process.workers"), ex.getMessage());
    }

    @Test
    void invalidLoadPolicyIsRejected(@TempDir Path dir) throws Exception {
        var file = dir.resolve("policy.yaml");
        Files.writeString(file, "kernel:\n  load_policy: sometimes\n");

        var ex = assertThrows(IllegalArgumentException.class, () -> KernelConfigLoader.load(file));
        assertTrue(ex.getMessage().contains("kernel.load_policy"), ex.getMessage());
    }

    @Test
    void rejectsMalformedTomlAndUnknownExtensions(@TempDir Path dir) throws Exception {
        var broken = dir.resolve("broken.toml");
        Files.writeString(broken, "cells = [\n");
        assertThrows(IllegalArgumentException.class, () -> KernelConfigLoader.load(broken));

        var ini = dir.resolve("kernel.ini");
        Files.writeString(ini, "workers=1");
        assertThrows(IllegalArgumentException.class, () -> KernelConfigLoader.load(ini));
        assertThrows(IllegalArgumentException.class, () -> KernelConfigLoader.load(dir.resolve("missing.toml")));
    }
}
