package com.vtb.attribution.config;

import com.vtb.attribution.models.DatabaseVersion;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AttributionConfigTest {

    @Test
    void testClasspathConfig() {
        AttributionConfig config = AttributionConfig.load();

        assertEquals(10, (int) config.getGenerator().getMinSize());
        assertEquals(50, (int) config.getGenerator().getMaxSize());
        assertEquals(0.5, config.getGenerator().getFractions().getAttackPatterns(), 1e-12);
        assertEquals(100, (int) config.getTraining().getPerLabel());
        assertEquals(27L, (long) config.getTraining().getSeed());
        assertEquals(DatabaseVersion.BASELINE, config.getTraining().baseline());
        assertEquals(3, (int) config.getModel().getTopN());
        assertEquals("meta_data.json", config.getModel().getMetadataFile());
    }

    @Test
    void testEachLoadIsIndependent() {
        AttributionConfig first = AttributionConfig.load();
        first.getTraining().setPerLabel(5);

        assertEquals(100, (int) AttributionConfig.load().getTraining().getPerLabel());
    }

    @Test
    void testExternalFileWithPartialOverrides(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("custom.yaml");
        Files.writeString(file, """
            training:
              perLabel: 7
              baselineVersion: "(1, 0, 0)"
            model:
              topN: 5
            unknownSection: true
            """);

        AttributionConfig config = AttributionConfig.load(file);
        assertEquals(7, (int) config.getTraining().getPerLabel());
        assertEquals(DatabaseVersion.parse("(1, 0, 0)"), config.getTraining().baseline());
        assertEquals(5, (int) config.getModel().getTopN());
        assertEquals(0.2, config.getTraining().getTestFraction(), 1e-12, "Незаданные значения по умолчанию");
        assertEquals(0.1, config.getGenerator().getFractions().getOther(), 1e-12);
        assertEquals("data", config.getModel().getLocation());
    }

    @Test
    void testMissingOrBrokenFile(@TempDir Path tempDir) throws Exception {
        assertThrows(IllegalArgumentException.class, () -> AttributionConfig.load(tempDir.resolve("missing.yaml")));

        Path broken = tempDir.resolve("broken.yaml");
        Files.writeString(broken, "training: [unclosed");
        assertThrows(IllegalArgumentException.class, () -> AttributionConfig.load(broken));
    }

    @Test
    void testDefaults() {
        AttributionConfig config = AttributionConfig.defaults();
        assertEquals(1.5, config.getGenerator().getAlpha(), 1e-12);
        assertEquals(10.0, config.getGenerator().getBeta(), 1e-12);
        assertEquals("model.ser", config.getModel().getModelFile());
    }
}
