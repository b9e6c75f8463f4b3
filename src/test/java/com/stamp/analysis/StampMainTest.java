package com.stamp.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.stamp.analysis.components.StampComponents;
import com.stamp.analysis.datasource.TestArchives;
import com.stamp.analysis.datasource.TextSpectrumReader;
import com.stamp.cube.CubeAssemblyException;
import com.stamp.cube.SourceFormat;
import com.stamp.util.JsonUtil;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StampMainTest {

    @TempDir
    Path tempDir;

    @Test
    void optionsFollowThePositionalArguments () {
        Map<String, String> options = StampMain.parseOptions(new String[] {
            "upload.zip", "out.json", "use_interpolation=true", "custom_bands=[{\"name\":\"a=b\"}]"
        });
        assertEquals(2, options.size());
        assertEquals("true", options.get("use_interpolation"));
        assertEquals("[{\"name\":\"a=b\"}]", options.get("custom_bands"));

        CubeAssemblyException e = assertThrows(CubeAssemblyException.class,
            () -> StampMain.parseOptions(new String[] {"upload.zip", "out.json", "smoothing"}));
        assertEquals(CubeAssemblyException.Kind.BAD_REQUEST, e.kind);
    }

    @Test
    void writesResultFile () throws Exception {
        File archive = TestArchives.zip(tempDir.resolve("upload.zip").toFile(),
            Map.of("visit.fits", TestArchives.spectra(60000, 0, 0.1, 0.2, 0.3)));
        File output = tempDir.resolve("result.json").toFile();
        StampComponents components = new StampComponents(StampConfig.fromResource("stamp-test.properties"),
            Map.of(SourceFormat.FITS, new TextSpectrumReader(3)));
        try {
            assertEquals(0, StampMain.run(components, archive, output, Map.of("smoothing_sigma", "1")));
        } finally {
            components.shutdown();
        }
        JsonNode tree = JsonUtil.objectMapper.readTree(output);
        assertEquals(4, tree.get("cube").get("timeAxis").size());
        assertEquals(1.0, tree.get("metadata").get("smoothingSigma").asDouble());
    }

    @Test
    void failedJobGivesNonZeroStatus () throws Exception {
        File archive = TestArchives.zip(tempDir.resolve("upload.zip").toFile(), Map.of("notes.txt", "none"));
        File output = tempDir.resolve("result.json").toFile();
        StampComponents components = new StampComponents(StampConfig.fromResource("stamp-test.properties"),
            Map.of(SourceFormat.FITS, new TextSpectrumReader(3)));
        try {
            assertEquals(1, StampMain.run(components, archive, output, Map.of()));
        } finally {
            components.shutdown();
        }
        assertFalse(output.exists());
    }

}
