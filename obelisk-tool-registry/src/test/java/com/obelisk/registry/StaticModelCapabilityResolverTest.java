package com.obelisk.registry;

import com.obelisk.config.ObeliskConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StaticModelCapabilityResolverTest {

    @Test
    void load_defaultsToBundledCatalog() {
        StaticModelCapabilityResolver resolver = StaticModelCapabilityResolver.load(ObeliskConfig.defaults());

        assertTrue(resolver.supportsToolCalls("openai/gpt-4o"));
        assertFalse(resolver.supportsToolCalls("meta-llama/llama-3-8b-instruct"));
        assertFalse(resolver.supportsToolCalls("unknown/model"));
        assertTrue(resolver.toolCapableModels().stream().allMatch(ModelCapability::supportsToolCalls));
    }

    @Test
    void fromFile_readsJsonCatalog(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("models.json");
        Files.writeString(file, """
                [
                  { "modelId": "a/one", "name": "Zeta", "supportsToolCalls": true, "contextLength": 4096 },
                  { "modelId": "b/two", "supportsToolCalls": false, "contextLength": 2048 }
                ]
                """);

        StaticModelCapabilityResolver resolver = StaticModelCapabilityResolver.fromFile(file);

        List<ModelCapability> all = resolver.allModels();
        assertEquals(2, all.size());
        assertEquals("b/two", all.get(0).name());
        assertEquals(4096, resolver.resolve("a/one").orElseThrow().contextLength());
    }

    @Test
    void constructor_rejectsDuplicateModelIds() {
        assertThrows(IllegalArgumentException.class, () -> new StaticModelCapabilityResolver(List.of(
                new ModelCapability("x", "X", true, 1),
                new ModelCapability("x", "X2", false, 1))));
    }
}
