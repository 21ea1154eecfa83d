package io.flowmodel;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowModelConfigTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void loadDefault_readsBundledSettings() {
        FlowModelConfig config = FlowModelConfig.loadDefault();

        assertThat(config.collectionTypes()).contains("java.util.List", "java.util.Map", "java.util.ArrayList");
        assertThat(config.collectionWriteMethods()).contains("add", "put", "offer", "push");
        assertThat(config.collectionReadMethods()).contains("get", "poll", "next");
        assertThat(config.hierarchyPruning()).isTrue();
        assertThat(config.staticFieldJumpSteps()).isFalse();
        assertThat(config.includeClasses()).isEmpty();
        assertThat(config.excludeClasses()).contains("module-info");
    }

    @Test
    void load_overlaysUserKeysOnDefaults() {
        FlowModelConfig config = FlowModelConfig.load(yaml("""
                collections:
                  writeMethods: [store]
                jumpSteps:
                  staticFields: true
                """));

        assertThat(config.collectionWriteMethods()).containsExactly("store");
        assertThat(config.collectionReadMethods()).contains("get");
        assertThat(config.collectionTypes()).contains("java.util.List");
        assertThat(config.staticFieldJumpSteps()).isTrue();
        assertThat(config.hierarchyPruning()).isTrue();
    }

    @Test
    void load_emptyDocumentKeepsDefaults() {
        FlowModelConfig config = FlowModelConfig.load(yaml(""));

        assertThat(config.collectionTypes()).isEqualTo(FlowModelConfig.loadDefault().collectionTypes());
    }

    @Test
    void load_rejectsNonMappingRoot() {
        assertThatThrownBy(() -> FlowModelConfig.load(yaml("- a\n- b\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mapping");
    }

    @Test
    void loadFromFile_readsYamlFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("flow-model.yaml");
        Files.writeString(file, "types:\n  hierarchyPruning: false\n");

        assertThat(FlowModelConfig.loadFromFile(file).hierarchyPruning()).isFalse();
    }

    @Test
    void withSwitches_copyOnlyTheChangedSetting() {
        FlowModelConfig defaults = FlowModelConfig.loadDefault();
        FlowModelConfig changed = defaults.withHierarchyPruning(false).withStaticFieldJumpSteps(true);

        assertThat(changed.hierarchyPruning()).isFalse();
        assertThat(changed.staticFieldJumpSteps()).isTrue();
        assertThat(changed.collectionTypes()).isEqualTo(defaults.collectionTypes());
        assertThat(defaults.hierarchyPruning()).isTrue();
    }

    @Test
    void matchesPattern_singleStarStaysWithinSegment() {
        assertThat(FlowModelConfig.matchesPattern("com.example.Foo", "com.example.*")).isTrue();
        assertThat(FlowModelConfig.matchesPattern("com.example.sub.Foo", "com.example.*")).isFalse();
        assertThat(FlowModelConfig.matchesPattern("com.example.FooTest", "com.example.*Test")).isTrue();
    }

    @Test
    void matchesPattern_doubleStarCrossesSegments() {
        assertThat(FlowModelConfig.matchesPattern("com.example.sub.Foo", "com.example.**")).isTrue();
        assertThat(FlowModelConfig.matchesPattern("com.example.package-info", "**.package-info")).isTrue();
        assertThat(FlowModelConfig.matchesPattern("org.other.Foo", "com.example.**")).isFalse();
    }

    @Test
    void matchesPattern_treatsDotsLiterally() {
        assertThat(FlowModelConfig.matchesPattern("comXexample.Foo", "com.example.Foo")).isFalse();
    }

    @Test
    void shouldLoadClass_excludesWinOverIncludes() {
        FlowModelConfig config = FlowModelConfig.load(yaml("""
                loader:
                  includeClasses: ["com.example.**"]
                  excludeClasses: ["**.*Test"]
                """));

        assertThat(config.shouldLoadClass("com.example.Service")).isTrue();
        assertThat(config.shouldLoadClass("com.example.ServiceTest")).isFalse();
        assertThat(config.shouldLoadClass("org.other.Service")).isFalse();
    }

    @Test
    void shouldLoadClass_emptyIncludesLoadEverythingNotExcluded() {
        FlowModelConfig config = FlowModelConfig.loadDefault();

        assertThat(config.shouldLoadClass("org.other.Service")).isTrue();
        assertThat(config.shouldLoadClass("module-info")).isFalse();
        assertThat(config.shouldLoadClass("com.example.package-info")).isFalse();
    }
}
