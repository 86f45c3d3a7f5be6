package com.driftsentinel.core.config;

import com.driftsentinel.core.detection.SpecificationRegistry;
import com.driftsentinel.core.error.ConfigException;
import com.driftsentinel.core.model.ElementKind;
import com.driftsentinel.core.model.ExpectedElement;
import com.driftsentinel.core.model.Specification;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SpecificationLoader}.
 */
class SpecificationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should register exact paths and globs")
    void shouldLoadSpecifications() {
        SpecificationRegistry registry = SpecificationLoader.fromClasspath("test-specifications.yml");

        assertThat(registry.size()).isEqualTo(2);
        Specification calc = registry.specificationFor("src/calc.py").orElseThrow();
        assertThat(calc.reference()).isEqualTo("calc@docs/calc.md");
        assertThat(calc.getRevision()).isEqualTo("3");
        assertThat(calc.getElements()).extracting(ExpectedElement::getId).containsExactly("calc", "sum");
        assertThat(calc.findElement("sum").orElseThrow().getBehaviorHash()).isEqualTo("b-1");

        Specification payments = registry.specificationFor("src/payments/api.py").orElseThrow();
        assertThat(payments.getName()).isEqualTo("payments");
        assertThat(payments.findElement("charge").orElseThrow().isStablePublicApi()).isTrue();
        assertThat(payments.findElement("requests").orElseThrow().getKind()).isEqualTo(ElementKind.DEPENDENCY);

        assertThat(registry.specificationFor("src/other.py")).isEmpty();
    }

    @Test
    @DisplayName("Should reject a specification without paths")
    void shouldRejectSpecificationWithoutPaths() {
        assertThatThrownBy(() -> SpecificationLoader.fromClasspath("invalid-specifications.yml"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Specification 'orphan' declares no paths");
    }

    @Test
    @DisplayName("Should return an empty registry for an empty file")
    void shouldReturnEmptyRegistryForEmptyFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("specs.yml"), "");

        assertThat(SpecificationLoader.fromFile(file.toString()).size()).isZero();
    }

    @Test
    @DisplayName("Should wrap malformed YAML in a ConfigException")
    void shouldRejectMalformedYaml() throws IOException {
        Path file = Files.writeString(tempDir.resolve("specs.yml"), "specifications: [ {name: x\n");

        assertThatThrownBy(() -> SpecificationLoader.fromFile(file.toString()))
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("Malformed specifications YAML");
    }

    @Test
    @DisplayName("Should fail for a missing file")
    void shouldFailForMissingFile() {
        assertThatThrownBy(() -> SpecificationLoader.fromFile(tempDir.resolve("none.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Specifications file not found");
    }
}
