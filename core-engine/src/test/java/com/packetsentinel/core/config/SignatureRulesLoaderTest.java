package com.packetsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SignatureRulesLoader}.
 */
class SignatureRulesLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should load test rules from classpath")
    void shouldLoadFromClasspath() {
        SignatureRulesConfig config = SignatureRulesLoader.fromClasspath("test-signatures.yml");

        assertThat(config.getRules()).hasSize(2);
        SignatureRuleDefinition sql = config.getRules().get(0);
        assertThat(sql.getName()).isEqualTo("test_sql_injection");
        assertThat(sql.getType()).isEqualTo(SignatureRuleDefinition.TYPE_PATTERN);
        assertThat(sql.getPatterns()).hasSize(2);
        assertThat(config.getRules().get(1).getThreshold()).isEqualTo(20.0);
        assertThat(config.getRules().get(1).getWindowSeconds()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should load the bundled rule set")
    void shouldLoadBundledRules() {
        SignatureRulesConfig config = SignatureRulesLoader.load(null);

        assertThat(config.getRules())
                .extracting(SignatureRuleDefinition::getName)
                .contains("sql_injection", "xss_attack", "port_scan", "brute_force");
    }

    @Test
    @DisplayName("Should fall back to the bundled rules when the file is missing")
    void shouldFallBackWhenFileMissing() {
        SignatureRulesConfig config = SignatureRulesLoader.load(tempDir.resolve("nope.yml").toString());

        assertThat(config.getRules()).isNotEmpty();
    }

    @Test
    @DisplayName("Should load rules from a file path")
    void shouldLoadFromFile() throws IOException {
        Path file = tempDir.resolve("rules.yml");
        Files.writeString(file, String.join("\n",
                "rules:",
                "  - name: bad_agent",
                "    type: pattern",
                "    description: Bad agent",
                "    severity: low",
                "    field: USER_AGENT",
                "    patterns:",
                "      - 'evilbot'"));

        SignatureRulesConfig config = SignatureRulesLoader.load(file.toString());

        assertThat(config.getRules()).hasSize(1);
        assertThat(config.getRules().get(0).getField()).isEqualTo(SignatureRuleDefinition.FIELD_USER_AGENT);
    }

    @Test
    @DisplayName("Should fail validation for an unknown rule type")
    void shouldRejectUnknownType() {
        assertThatThrownBy(() -> SignatureRulesLoader.fromClasspath("invalid-signatures.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Unknown rule type");
    }

    @Test
    @DisplayName("Should reject duplicate rule names")
    void shouldRejectDuplicateNames() throws IOException {
        Path file = tempDir.resolve("dupes.yml");
        Files.writeString(file, String.join("\n",
                "rules:",
                "  - name: same",
                "    type: packet_burst",
                "    description: Burst",
                "    severity: high",
                "    threshold: 10",
                "  - name: same",
                "    type: packet_burst",
                "    description: Burst again",
                "    severity: high",
                "    threshold: 20"));

        assertThatThrownBy(() -> SignatureRulesLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("same");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> SignatureRulesLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }
}
