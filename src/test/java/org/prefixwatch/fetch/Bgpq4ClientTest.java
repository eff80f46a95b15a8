package org.prefixwatch.fetch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.prefixwatch.ObjectMapperFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Bgpq4ClientTest {

    @Test
    void buildsOneCommandPerAddressFamily() {
        final var client = new Bgpq4Client(ObjectMapperFactory.create(), List.of("bgpq4", "-h", "rr.ntt.net"),
                Duration.ofSeconds(5), "RADB", true);

        assertThat(client.commandLine("AS-EXAMPLE", false))
                .containsExactly("bgpq4", "-h", "rr.ntt.net", "-4", "-j", "-A", "-S", "RADB", "-l", "pl", "AS-EXAMPLE");
        assertThat(client.commandLine("AS-EXAMPLE", true)).contains("-6").doesNotContain("-4");
    }

    @Test
    void parsesPrefixListJson() throws Exception {
        final var client = new Bgpq4Client(ObjectMapperFactory.create(), List.of("bgpq4"), Duration.ofSeconds(5),
                "RADB", false);

        assertThat(client.parse("""
                {"pl": [
                  {"prefix": "192.0.2.0/24", "exact": true},
                  {"prefix": "198.51.100.0/22", "exact": false, "less-equal": 24},
                  {"exact": true}
                ]}
                """)).containsExactlyInAnyOrder("192.0.2.0/24", "198.51.100.0/22");
        assertThat(client.parse("  ")).isEmpty();
        assertThatThrownBy(() -> client.parse("not json")).isInstanceOf(IOException.class)
                .hasMessageStartingWith("Failed to parse bgpq4 JSON output");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void reportsEachFamilyFailureSeparately(@TempDir Path tempDir) throws Exception {
        final var script = tempDir.resolve("bgpq4.sh");
        Files.writeString(script, """
                if [ "$1" = "-4" ]; then
                  echo '{"pl": [{"prefix": "192.0.2.0/24", "exact": true}]}'
                else
                  echo 'no route6 data' >&2
                  exit 1
                fi
                """);
        final var client = new Bgpq4Client(ObjectMapperFactory.create(), List.of("sh", script.toString()),
                Duration.ofSeconds(10), "RADB", false);

        final var result = client.fetch("as64500");

        assertThat(result.ipv4Prefixes()).containsExactly("192.0.2.0/24");
        assertThat(result.ipv6Prefixes()).isEmpty();
        assertThat(result.sourcesQueried()).containsExactly("RADB");
        assertThat(result.errors()).containsExactly("IPv6 query failed: bgpq4 exited with code 1: no route6 data");
        assertThat(result.isTotalFailure()).isFalse();
    }

    @Test
    void missingBinaryFailsBothFamilies() {
        final var client = new Bgpq4Client(ObjectMapperFactory.create(), List.of("/nonexistent/bgpq4"),
                Duration.ofSeconds(5), "RADB", false);

        final var result = client.fetch("AS64500");

        assertThat(result.isTotalFailure()).isTrue();
        assertThat(result.errors()).hasSize(2);
        assertThat(result.errors().get(0)).startsWith("IPv4 query failed: Command not found: /nonexistent/bgpq4");
    }
}
