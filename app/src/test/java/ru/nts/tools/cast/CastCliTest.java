/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.cast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.cast.compress.CompressionConfig;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CastCliTest {

    private static final String SERVICE = """
            public class AccountService {
                public void open(Account account) {
                    account.setOwner(request.getOwner());
                    account.setCurrency(request.getCurrency());
                }

                public int balance(Account account) {
                    if (account.isClosed()) {
                        return 0;
                    }
                    return account.getBalance();
                }
            }
            """;

    private static final String ORDER_MAPPER = """
            public class OrderMapper {
                public void fill(Order order, OrderRequest request) {
                    order.setCustomerIdentifier(request.getCustomerIdentifier());
                    order.setShippingAddress(request.getShippingAddress());
                    order.setBillingAddress(request.getBillingAddress());
                    order.setDeliveryInstructions(request.getDeliveryInstructions());
                }
            }
            """;

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return runWithEnv(Map.of(), args);
    }

    private int runWithEnv(Map<String, String> env, String... args) {
        return new CastCli().run(args, env,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private Path writeService() throws IOException {
        Path file = tempDir.resolve("AccountService.java");
        Files.writeString(file, SERVICE);
        return file;
    }

    @Test
    void perMethodOutput() throws IOException {
        Path file = writeService();

        int exitCode = run(file.toString());

        assertEquals(CastCli.EXIT_OK, exitCode, err.toString(StandardCharsets.UTF_8));
        JsonNode json = mapper.readTree(out.toString(StandardCharsets.UTF_8));
        assertEquals(file.toString(), json.get("file").asText());
        assertTrue(json.get("parser_available").asBoolean());
        assertEquals(2, json.get("chunks").size());
        assertEquals("open", json.get("chunks").get(0).get("metadata").get("method_name").asText());
        assertTrue(json.get("chunks").get(1).get("compressed_code").asText().contains("if "));
        assertEquals(2, json.get("summary").get("total_chunks").asInt());
    }

    @Test
    void wholeFileOutput() throws IOException {
        Path file = writeService();

        int exitCode = run(file.toString(), "--whole-file", "--threshold", "0.8", "--max-ratio", "0.5");

        assertEquals(CastCli.EXIT_OK, exitCode, err.toString(StandardCharsets.UTF_8));
        JsonNode json = mapper.readTree(out.toString(StandardCharsets.UTF_8));
        assertEquals(SERVICE, json.get("original_code").asText());
        assertTrue(json.has("compressed_code"));
        assertTrue(json.get("stats").has("total_nodes"));
        assertEquals(file.toString(), json.get("file").asText());
    }

    @Test
    void missingFileIsError() {
        int exitCode = run(tempDir.resolve("Missing.java").toString());

        assertEquals(CastCli.EXIT_ERROR, exitCode);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("[ERROR: FILE_NOT_FOUND]"));
        assertEquals("", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void unsupportedLanguageIsError() throws IOException {
        Path notes = tempDir.resolve("notes.txt");
        Files.writeString(notes, "plain text");

        int exitCode = run(notes.toString());

        assertEquals(CastCli.EXIT_ERROR, exitCode);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("[ERROR: LANGUAGE_UNSUPPORTED]"));
    }

    @Test
    void invalidConfigIsError() throws IOException {
        Path file = writeService();

        int exitCode = run(file.toString(), "--threshold", "1.5");

        assertEquals(CastCli.EXIT_ERROR, exitCode);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("[ERROR: CONFIG_INVALID]"));
    }

    @Test
    void invalidEnvironmentThresholdIsError() throws IOException {
        Path file = writeService();

        int exitCode = runWithEnv(Map.of(CompressionConfig.ENV_SIMILARITY_THRESHOLD, "abc"), file.toString());

        assertEquals(CastCli.EXIT_ERROR, exitCode);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("[ERROR: CONFIG_INVALID]"));
    }

    @Test
    void environmentThresholdAppliesAndFlagOverridesIt() throws IOException {
        Path file = tempDir.resolve("OrderMapper.java");
        Files.writeString(file, ORDER_MAPPER);
        Map<String, String> env = Map.of(CompressionConfig.ENV_SIMILARITY_THRESHOLD, "1.0");

        assertEquals(CastCli.EXIT_OK, runWithEnv(env, file.toString(), "--whole-file"));
        JsonNode strict = mapper.readTree(out.toString(StandardCharsets.UTF_8));
        assertEquals(0, strict.get("stats").get("merged_nodes").asInt(),
                "Different setters are never fully similar");

        out.reset();
        assertEquals(CastCli.EXIT_OK, runWithEnv(env, file.toString(), "--whole-file", "--threshold", "0.7"));
        JsonNode relaxed = mapper.readTree(out.toString(StandardCharsets.UTF_8));
        assertTrue(relaxed.get("stats").get("merged_nodes").asInt() > 0, "Flag must override environment");
        assertTrue(relaxed.get("compressed_code").asText().contains("/* 2x"));
    }

    @Test
    void compressesWithoutUseCastVariable() throws IOException {
        Path file = writeService();

        int exitCode = runWithEnv(Map.of(CompressionConfig.ENV_USE_CAST, "false"), file.toString());

        assertEquals(CastCli.EXIT_OK, exitCode, err.toString(StandardCharsets.UTF_8));
        JsonNode json = mapper.readTree(out.toString(StandardCharsets.UTF_8));
        for (JsonNode chunk : json.get("chunks")) {
            assertTrue(chunk.get("metadata").get("uses_cast").asBoolean());
        }
    }

    @Test
    void usageErrors() {
        assertEquals(CastCli.EXIT_USAGE, run());
        assertEquals(CastCli.EXIT_USAGE, run("A.java", "B.java"));
        assertEquals(CastCli.EXIT_USAGE, run("A.java", "--unknown"));
        assertEquals(CastCli.EXIT_USAGE, run("A.java", "--threshold"));
        assertEquals(CastCli.EXIT_USAGE, run("A.java", "--threshold", "abc"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage: nts-cast"));
    }

    @Test
    void help() {
        assertEquals(CastCli.EXIT_OK, run("--help"));
        assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("Usage: nts-cast"));
    }
}
