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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.cast.chunk.ChunkCompressor;
import ru.nts.tools.cast.chunk.CodeChunk;
import ru.nts.tools.cast.chunk.CompressedChunk;
import ru.nts.tools.cast.chunk.MethodChunkExtractor;
import ru.nts.tools.cast.compress.CastCompressor;
import ru.nts.tools.cast.compress.CompressionConfig;
import ru.nts.tools.cast.core.CastErrorCode;
import ru.nts.tools.cast.core.CastException;
import ru.nts.tools.cast.core.treesitter.LanguageDetector;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Консольная точка входа: сжимает методы Java файла и печатает JSON в stdout.
 *
 * <pre>
 * java -jar nts-cast.jar Service.java [--threshold 0.7] [--max-ratio 0.6] [--whole-file]
 * </pre>
 *
 * Пороги берутся из CAST_SIMILARITY_THRESHOLD и CAST_MAX_COMPRESSION_RATIO, флаги их
 * переопределяют. USE_CAST здесь не учитывается: CLI вызывают ради сжатия.
 *
 * Логи идут в stderr, чтобы stdout оставался чистым JSON.
 */
public final class CastCli {

    private static final Logger log = LoggerFactory.getLogger(CastCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_ERROR = 2;

    private static final String USAGE =
            "Usage: nts-cast <file.java> [--threshold X] [--max-ratio Y] [--whole-file]";

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static void main(String[] args) {
        // На Windows стандартные потоки по умолчанию в системной кодировке, а JSON должен быть в UTF-8
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(System.err, true, StandardCharsets.UTF_8);
        System.exit(new CastCli().run(args, System.getenv(), out, err));
    }

    int run(String[] args, Map<String, String> env, PrintStream out, PrintStream err) {
        Path file = null;
        boolean wholeFile = false;
        Double threshold = null;
        Double maxRatio = null;

        try {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--threshold" -> threshold = parseNumber("--threshold", next(args, ++i));
                    case "--max-ratio" -> maxRatio = parseNumber("--max-ratio", next(args, ++i));
                    case "--whole-file" -> wholeFile = true;
                    case "-h", "--help" -> {
                        out.println(USAGE);
                        return EXIT_OK;
                    }
                    default -> {
                        if (arg.startsWith("--") || file != null) {
                            err.println("Unknown argument: " + arg);
                            err.println(USAGE);
                            return EXIT_USAGE;
                        }
                        file = Path.of(arg);
                    }
                }
            }
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        if (file == null) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        Path source = file;

        try {
            String language = LanguageDetector.detect(source)
                    .orElseThrow(() -> new CastException(CastErrorCode.LANGUAGE_UNSUPPORTED, "path", source));
            CompressionConfig.Builder builder = CompressionConfig.builderFromEnvironment(env).enabled(true);
            if (threshold != null) {
                builder.similarityThreshold(threshold);
            }
            if (maxRatio != null) {
                builder.maxCompressionRatio(maxRatio);
            }
            CompressionConfig config = builder.languageId(language).build();
            CastCompressor compressor = CastCompressor.create(config);
            // Без парсера методы не выделить: отдаём файл целиком в режиме passthrough
            boolean perMethod = !wholeFile && compressor.isParserAvailable();
            out.println(mapper.writeValueAsString(!perMethod
                    ? compressWholeFile(compressor, source)
                    : compressMethods(compressor, source)));
            return EXIT_OK;
        } catch (CastException e) {
            log.error(e.toLogMessage());
            err.println(e.toUserMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            log.error("Failed to write result", e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private ObjectNode compressMethods(CastCompressor compressor, Path file) {
        List<CodeChunk> chunks = new MethodChunkExtractor().extract(file);
        List<CompressedChunk> compressed = new ChunkCompressor(compressor).apply(chunks);

        ObjectNode root = mapper.createObjectNode();
        root.put("file", file.toString());
        root.put("parser_available", compressor.isParserAvailable());
        ArrayNode array = root.putArray("chunks");
        for (CompressedChunk chunk : compressed) {
            array.add(chunk.toJson(mapper));
        }
        root.set("summary", mapper.valueToTree(ChunkCompressor.summarize(compressed)));
        return root;
    }

    private ObjectNode compressWholeFile(CastCompressor compressor, Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new CastException(CastErrorCode.FILE_NOT_FOUND, Map.of("path", file), e);
        } catch (IOException e) {
            throw new CastException(CastErrorCode.FILE_NOT_READABLE, Map.of("path", file), e);
        }
        ObjectNode root = compressor.compress(content).toJson(mapper);
        root.put("file", file.toString());
        return root;
    }

    private static String next(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[index - 1]);
        }
        return args[index];
    }

    private static double parseNumber(String name, String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + name + ": " + raw);
        }
    }
}
