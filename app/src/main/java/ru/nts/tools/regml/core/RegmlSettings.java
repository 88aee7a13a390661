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
package ru.nts.tools.regml.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Настройки движка.
 *
 * <p>Источники в порядке возрастания приоритета:
 * <ol>
 *     <li>встроенный {@code regml.properties};</li>
 *     <li>файл, указанный в переменной окружения {@code REGML_SETTINGS_FILE};</li>
 *     <li>системные свойства Java ({@code -Dregml.root=...});</li>
 *     <li>переменные окружения ({@code REGML_ROOT}, {@code REGML_JSON_ROOT}, {@code REGML_THREADS}).</li>
 * </ol>
 *
 * Регуляции хранятся в {@code <root>/regulation/<part>/<version>.json},
 * уведомления в {@code <root>/notice/<part>/<documentNumber>.json}.
 */
public final class RegmlSettings {

    private static final Logger log = LoggerFactory.getLogger(RegmlSettings.class);

    public static final String ROOT = "regml.root";
    public static final String JSON_ROOT = "regml.json.root";
    public static final String THREADS = "regml.threads";
    public static final String SINGULAR_EXCEPTIONS = "regml.singular.exceptions";

    private static final String DEFAULTS_RESOURCE = "/regml.properties";
    private static final String SETTINGS_FILE_ENV = "REGML_SETTINGS_FILE";
    private static final String JSON_SUFFIX = ".json";

    private final Path root;
    private final Path jsonRoot;
    private final int threads;
    private final Set<String> singularExceptions;

    private RegmlSettings(Path root, Path jsonRoot, int threads, Set<String> singularExceptions) {
        this.root = root;
        this.jsonRoot = jsonRoot;
        this.threads = threads;
        this.singularExceptions = singularExceptions;
    }

    /**
     * Загружает настройки из окружения текущего процесса.
     */
    public static RegmlSettings load() {
        return load(System.getenv(), System.getProperties());
    }

    /**
     * Загружает настройки из переданного окружения (используется в тестах).
     */
    public static RegmlSettings load(Map<String, String> env, Properties systemProperties) {
        Properties merged = new Properties();
        try (InputStream in = RegmlSettings.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                merged.load(in);
            }
        } catch (IOException e) {
            throw new RegmlException(RegmlErrorCode.IO_ERROR, Map.of("path", DEFAULTS_RESOURCE), e);
        }

        String settingsFile = env.get(SETTINGS_FILE_ENV);
        if (settingsFile != null && !settingsFile.isBlank()) {
            Path path = Paths.get(settingsFile);
            if (!Files.isRegularFile(path)) {
                throw RegmlFileException.notFound(path);
            }
            try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                merged.load(reader);
            } catch (IOException e) {
                throw RegmlFileException.notReadable(path, e);
            }
            log.debug("Settings loaded from {}", path);
        }

        for (String key : new String[]{ROOT, JSON_ROOT, THREADS, SINGULAR_EXCEPTIONS}) {
            String value = systemProperties.getProperty(key);
            if (value != null && !value.isBlank()) {
                merged.setProperty(key, value);
            }
            String envValue = env.get(toEnvName(key));
            if (envValue != null && !envValue.isBlank()) {
                merged.setProperty(key, envValue);
            }
        }
        return fromProperties(merged);
    }

    /**
     * Создает настройки напрямую из набора свойств, без окружения.
     */
    public static RegmlSettings fromProperties(Properties properties) {
        Path root = Paths.get(properties.getProperty(ROOT, "."));
        Path jsonRoot = Paths.get(properties.getProperty(JSON_ROOT, root.resolve("json").toString()));

        int threads = Runtime.getRuntime().availableProcessors();
        String threadValue = properties.getProperty(THREADS, "").trim();
        if (!threadValue.isEmpty()) {
            try {
                threads = Integer.parseInt(threadValue);
            } catch (NumberFormatException e) {
                throw new RegmlException(RegmlErrorCode.INTERNAL_ERROR,
                        Map.of("setting", THREADS, "value", threadValue), e);
            }
        }
        if (threads < 1) {
            threads = 1;
        }

        Set<String> exceptions = Arrays.stream(properties.getProperty(SINGULAR_EXCEPTIONS, "").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));

        return new RegmlSettings(root, jsonRoot, threads, Collections.unmodifiableSet(exceptions));
    }

    static String toEnvName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_');
    }

    public Path root() {
        return root;
    }

    public Path jsonRoot() {
        return jsonRoot;
    }

    public int threads() {
        return threads;
    }

    public Set<String> singularExceptions() {
        return singularExceptions;
    }

    public Path regulationDir(String part) {
        return root.resolve("regulation").resolve(part);
    }

    public Path noticeDir(String part) {
        return root.resolve("notice").resolve(part);
    }

    /**
     * Находит файл регуляции: путь как есть, затем относительно {@code <root>/regulation},
     * с суффиксом {@code .json} и без него.
     */
    public Path findRegulationFile(String name) {
        return findFile(name, root.resolve("regulation"));
    }

    /**
     * Находит файл уведомления: путь как есть, затем относительно {@code <root>/notice}.
     */
    public Path findNoticeFile(String name) {
        return findFile(name, root.resolve("notice"));
    }

    private static Path findFile(String name, Path base) {
        Path direct = Paths.get(name);
        if (Files.exists(direct)) {
            return direct;
        }
        Path inBase = base.resolve(name);
        if (Files.exists(inBase)) {
            return inBase;
        }
        if (!name.endsWith(JSON_SUFFIX)) {
            Path withSuffix = base.resolve(name + JSON_SUFFIX);
            if (Files.exists(withSuffix)) {
                return withSuffix;
            }
            Path directWithSuffix = Paths.get(name + JSON_SUFFIX);
            if (Files.exists(directWithSuffix)) {
                return directWithSuffix;
            }
        }
        throw RegmlFileException.notFound(name);
    }

    @Override
    public String toString() {
        return "RegmlSettings{root=" + root + ", jsonRoot=" + jsonRoot + ", threads=" + threads + "}";
    }
}
