package com.setcubes.config;

import com.setcubes.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads engine configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static EngineConfig load(String path) {
        log.info("Loading SetCubes configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration not found: " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static EngineConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // Settings may sit at the root or under a 'setcubes' key
        Map<String, Object> engine = root.containsKey("setcubes")
                ? (Map<String, Object>) root.get("setcubes")
                : root;

        String name = getString(engine, "name", "setcubes");
        String version = getString(engine, "version", "1.0");
        GroupingConfig grouping = parseGrouping(section(engine, "grouping"));
        SearchConfig search = parseSearch(section(engine, "search"));
        BatchConfig batch = parseBatch(section(engine, "batch"));
        List<ScenarioConfig> scenarios = parseScenarios(engine.get("scenarios"));

        EngineConfig config = new EngineConfig(name, version, grouping, search, batch, scenarios);

        log.info("Loaded SetCubes configuration: {} v{} with {} scenarios, search budget {} steps / {}ms, {} batch threads",
                name, version, scenarios.size(), search.maxSteps(), search.timeoutMs(), batch.threads());

        return config;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("'" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static GroupingConfig parseGrouping(Map<String, Object> map) {
        if (map == null) {
            return GroupingConfig.defaults();
        }
        GroupingConfig defaults = GroupingConfig.defaults();
        return new GroupingConfig(
                getDouble(map, "token-extent", defaults.tokenExtent()),
                getDouble(map, "touch-tolerance", defaults.touchTolerance()));
    }

    private static SearchConfig parseSearch(Map<String, Object> map) {
        if (map == null) {
            return SearchConfig.defaults();
        }
        SearchConfig defaults = SearchConfig.defaults();
        return new SearchConfig(
                getLong(map, "max-steps", defaults.maxSteps()),
                getLong(map, "timeout-ms", defaults.timeoutMs()));
    }

    private static BatchConfig parseBatch(Map<String, Object> map) {
        if (map == null) {
            return BatchConfig.defaults();
        }
        return new BatchConfig(getInt(map, "threads", BatchConfig.defaults().threads()));
    }

    @SuppressWarnings("unchecked")
    private static List<ScenarioConfig> parseScenarios(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new ConfigurationException("'scenarios' must be a list");
        }
        List<Object> list = (List<Object>) value;

        List<ScenarioConfig> scenarios = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < list.size(); i++) {
            if (!(list.get(i) instanceof Map)) {
                throw new ConfigurationException("Scenario at index " + i + " must be a mapping");
            }
            Map<String, Object> map = (Map<String, Object>) list.get(i);
            String id = getString(map, "id", "scenario-" + i);
            if (!ids.add(id)) {
                throw new ConfigurationException("Duplicate scenario id '" + id + "'");
            }

            ScenarioConfig scenario = new ScenarioConfig(
                    id,
                    parseCards(map.get("cards"), id),
                    getString(map, "pool", ""),
                    getInt(map, "goal", 0),
                    getBoolean(map, "restrictions", false),
                    getString(map, "required", null));

            // Fail fast on malformed rounds rather than at first use
            scenario.toPuzzle();
            scenarios.add(scenario);
        }
        return scenarios;
    }

    private static List<Integer> parseCards(Object value, String id) {
        if (!(value instanceof List<?> raw)) {
            throw new ConfigurationException("Scenario '" + id + "' needs a 'cards' list");
        }
        List<Integer> cards = new ArrayList<>(raw.size());
        for (Object card : raw) {
            if (card instanceof Number number) {
                cards.add(number.intValue());
            } else {
                try {
                    cards.add(Integer.parseInt(card.toString().trim()));
                } catch (NumberFormatException e) {
                    throw new ConfigurationException("Scenario '" + id + "' has a non-numeric card: " + card, e);
                }
            }
        }
        return cards;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        return Integer.parseInt(value.toString());
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        return Long.parseLong(value.toString());
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).doubleValue();
        return Double.parseDouble(value.toString());
    }
}
