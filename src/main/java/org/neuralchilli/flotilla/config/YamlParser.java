package org.neuralchilli.flotilla.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.flotilla.domain.Capacity;
import org.neuralchilli.flotilla.domain.ExitAction;
import org.neuralchilli.flotilla.domain.ExitActionRules;
import org.neuralchilli.flotilla.domain.GroupSpec;
import org.neuralchilli.flotilla.domain.Platform;
import org.neuralchilli.flotilla.domain.Pool;
import org.neuralchilli.flotilla.domain.PoolStatus;
import org.neuralchilli.flotilla.domain.Priority;
import org.neuralchilli.flotilla.domain.ResourceRequest;
import org.neuralchilli.flotilla.domain.TaskSpec;
import org.neuralchilli.flotilla.domain.WorkflowSpec;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parses workflow and pool YAML into domain objects.
 * <p>
 * A workflow declares either {@code groups} or flat {@code tasks}, never both.
 * Durations accept ISO-8601 ({@code PT30M}) or a number with a unit suffix
 * ({@code 45s}, {@code 30m}, {@code 2h}, {@code 1d}).
 */
@ApplicationScoped
public class YamlParser {

    private final Yaml yaml = new Yaml();

    /**
     * Parse a workflow definition from YAML string
     */
    public WorkflowSpec parseWorkflow(String yamlContent) {
        return parseWorkflowFromMap(load(yamlContent));
    }

    /**
     * Parse a workflow definition from InputStream
     */
    public WorkflowSpec parseWorkflow(InputStream inputStream) {
        return parseWorkflowFromMap(load(inputStream));
    }

    /**
     * Parse pool definitions from YAML string
     */
    public List<Pool> parsePools(String yamlContent) {
        return parsePoolsFromMap(load(yamlContent));
    }

    /**
     * Parse pool definitions from InputStream
     */
    public List<Pool> parsePools(InputStream inputStream) {
        return parsePoolsFromMap(load(inputStream));
    }

    @SuppressWarnings("unchecked")
    private WorkflowSpec parseWorkflowFromMap(Map<String, Object> data) {
        String name = getString(data, "name", true);
        String pool = getString(data, "pool", true);
        Priority priority = Priority.fromString(getString(data, "priority", false));
        boolean reschedulePreempted = getBoolean(data, "reschedule_preempted", true);

        Map<String, Object> timeouts = getMap(data, "timeouts");
        Duration queueTimeout = parseDuration(getString(timeouts, "queue", false));
        Duration execTimeout = parseDuration(getString(timeouts, "exec", false));

        boolean hasGroups = data.containsKey("groups");
        boolean hasTasks = data.containsKey("tasks");
        if (hasGroups && hasTasks) {
            throw new IllegalArgumentException("Workflow '" + name + "' cannot declare both groups and tasks");
        }
        if (!hasGroups && !hasTasks) {
            throw new IllegalArgumentException("Workflow '" + name + "' must declare groups or tasks");
        }

        List<GroupSpec> groups;
        if (hasGroups) {
            groups = getMapList(data, "groups").stream()
                    .map(this::parseGroup)
                    .collect(Collectors.toList());
        } else {
            groups = getMapList(data, "tasks").stream()
                    .map(this::parseTask)
                    .map(GroupSpec::single)
                    .collect(Collectors.toList());
        }

        return new WorkflowSpec(name, pool, priority, groups, queueTimeout, execTimeout, reschedulePreempted);
    }

    private GroupSpec parseGroup(Map<String, Object> data) {
        String name = getString(data, "name", true);
        boolean ignoreNonleadStatus = getBoolean(data, "ignore_nonlead_status", true);
        boolean barrier = getBoolean(data, "barrier", true);

        List<Map<String, Object>> tasksList = getMapList(data, "tasks");
        if (tasksList.isEmpty()) {
            throw new IllegalArgumentException("Group '" + name + "' must have at least one task");
        }
        List<TaskSpec> tasks = tasksList.stream()
                .map(this::parseTask)
                .collect(Collectors.toList());

        return new GroupSpec(name, tasks, ignoreNonleadStatus, barrier);
    }

    private TaskSpec parseTask(Map<String, Object> data) {
        String name = getString(data, "name", true);
        boolean lead = getBoolean(data, "lead", false);
        String image = getString(data, "image", false);
        List<String> command = getStringList(data, "command", List.of());
        List<String> dependsOn = getStringList(data, "depends_on", List.of());

        Map<String, Object> resources = getMap(data, "resources");
        if (resources.isEmpty()) {
            throw new IllegalArgumentException("Task '" + name + "' must declare resources");
        }
        ResourceRequest request = new ResourceRequest(
                getInt(resources, "gpu", 0),
                getInt(resources, "cpu", 0),
                getInt(resources, "memory", 0),
                getInt(resources, "storage", 0),
                getString(resources, "platform", false),
                getBoolean(resources, "privileged", false),
                getBoolean(resources, "host_network", false)
        );

        return new TaskSpec(name, lead, image, command, request, dependsOn, parseExitActions(data, "exit_actions"));
    }

    private List<Pool> parsePoolsFromMap(Map<String, Object> data) {
        List<Map<String, Object>> poolsList = getMapList(data, "pools");
        List<Pool> pools = new ArrayList<>();
        for (Map<String, Object> poolData : poolsList) {
            pools.add(parsePool(poolData));
        }
        return pools;
    }

    private Pool parsePool(Map<String, Object> data) {
        String name = getString(data, "name", true);
        String backend = getString(data, "backend", true);
        PoolStatus status = PoolStatus.fromString(getString(data, "status", false));

        Map<Priority, Capacity> quota = new EnumMap<>(Priority.class);
        Map<String, Object> quotaData = getMap(data, "quota");
        for (Map.Entry<String, Object> entry : quotaData.entrySet()) {
            Priority priority = Priority.fromString(entry.getKey());
            Map<String, Object> limits = asMap(entry.getValue(), "quota." + entry.getKey());
            quota.put(priority, Capacity.of(getInt(limits, "gpu", 0), getInt(limits, "cpu", 0)));
        }

        List<Platform> platforms = getMapList(data, "platforms").stream()
                .map(platform -> new Platform(
                        getString(platform, "name", true),
                        getInt(platform, "gpu", 0),
                        getInt(platform, "cpu", 0),
                        getInt(platform, "memory", 0),
                        getInt(platform, "storage", 0),
                        getBoolean(platform, "privileged", false),
                        getBoolean(platform, "host_network", false)
                ))
                .collect(Collectors.toList());

        Map<String, Object> timeouts = getMap(data, "timeouts");

        return new Pool(
                name,
                backend,
                status,
                quota,
                platforms,
                parseExitActions(data, "default_exit_actions"),
                parseDuration(getString(timeouts, "queue", false)),
                parseDuration(getString(timeouts, "exec", false))
        );
    }

    private ExitActionRules parseExitActions(Map<String, Object> data, String key) {
        Map<String, String> raw = getStringMap(data, key, Map.of());
        if (raw.isEmpty()) {
            return ExitActionRules.NONE;
        }
        Map<ExitAction, String> ranges = new EnumMap<>(ExitAction.class);
        raw.forEach((action, range) -> ranges.put(ExitAction.fromString(action), range));
        return new ExitActionRules(ranges);
    }

    /**
     * Parse a duration in ISO-8601 or shorthand form. Null or blank means no duration.
     */
    static Duration parseDuration(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.toUpperCase(Locale.ROOT).startsWith("P")) {
            return Duration.parse(trimmed);
        }

        char unit = Character.toLowerCase(trimmed.charAt(trimmed.length() - 1));
        String digits = Character.isDigit(unit) ? trimmed : trimmed.substring(0, trimmed.length() - 1);
        long amount;
        try {
            amount = Long.parseLong(digits.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid duration: '" + value + "'", e);
        }
        return switch (unit) {
            case 's' -> Duration.ofSeconds(amount);
            case 'm' -> Duration.ofMinutes(amount);
            case 'h' -> Duration.ofHours(amount);
            case 'd' -> Duration.ofDays(amount);
            default -> {
                if (Character.isDigit(unit)) {
                    yield Duration.ofSeconds(amount);
                }
                throw new IllegalArgumentException("Invalid duration unit in '" + value + "'");
            }
        };
    }

    private Map<String, Object> load(Object source) {
        Object loaded = source instanceof InputStream
                ? yaml.load((InputStream) source)
                : yaml.load((String) source);
        if (loaded == null) {
            throw new IllegalArgumentException("YAML document is empty");
        }
        return asMap(loaded, "document");
    }

    // Helper methods for type-safe extraction

    private String getString(Map<String, Object> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new IllegalArgumentException("Missing required field: " + key);
            }
            return null;
        }
        return value.toString();
    }

    private boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString());
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Field '" + key + "' must be a number, got '" + value + "'", e);
        }
    }

    private List<String> getStringList(Map<String, Object> map, String key, List<String> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof List) {
            return ((List<?>) value).stream()
                    .map(Object::toString)
                    .collect(Collectors.toList());
        }
        // A single string is a one-element list
        return List.of(value.toString());
    }

    private Map<String, String> getStringMap(Map<String, Object> map, String key, Map<String, String> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Map) {
            Map<String, String> result = new HashMap<>();
            ((Map<?, ?>) value).forEach((k, v) ->
                    result.put(k.toString(), v != null ? v.toString() : null)
            );
            return result;
        }
        return defaultValue;
    }

    private Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value == null ? Map.of() : asMap(value, key);
    }

    private List<Map<String, Object>> getMapList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("Field '" + key + "' must be a list");
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            result.add(asMap(item, key));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String field) {
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Field '" + field + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }
}
