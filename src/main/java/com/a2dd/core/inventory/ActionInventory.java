package com.a2dd.core.inventory;

import com.a2dd.core.config.ConverterProperties;
import com.a2dd.core.conversion.ConversionException;
import com.a2dd.core.document.DocumentParser;
import com.a2dd.core.model.TaskNode;
import com.a2dd.core.resolve.ActionResolver;
import com.a2dd.core.resolve.FreeFormArgs;
import com.a2dd.core.resolve.Keywords;
import com.a2dd.core.resolve.ResolvedAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Surveys a corpus of playbooks, task files and roles: which modules are used and how often,
 * or which options a given module is called with. Useful to decide which translation rules
 * to write next.
 * <p>
 * Unlike conversion, problems are tolerated: unreadable files and unresolvable tasks are
 * logged, counted and skipped.
 */
@Service
public class ActionInventory {

    private static final Logger log = LoggerFactory.getLogger(ActionInventory.class);

    private final DocumentParser parser;
    private final ActionResolver resolver;
    private final ConverterProperties properties;

    public ActionInventory(DocumentParser parser, ActionResolver resolver, ConverterProperties properties) {
        this.parser = parser;
        this.resolver = resolver;
        this.properties = properties;
    }

    public InventoryReport countActions(List<Path> paths) {
        var counts = new HashMap<String, Long>();
        int[] errors = {0};
        for (Path file : files(paths)) {
            for (TaskNode task : tasks(file, errors)) {
                String action = actionOf(task, file, errors);
                if (action != null) {
                    counts.merge(action, 1L, Long::sum);
                }
            }
        }
        var sorted = new LinkedHashMap<String, Long>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(e -> sorted.put(e.getKey(), e.getValue()));
        return new InventoryReport(sorted, errors[0]);
    }

    /**
     * Option names passed to {@code module} across the corpus, sorted.
     */
    public SortedSet<String> collectOptions(List<Path> paths, String module) {
        var options = new TreeSet<String>();
        int[] errors = {0};
        for (Path file : files(paths)) {
            for (TaskNode task : tasks(file, errors)) {
                ResolvedAction resolved = resolve(task, file, errors);
                if (resolved == null || !resolved.action().equals(module)) {
                    continue;
                }
                Object value = resolved.moduleValue();
                if (value instanceof Map<?, ?> map) {
                    map.keySet().forEach(k -> options.add(String.valueOf(k)));
                } else if (value instanceof String text) {
                    options.addAll(FreeFormArgs.parse(text).keySet());
                }
            }
        }
        return options;
    }

    private String actionOf(TaskNode task, Path file, int[] errors) {
        for (String key : task.keys()) {
            if (Keywords.INCLUDE_KEYS.contains(key)) {
                return key;
            }
        }
        ResolvedAction resolved = resolve(task, file, errors);
        return resolved == null ? null : resolved.action();
    }

    private ResolvedAction resolve(TaskNode task, Path file, int[] errors) {
        try {
            return resolver.resolve(task);
        } catch (ConversionException e) {
            log.warn("Error in file {}: {}", file, e.getMessage());
            errors[0]++;
            return null;
        }
    }

    private List<TaskNode> tasks(Path file, int[] errors) {
        Object document;
        try {
            document = parser.parse(file);
        } catch (ConversionException e) {
            log.warn("Skipping {}: {}", file, e.getMessage());
            errors[0]++;
            return List.of();
        }
        var tasks = new ArrayList<TaskNode>();
        if (document instanceof List<?> entries) {
            collect(entries, tasks, true);
        }
        return tasks;
    }

    private void collect(List<?> entries, List<TaskNode> sink, boolean topLevel) {
        for (Object entry : entries) {
            if (!(entry instanceof Map<?, ?> map)) {
                continue;
            }
            if (map.get(Keywords.BLOCK_KEY) instanceof List<?> block) {
                collect(block, sink, false);
            } else if (topLevel && map.containsKey("hosts")) {
                for (String key : properties.getInventory().getPlayTaskListKeys()) {
                    if (map.get(key) instanceof List<?> playTasks) {
                        collect(playTasks, sink, false);
                    }
                }
            } else {
                sink.add(TaskNode.of(map));
            }
        }
    }

    private List<Path> files(List<Path> paths) {
        var result = new ArrayList<Path>();
        for (Path path : paths) {
            if (Files.isDirectory(path)) {
                try (Stream<Path> walk = Files.walk(path)) {
                    Stream<Path> files = walk
                            .filter(Files::isRegularFile)
                            .filter(p -> properties.isYamlFile(p.getFileName().toString()))
                            .filter(p -> !isSkipped(path, p));
                    if (properties.isSortDirectoryEntries()) {
                        files = files.sorted();
                    }
                    result.addAll(files.toList());
                } catch (IOException e) {
                    throw new ConversionException("Failed to walk " + path, e);
                }
            } else if (Files.isRegularFile(path)) {
                result.add(path);
            } else {
                log.warn("Skipping {}: no such file or directory", path);
            }
        }
        return result;
    }

    private boolean isSkipped(Path root, Path file) {
        for (Path component : root.relativize(file)) {
            if (properties.getInventory().getSkipDirectories().contains(component.toString())) {
                return true;
            }
        }
        return false;
    }
}
