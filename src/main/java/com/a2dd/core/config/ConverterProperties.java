package com.a2dd.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Converter settings bound from {@code a2dd.*} in application YAML.
 */
@Component
@ConfigurationProperties(prefix = "a2dd")
public class ConverterProperties {

    private String unnamedTaskName = "Unnamed task";

    /**
     * Play keys whose values are flattened as task lists, matched in document order.
     * The underscore spellings Ansible uses are not matched by default.
     */
    private List<String> playTaskListKeys = List.of("pre-tasks", "tasks", "post-tasks");

    private List<String> yamlExtensions = List.of(".yml", ".yaml");

    /** Sort role and inventory files by path before processing. */
    private boolean sortDirectoryEntries = true;

    private Inventory inventory = new Inventory();

    public String getUnnamedTaskName() {
        return unnamedTaskName;
    }

    public void setUnnamedTaskName(String unnamedTaskName) {
        this.unnamedTaskName = unnamedTaskName;
    }

    public List<String> getPlayTaskListKeys() {
        return playTaskListKeys;
    }

    public void setPlayTaskListKeys(List<String> playTaskListKeys) {
        this.playTaskListKeys = playTaskListKeys;
    }

    public List<String> getYamlExtensions() {
        return yamlExtensions;
    }

    public void setYamlExtensions(List<String> yamlExtensions) {
        this.yamlExtensions = yamlExtensions;
    }

    public boolean isSortDirectoryEntries() {
        return sortDirectoryEntries;
    }

    public void setSortDirectoryEntries(boolean sortDirectoryEntries) {
        this.sortDirectoryEntries = sortDirectoryEntries;
    }

    public Inventory getInventory() {
        return inventory;
    }

    public void setInventory(Inventory inventory) {
        this.inventory = inventory;
    }

    public boolean isYamlFile(String fileName) {
        for (String ext : yamlExtensions) {
            if (fileName.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    public static class Inventory {
        private List<String> skipDirectories = List.of("molecule");
        private List<String> playTaskListKeys = List.of("tasks", "pre_tasks", "post_tasks");

        public List<String> getSkipDirectories() {
            return skipDirectories;
        }

        public void setSkipDirectories(List<String> skipDirectories) {
            this.skipDirectories = skipDirectories;
        }

        public List<String> getPlayTaskListKeys() {
            return playTaskListKeys;
        }

        public void setPlayTaskListKeys(List<String> playTaskListKeys) {
            this.playTaskListKeys = playTaskListKeys;
        }
    }
}
