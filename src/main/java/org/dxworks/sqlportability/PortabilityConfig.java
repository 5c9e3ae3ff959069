package org.dxworks.sqlportability;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class PortabilityConfig {

    public static final String CONFIG_FILE_NAME = ".dbt-multi-adapter.yml";
    private static final String DEFAULT_MACRO_OUTPUT = "macros/portable_functions.sql";
    private static final String DEFAULT_MODEL_PATH = "models";
    private static final boolean DEFAULT_SCAN_PROJECT = true;

    private final List<String> adapters;
    private final Path macroOutput;
    private final boolean scanProject;
    private final List<Path> modelPaths;
    private final Path projectRoot;

    private PortabilityConfig(List<String> adapters,
                              Path macroOutput,
                              boolean scanProject,
                              List<Path> modelPaths,
                              Path projectRoot) {
        this.adapters = Collections.unmodifiableList(new ArrayList<>(adapters));
        this.macroOutput = macroOutput;
        this.scanProject = scanProject;
        this.modelPaths = Collections.unmodifiableList(new ArrayList<>(modelPaths));
        this.projectRoot = projectRoot;
    }

    /** Configured dialects in user order; the first one is primary. */
    public List<String> getAdapters() {
        return adapters;
    }

    public String getPrimaryAdapter() {
        return adapters.get(0);
    }

    public Path getMacroOutput() {
        return macroOutput;
    }

    public boolean isScanProject() {
        return scanProject;
    }

    public List<Path> getModelPaths() {
        return modelPaths;
    }

    public Path getProjectRoot() {
        return projectRoot;
    }

    public static PortabilityConfig load() throws IOException {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    /**
     * Reads a config file. Relative paths in it resolve against the file's directory.
     *
     * @throws FileNotFoundException when the file does not exist
     * @throws IllegalArgumentException when the file is empty or names fewer than two adapters
     */
    public static PortabilityConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new FileNotFoundException("Config file not found: " + configPath);
        }

        String content = Files.readString(configPath, StandardCharsets.UTF_8);
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        JsonNode tree = content.isBlank() ? null : yamlMapper.readTree(content);
        if (tree == null || tree.isMissingNode() || tree.isNull() || tree.isEmpty()) {
            throw new IllegalArgumentException("Config file is empty");
        }
        YamlConfig yamlConfig = yamlMapper.treeToValue(tree, YamlConfig.class);

        Path projectRoot = configPath.toAbsolutePath().getParent();
        return with(yamlConfig.adapters,
                projectRoot.resolve(yamlConfig.macroOutput != null ? yamlConfig.macroOutput : DEFAULT_MACRO_OUTPUT),
                yamlConfig.scanProject != null ? yamlConfig.scanProject : DEFAULT_SCAN_PROJECT,
                resolveAll(projectRoot, yamlConfig.modelPaths != null ? yamlConfig.modelPaths : List.of(DEFAULT_MODEL_PATH)),
                projectRoot);
    }

    /**
     * Builds a config directly. Model paths are dropped when scanning is off.
     */
    public static PortabilityConfig with(List<String> adapters,
                                         Path macroOutput,
                                         boolean scanProject,
                                         List<Path> modelPaths,
                                         Path projectRoot) {
        if (adapters == null || adapters.size() < 2) {
            throw new IllegalArgumentException("At least 2 adapters must be specified");
        }
        List<Path> effectiveModelPaths = scanProject ? modelPaths : List.of();
        return new PortabilityConfig(adapters, macroOutput, scanProject, effectiveModelPaths, projectRoot);
    }

    private static List<Path> resolveAll(Path root, List<String> paths) {
        List<Path> resolved = new ArrayList<>();
        for (String p : paths) {
            resolved.add(root.resolve(p));
        }
        return resolved;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class YamlConfig {
        public List<String> adapters;
        @JsonProperty("macro_output")
        public String macroOutput;
        @JsonProperty("scan_project")
        public Boolean scanProject;
        @JsonProperty("model_paths")
        public List<String> modelPaths;
    }
}
