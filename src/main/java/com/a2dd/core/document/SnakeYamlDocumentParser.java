package com.a2dd.core.document;

import com.a2dd.core.conversion.UnsupportedConstructException;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * SnakeYAML-backed parser. Maps keep source order ({@code LinkedHashMap}) and scalars are
 * resolved with YAML 1.1 rules, so {@code yes}/{@code no} load as booleans and
 * {@code 0644} loads as an octal integer.
 */
@Component
public class SnakeYamlDocumentParser implements DocumentParser {

    @Override
    public Object parse(Path path) {
        try (Reader reader = Files.newBufferedReader(path)) {
            return newYaml().load(reader);
        } catch (IOException e) {
            throw new UnsupportedConstructException("Failed to read document: " + path, e);
        } catch (YAMLException e) {
            throw new UnsupportedConstructException("Failed to parse YAML in " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Object parse(String text) {
        try {
            return newYaml().load(text);
        } catch (YAMLException e) {
            throw new UnsupportedConstructException("Failed to parse YAML: " + e.getMessage(), e);
        }
    }

    private static Yaml newYaml() {
        var options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return new Yaml(new SafeConstructor(options));
    }
}
