package it.unimib.datai.autolayer.core.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import it.unimib.datai.autolayer.common.template.Template;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads YAML or JSON templates and writes them back as YAML.
 */
public final class TemplateIO {
    private static final ObjectMapper YAML = new ObjectMapper(YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .build());

    private TemplateIO() {}

    public static Template read(Path path) {
        try {
            JsonNode root = YAML.readTree(path.toFile());
            return Template.of(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read template: " + path, e);
        }
    }

    public static void write(Path path, Template template) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            YAML.writeValue(path.toFile(), template.toNode());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write template: " + path, e);
        }
    }

    public static String toYaml(Template template) {
        try {
            return YAML.writeValueAsString(template.toNode());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize template", e);
        }
    }
}
