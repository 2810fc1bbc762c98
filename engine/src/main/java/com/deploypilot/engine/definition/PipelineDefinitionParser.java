package com.deploypilot.engine.definition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses Bitbucket-pipelines style YAML into a {@link PipelineDefinition}.
 *
 * Only the {@code pipelines.default} list is read. Each entry is a
 * {@code step} mapping with {@code name}, {@code script} and an optional
 * {@code image}; steps without an image inherit the top-level one.
 *
 * <pre>
 * image: maven:3.9-eclipse-temurin-17
 * pipelines:
 *   default:
 *     - step:
 *         name: Build
 *         script:
 *           - mvn -B package
 * </pre>
 */
@Component
public class PipelineDefinitionParser {

    private static final String UNNAMED_STEP = "Unnamed step";

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    public DefinitionParseResult parse(String document) {
        if (document == null || document.isBlank()) {
            return DefinitionParseResult.invalid(List.of("Pipeline configuration is empty"));
        }

        JsonNode root;
        try {
            root = yaml.readTree(document);
        } catch (JsonProcessingException e) {
            return DefinitionParseResult.invalid(
                    List.of("Invalid YAML configuration: " + e.getOriginalMessage()));
        }
        if (root == null || !root.isObject()) {
            return DefinitionParseResult.invalid(List.of("Pipeline configuration must be a mapping"));
        }

        String defaultImage = textOrNull(root.path("image"));
        if (defaultImage == null) defaultImage = PipelineDefinition.DEFAULT_IMAGE;

        JsonNode defaultPipeline = root.path("pipelines").path("default");
        if (!defaultPipeline.isArray() || defaultPipeline.isEmpty()) {
            return DefinitionParseResult.invalid(List.of("No default pipeline defined"));
        }

        List<String> errors = new ArrayList<>();
        List<StepDefinition> steps = new ArrayList<>();
        int index = 0;
        for (JsonNode entry : defaultPipeline) {
            index++;
            JsonNode step = entry.path("step");
            if (!step.isObject()) {
                errors.add("Entry %d of the default pipeline is not a step".formatted(index));
                continue;
            }
            String name  = textOrNull(step.path("name"));
            String image = textOrNull(step.path("image"));
            steps.add(new StepDefinition(
                    name != null ? name : UNNAMED_STEP,
                    image != null ? image : defaultImage,
                    scriptOf(step.path("script"))));
        }

        PipelineDefinition definition = new PipelineDefinition(steps);
        errors.addAll(definition.validate());
        return errors.isEmpty()
                ? DefinitionParseResult.valid(definition)
                : DefinitionParseResult.invalid(errors);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    // Bitbucket allows both plain strings and {image: name} mappings.
    private static String textOrNull(JsonNode node) {
        if (node.isTextual() && !node.asText().isBlank()) return node.asText();
        if (node.isObject()) return textOrNull(node.path("name"));
        return null;
    }

    private static List<String> scriptOf(JsonNode script) {
        List<String> commands = new ArrayList<>();
        if (script.isArray()) {
            for (JsonNode line : script) {
                if (line.isValueNode() && !line.asText().isBlank()) {
                    commands.add(line.asText());
                }
            }
        } else if (script.isTextual() && !script.asText().isBlank()) {
            commands.add(script.asText());
        }
        return commands;
    }
}
