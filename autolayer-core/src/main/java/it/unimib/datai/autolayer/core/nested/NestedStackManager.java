package it.unimib.datai.autolayer.core.nested;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import it.unimib.datai.autolayer.common.model.FunctionDefinition;
import it.unimib.datai.autolayer.common.model.PackageType;
import it.unimib.datai.autolayer.common.template.Intrinsics;
import it.unimib.datai.autolayer.common.template.Template;
import it.unimib.datai.autolayer.core.build.ApplicationBuildResult;
import it.unimib.datai.autolayer.core.layer.EligibilityFilter;
import it.unimib.datai.autolayer.core.layer.LayerFolderBuilder;
import it.unimib.datai.autolayer.core.provider.TemplateFunctionResolver;
import it.unimib.datai.autolayer.core.template.TemplateMover;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Moves the dependencies of every supported function into its own layer, declares those layers in a
 * nested stack and references them back from the functions of the original template.
 */
public class NestedStackManager {
    private static final Logger log = LoggerFactory.getLogger(NestedStackManager.class);

    public static final String NESTED_STACK_NAME = "AwsSamAutoDependencyLayerNestedStack";
    public static final String NESTED_TEMPLATE_FILE = "nested_template.yaml";

    private final String stackName;
    private final Path buildDir;
    private final Path stackLocation;
    private final Template currentTemplate;
    private final ApplicationBuildResult buildResult;
    private final TemplateFunctionResolver functionResolver;
    private final EligibilityFilter eligibilityFilter;

    /**
     * @param stackName       original stack name, used to name the layers
     * @param buildDir        where layer folders and the nested template are written
     * @param stackLocation   path of the original template; relative paths in templates are relative to it
     * @param currentTemplate template to patch, left untouched
     * @param buildResult     artifacts and build graph of the upstream build
     */
    public NestedStackManager(
            String stackName,
            Path buildDir,
            Path stackLocation,
            Template currentTemplate,
            ApplicationBuildResult buildResult
    ) {
        this(stackName, buildDir, stackLocation, currentTemplate, buildResult,
                new TemplateFunctionResolver(), new EligibilityFilter());
    }

    public NestedStackManager(
            String stackName,
            Path buildDir,
            Path stackLocation,
            Template currentTemplate,
            ApplicationBuildResult buildResult,
            TemplateFunctionResolver functionResolver,
            EligibilityFilter eligibilityFilter
    ) {
        this.stackName = stackName;
        this.buildDir = buildDir;
        this.stackLocation = stackLocation;
        this.currentTemplate = currentTemplate;
        this.buildResult = buildResult;
        this.functionResolver = functionResolver;
        this.eligibilityFilter = eligibilityFilter;
    }

    public Template generateAutoDependencyLayerStack() {
        Template template = Template.of(currentTemplate.toNode());
        NestedStackBuilder nestedStackBuilder = new NestedStackBuilder();

        List<FunctionDefinition> zipFunctions = functionResolver.resolve(template).stream()
                .filter(function -> function.packageType() == PackageType.ZIP)
                .toList();

        for (FunctionDefinition function : zipFunctions) {
            if (!eligibilityFilter.isSupported(function, buildResult)) {
                continue;
            }

            Optional<Path> dependenciesDir = eligibilityFilter.dependenciesDir(function, buildResult.buildGraph());
            if (dependenciesDir.isEmpty()) {
                log.debug("Dependency folder can't be found for {}, skipping auto dependency layer creation", function.name());
                continue;
            }

            template = addLayer(template, nestedStackBuilder, dependenciesDir.get(), function);
        }

        if (!nestedStackBuilder.isAnyFunctionAdded()) {
            log.debug("No function has been added for auto dependency layer creation");
            return template;
        }

        Path nestedTemplateLocation = buildDir.resolve(NESTED_TEMPLATE_FILE);
        TemplateMover.move(stackLocation, nestedTemplateLocation, nestedStackBuilder.buildTemplate());
        log.info("Wrote nested stack with {} dependency layer(s) to {}",
                nestedStackBuilder.registeredFunctions(), nestedTemplateLocation);

        return template.withResource(NESTED_STACK_NAME,
                NestedStackBuilder.nestedStackReferenceResource(nestedTemplateLocation.toString()));
    }

    /**
     * Logical ids of the functions whose layers reference the nested dependency layer stack.
     */
    public static List<String> functionsWithDependencyLayer(Template template) {
        List<String> functions = new ArrayList<>();
        for (String logicalId : template.resourceIds()) {
            JsonNode layers = template.resource(logicalId)
                    .map(resource -> resource.path(Template.PROPERTIES).path(Template.LAYERS))
                    .orElse(MissingNode.getInstance());
            for (JsonNode layer : layers) {
                if (NESTED_STACK_NAME.equals(layer.path("Fn::GetAtt").path(0).asText(null))) {
                    functions.add(logicalId);
                    break;
                }
            }
        }
        return functions;
    }

    private Template addLayer(Template template, NestedStackBuilder builder, Path dependenciesDir, FunctionDefinition function) {
        String layerLogicalId = NestedStackBuilder.layerLogicalId(function.name());
        Path layerLocation = LayerFolderBuilder.build(
                buildDir, dependenciesDir, layerLogicalId, function.name(), function.runtime());

        String layerOutputKey = builder.addFunction(stackName, layerLocation, function);

        return template.withAppendedLayer(function.name(),
                Intrinsics.getAtt(NESTED_STACK_NAME, "Outputs." + layerOutputKey));
    }
}
