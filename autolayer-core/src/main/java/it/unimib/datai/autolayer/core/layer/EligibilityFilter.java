package it.unimib.datai.autolayer.core.layer;

import it.unimib.datai.autolayer.common.model.FunctionDefinition;
import it.unimib.datai.autolayer.common.model.PackageType;
import it.unimib.datai.autolayer.common.model.RuntimeFamily;
import it.unimib.datai.autolayer.core.build.ApplicationBuildResult;
import it.unimib.datai.autolayer.core.build.BuildGraph;
import it.unimib.datai.autolayer.core.build.FunctionBuildDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which functions get their dependencies moved into a layer.
 */
public class EligibilityFilter {
    private static final Logger log = LoggerFactory.getLogger(EligibilityFilter.class);

    public boolean isEligible(FunctionDefinition function, ApplicationBuildResult buildResult) {
        return isSupported(function, buildResult)
                && dependenciesDir(function, buildResult.buildGraph()).isPresent();
    }

    /**
     * Everything but the dependencies folder: function type, package type, built in this session, runtime.
     */
    public boolean isSupported(FunctionDefinition function, ApplicationBuildResult buildResult) {
        if (function.resourceType() == null || !function.resourceType().isFunction()) {
            log.debug("Resource {} is not a supported function type, skipping auto dependency layer creation", function.name());
            return false;
        }
        if (function.packageType() != PackageType.ZIP) {
            log.debug("Function {} is packaged as {}, skipping auto dependency layer creation",
                    function.name(), function.packageType().value());
            return false;
        }
        if (!isFunctionBuilt(function, buildResult.artifacts())) {
            log.debug("Function {} is not built within this session, skipping auto dependency layer creation", function.name());
            return false;
        }
        return isRuntimeSupported(function.runtime());
    }

    public boolean isFunctionBuilt(FunctionDefinition function, Map<String, Path> artifacts) {
        return artifacts.containsKey(function.name());
    }

    public boolean isRuntimeSupported(String runtime) {
        if (RuntimeFamily.of(runtime).isEmpty()) {
            log.debug("Runtime {} is not supported for auto dependency layer creation", runtime);
            return false;
        }
        return true;
    }

    public Optional<Path> dependenciesDir(FunctionDefinition function, BuildGraph buildGraph) {
        return buildGraph.functionBuildDefinition(function.name())
                .map(FunctionBuildDefinition::dependenciesDir)
                .filter(dir -> !dir.toString().isBlank());
    }
}
