package it.unimib.datai.autolayer.cli.commands;

import it.unimib.datai.autolayer.common.template.Template;
import it.unimib.datai.autolayer.core.build.ApplicationBuildResult;
import it.unimib.datai.autolayer.core.build.BuildResultLoader;
import it.unimib.datai.autolayer.core.nested.NestedStackManager;
import it.unimib.datai.autolayer.core.template.TemplateIO;
import it.unimib.datai.autolayer.core.template.TemplateMover;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.List;

@Command(name = "generate", description = "Create dependency layers for built functions and write the patched template.")
public class GenerateCommand implements Runnable {
    static final String DEFAULT_OUTPUT = "template.yaml";

    @ParentCommand
    RootCommand root;

    @Option(names = {"-t", "--template"}, required = true, description = "Path to the original template (YAML or JSON).")
    Path template;

    @Option(names = {"-b", "--build-result"}, required = true, description = "Path to the build result descriptor.")
    Path buildResult;

    @Option(names = {"-o", "--output"}, description = "Where to write the patched template (default: <build-dir>/template.yaml).")
    Path output;

    @Option(names = {"--print"}, description = "Also print the patched template to stdout.")
    boolean print;

    @Override
    public void run() {
        String stackName = root.requireStackName();
        Path buildDir = root.buildDirectory();

        Template current = TemplateIO.read(template);
        ApplicationBuildResult result = BuildResultLoader.load(buildResult);

        Template patched = new NestedStackManager(stackName, buildDir, template, current, result)
                .generateAutoDependencyLayerStack();

        Path destination = output == null ? buildDir.resolve(DEFAULT_OUTPUT) : output;
        Template written = TemplateMover.move(template, destination, patched);

        List<String> functions = NestedStackManager.functionsWithDependencyLayer(patched);
        if (functions.isEmpty()) {
            System.out.println("No function qualified for dependency layers");
        } else {
            System.out.println("Added dependency layers for " + functions.size() + " function(s): " + String.join(", ", functions));
        }
        System.out.println("Template written to " + destination);
        if (print) {
            System.out.print(TemplateIO.toYaml(written));
        }
    }
}
