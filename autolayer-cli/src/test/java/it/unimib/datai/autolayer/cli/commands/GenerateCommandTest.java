package it.unimib.datai.autolayer.cli.commands;

import it.unimib.datai.autolayer.cli.testsupport.CliTestSupport;
import it.unimib.datai.autolayer.cli.testsupport.CliTestSupport.CommandResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class GenerateCommandTest {

    @TempDir
    Path tmp;

    private Path template;
    private Path buildResult;
    private Path buildDir;

    @BeforeEach
    void setUp() throws Exception {
        buildDir = tmp.resolve("layers");

        Path deps = tmp.resolve("deps/Fn1");
        Files.createDirectories(deps.resolve("requests"));
        Files.writeString(deps.resolve("requests/__init__.py"), "# requests");

        template = tmp.resolve("template.yaml");
        buildResult = tmp.resolve("build-result.yaml");
        Files.writeString(buildResult, """
                artifacts:
                  Fn1: build/Fn1
                buildDefinitions:
                  - runtime: python3.11
                    codeDir: fn1
                    dependenciesDir: deps/Fn1
                    functions: [Fn1]
                """);
    }

    private CommandResult generate(String... extra) {
        String[] base = {
                "--config", tmp.resolve("config.yaml").toString(),
                "--stack-name", "orders",
                "--build-dir", buildDir.toString(),
                "generate", "-t", template.toString(), "-b", buildResult.toString()
        };
        String[] args = new String[base.length + extra.length];
        System.arraycopy(base, 0, args, 0, base.length);
        System.arraycopy(extra, 0, args, base.length, extra.length);
        return CliTestSupport.executeAndCaptureStdout(new CommandLine(new RootCommand()), args);
    }

    private void writeTemplate(String runtime) throws Exception {
        Files.writeString(template, """
                Resources:
                  Fn1:
                    Type: AWS::Serverless::Function
                    Properties:
                      Runtime: %s
                      Handler: app.handler
                      CodeUri: fn1/
                """.formatted(runtime));
    }

    @Test
    void writesPatchedTemplateAndLayer() throws Exception {
        writeTemplate("python3.11");

        CommandResult result = generate();

        assertThat(result.exitCode()).isEqualTo(0);
        assertThat(result.stdout()).contains("Added dependency layers for 1 function(s): Fn1");

        Path written = buildDir.resolve("template.yaml");
        String yaml = Files.readString(written);
        assertThat(yaml).contains("AwsSamAutoDependencyLayerNestedStack");
        assertThat(yaml).contains("Outputs.Fn1362b6916DepLayer");
        assertThat(yaml).contains("../fn1");
        assertThat(buildDir.resolve("nested_template.yaml")).exists();
        assertThat(buildDir.resolve("Fn1362b6916DepLayer/python/lib/python3.11/site-packages/requests/__init__.py")).exists();
    }

    @Test
    void unsupportedRuntimeWritesTemplateUnchanged() throws Exception {
        writeTemplate("ruby3.2");
        Path out = tmp.resolve("out/template.yaml");

        CommandResult result = generate("-o", out.toString());

        assertThat(result.exitCode()).isEqualTo(0);
        assertThat(result.stdout()).contains("No function qualified for dependency layers");
        assertThat(Files.readString(out)).doesNotContain("AwsSamAutoDependencyLayerNestedStack");
        assertThat(buildDir.resolve("nested_template.yaml")).doesNotExist();
    }

    @Test
    void printOptionEchoesTemplate() throws Exception {
        writeTemplate("nodejs20.x");

        CommandResult result = generate("--print");

        assertThat(result.exitCode()).isEqualTo(0);
        assertThat(result.stdout()).contains("Fn::GetAtt").contains("Handler");
    }

    @Test
    void missingTemplateExitsNonZero() {
        CommandResult result = generate();

        assertThat(result.exitCode()).isNotEqualTo(0);
    }

    @Test
    void missingStackNameExitsNonZero() throws Exception {
        writeTemplate("python3.11");

        int exit = new CommandLine(new RootCommand()).execute(
                "--config", tmp.resolve("config.yaml").toString(),
                "generate", "-t", template.toString(), "-b", buildResult.toString());

        assertThat(exit).isNotEqualTo(0);
    }

    @Test
    void missingRequiredOptionsExitNonZero() {
        int exit = new CommandLine(new RootCommand()).execute("generate");

        assertThat(exit).isNotEqualTo(0);
    }
}
