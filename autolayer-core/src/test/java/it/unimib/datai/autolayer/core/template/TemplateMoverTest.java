package it.unimib.datai.autolayer.core.template;

import com.fasterxml.jackson.databind.node.TextNode;
import it.unimib.datai.autolayer.common.template.Template;
import it.unimib.datai.autolayer.core.testsupport.Templates;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateMoverTest {

    @TempDir
    Path tmp;

    @Test
    void rewritesRelativePathsForNewLocation() {
        Template template = Templates.yaml("""
                Resources:
                  Fn:
                    Type: AWS::Serverless::Function
                    Properties:
                      CodeUri: src/fn
                  Layer:
                    Type: AWS::Lambda::LayerVersion
                    Properties:
                      Content: layers/shared
                  Remote:
                    Type: AWS::Lambda::Function
                    Properties:
                      Code: s3://bucket/code.zip
                  Bucket:
                    Type: AWS::S3::Bucket
                    Properties:
                      BucketName: src/fn
                """);
        Path original = tmp.resolve("project/template.yaml");
        Path destination = tmp.resolve("project/.build/template.yaml");

        Template moved = TemplateMover.move(original, destination, template);

        assertThat(moved.resource("Fn").orElseThrow().path("Properties").path("CodeUri").asText())
                .isEqualTo(Path.of("..", "src", "fn").toString());
        assertThat(moved.resource("Layer").orElseThrow().path("Properties").path("Content").asText())
                .isEqualTo(Path.of("..", "layers", "shared").toString());
        assertThat(moved.resource("Remote")).isEqualTo(template.resource("Remote"));
        assertThat(moved.resource("Bucket")).isEqualTo(template.resource("Bucket"));
        assertThat(TemplateIO.read(destination)).isEqualTo(moved);
    }

    @Test
    void leavesAbsoluteAndUrlPathsAlone() {
        Path root = tmp.resolve("a");
        Path newRoot = tmp.resolve("b");

        assertThat(TemplateMover.resolveRelativeTo(new TextNode(tmp.resolve("abs").toString()), root, newRoot)).isNull();
        assertThat(TemplateMover.resolveRelativeTo(new TextNode("https://example.com/t.yaml"), root, newRoot)).isNull();
        assertThat(TemplateMover.resolveRelativeTo(null, root, newRoot)).isNull();
        assertThat(TemplateMover.resolveRelativeTo(new TextNode("x/y"), root, newRoot))
                .isEqualTo(Path.of("..", "a", "x", "y").toString());
    }

    @Test
    void pathToNewRootItselfBecomesDot() {
        assertThat(TemplateMover.resolveRelativeTo(new TextNode("build"), tmp, tmp.resolve("build"))).isEqualTo(".");
    }

    @Test
    void nonTextualPathsAreKept() {
        Template template = Templates.yaml("""
                Resources:
                  Fn:
                    Type: AWS::Lambda::Function
                    Properties:
                      Code:
                        S3Bucket: b
                        S3Key: k
                """);

        Template moved = TemplateMover.updateRelativePaths(template, tmp.resolve("a"), tmp.resolve("b"));

        assertThat(moved).isEqualTo(template);
    }
}
