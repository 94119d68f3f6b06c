package com.apidocs.generator.parser;

import com.apidocs.generator.model.DocstringSections;
import com.apidocs.generator.model.FunctionDetail;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DocstringLineScanner and DocstringParser.
 */
class DocstringParserTest {

    private static final String RELU_DOC = """
            Computes rectified linear: `max(features, 0)`

            Args:
              features: A `Tensor`. Must be one of the following types: `float32`,
                `float64`, `int32`, `int64`, `uint8`, `int16`, `int8`, `uint16`,
                `half`.
              name: A name for the operation (optional)

            Returns:
              A `Tensor`. Has the same type as `features`
            """;

    private final DocstringStructurer structurer = new DocstringStructurer();

    @Test
    void testParseFunctionDetails() {
        DocstringSections sections = structurer.structure(RELU_DOC);

        assertThat(sections.getDetails()).hasSize(2);

        FunctionDetail args = sections.getDetails().get(0);
        assertThat(args.getKeyword()).isEqualTo("Args");
        assertThat(args.getHeader()).isEmpty();
        assertThat(args.getItems()).hasSize(2);
        assertThat(args.getItems().get(0).getName()).isEqualTo("features");
        assertThat(args.getItems().get(1).getName()).isEqualTo("name");
        assertThat(args.getItems().get(1).getDescription()).isEqualTo(" A name for the operation (optional)\n\n");

        FunctionDetail returns = sections.getDetails().get(1);
        assertThat(returns.getKeyword()).isEqualTo("Returns");
        assertThat(returns.getHeader()).isEqualTo("  A `Tensor`. Has the same type as `features`\n");
        assertThat(returns.getItems()).isEmpty();

        assertThat(sections.getDocstring()).isEqualTo("Computes rectified linear: `max(features, 0)`\n\n");
        assertThat(sections.getBrief()).isEqualTo("Computes rectified linear: `max(features, 0)`");
    }

    @Test
    void testRoundTripReproducesOriginal() {
        DocstringSections sections = structurer.structure(RELU_DOC);

        assertThat(sections.reassemble()).isEqualTo(RELU_DOC);
    }

    @Test
    void testContinuationLinesStayWithTheirItem() {
        DocstringSections sections = structurer.structure(RELU_DOC);

        String features = sections.getDetails().get(0).getItems().get(0).getDescription();
        assertThat(features).startsWith(" A `Tensor`.").endsWith("`half`.\n");
    }

    @Test
    void testCompatibilityBlocksAreExtracted() {
        String doc = """
                Function with a fancy docstring.

                Returns:
                  arg: the input, and
                  arg: the input, again.

                @compatibility(numpy)
                NumPy has nothing as awesome as this function.
                @end_compatibility

                @compatibility(theano)
                Theano has nothing as awesome as this function.

                Check it out.
                @end_compatibility""";

        DocstringSections sections = structurer.structure(doc);

        assertThat(sections.getCompatibility()).containsOnlyKeys("numpy", "theano");
        assertThat(sections.getCompatibility().get("numpy"))
                .isEqualTo("NumPy has nothing as awesome as this function.\n");
        assertThat(sections.getCompatibility().get("theano"))
                .isEqualTo("Theano has nothing as awesome as this function.\n\nCheck it out.\n");
        assertThat(sections.getDetails()).hasSize(1);
        assertThat(sections.getDetails().get(0).getItems()).extracting("name").containsExactly("arg", "arg");
        assertThat(sections.reassemble()).doesNotContain("compatibility").doesNotContain("NumPy");
    }

    @Test
    void testCompatibilityBlockInBodyKeepsFollowingText() {
        String doc = """
                Brief.
                @compatibility(eager)
                Not supported.
                @end_compatibility
                More text.
                """;

        DocstringSections sections = structurer.structure(doc);

        assertThat(sections.getDocstring()).isEqualTo("Brief.\nMore text.\n");
        assertThat(sections.getCompatibility()).containsEntry("eager", "Not supported.\n");
    }

    @Test
    void testUnterminatedCompatibilityBlockIsBodyText() {
        String doc = "Brief.\n@compatibility(numpy)\nNo end marker.\n";

        DocstringSections sections = structurer.structure(doc);

        assertThat(sections.getCompatibility()).isEmpty();
        assertThat(sections.getDocstring()).isEqualTo(doc);
    }

    @Test
    void testItemLineWithoutSectionIsBodyText() {
        String doc = "Brief.\n\n  orphan: not in any section.\n";

        DocstringSections sections = structurer.structure(doc);

        assertThat(sections.getDetails()).isEmpty();
        assertThat(sections.getDocstring()).isEqualTo(doc);
    }

    @Test
    void testFirstLineIsNeverASectionHeader() {
        DocstringSections sections = structurer.structure("Returns:\n  x: value\n");

        assertThat(sections.getDetails()).isEmpty();
        assertThat(sections.getBrief()).isEqualTo("Returns:");
    }

    @Test
    void testDeeperIndentedItemIsPartOfDescription() {
        String doc = """
                Brief.

                Args:
                  config: A dict with keys
                    alpha: first key
                    beta: second key
                  name: The name.
                """;

        DocstringSections sections = structurer.structure(doc);

        FunctionDetail args = sections.getDetails().get(0);
        assertThat(args.getItemIndent()).isEqualTo("  ");
        assertThat(args.getItems()).extracting("name").containsExactly("config", "name");
        assertThat(args.getItems().get(0).getDescription()).contains("alpha: first key");
        assertThat(sections.reassemble()).isEqualTo(doc);
    }

    @Test
    void testVariadicParameterItems() {
        String doc = """
                Brief.

                Args:
                  x: The input.
                  *args: Extra positional values.
                  **kwargs: Extra keyword values,
                    passed through.
                """;

        DocstringSections sections = structurer.structure(doc);

        FunctionDetail args = sections.getDetails().get(0);
        assertThat(args.getItems()).extracting("name").containsExactly("x", "*args", "**kwargs");
        assertThat(args.getItems().get(2).getDescription()).isEqualTo(" Extra keyword values,\n    passed through.\n");
        assertThat(sections.reassemble()).isEqualTo(doc);
    }

    @Test
    void testEmptyDocstring() {
        DocstringSections sections = structurer.structure("");

        assertThat(sections.getBrief()).isEmpty();
        assertThat(sections.getDocstring()).isEmpty();
        assertThat(sections.getDetails()).isEmpty();
        assertThat(sections.getCompatibility()).isEmpty();
    }

    @Test
    void testScannerKeepsEveryCharacter() {
        List<DocstringLine> lines = new DocstringLineScanner(RELU_DOC).scan();

        StringBuilder joined = new StringBuilder();
        lines.forEach(line -> joined.append(line.raw()));

        assertThat(joined.toString()).isEqualTo(RELU_DOC);
        assertThat(lines.get(2).getType()).isEqualTo(DocstringLine.LineType.SECTION_HEADER);
        assertThat(lines.get(3).getType()).isEqualTo(DocstringLine.LineType.ITEM);
        assertThat(lines.get(3).getIndent()).isEqualTo("  ");
    }
}
