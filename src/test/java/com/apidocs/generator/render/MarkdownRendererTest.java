package com.apidocs.generator.render;

import com.apidocs.generator.model.DetailItem;
import com.apidocs.generator.model.DocstringSections;
import com.apidocs.generator.model.FunctionDetail;
import com.apidocs.generator.model.SourceKind;
import com.apidocs.generator.model.SourceLocation;
import com.apidocs.generator.model.SymbolKind;
import com.apidocs.generator.model.page.ClassPageInfo;
import com.apidocs.generator.model.page.FunctionPageInfo;
import com.apidocs.generator.model.page.MemberInfo;
import com.apidocs.generator.model.page.ModulePageInfo;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MarkdownRenderer.
 */
class MarkdownRendererTest {

    private final MarkdownRenderer renderer = new MarkdownRenderer();

    private static DocstringSections doc(String text) {
        int newline = text.indexOf('\n');
        return DocstringSections.builder()
                .brief(newline < 0 ? text : text.substring(0, newline))
                .docstring(text)
                .build();
    }

    private static MemberInfo member(String shortName, SymbolKind kind, String docstring) {
        return MemberInfo.builder()
                .shortName(shortName)
                .fullName("tf.Thing." + shortName)
                .kind(kind)
                .doc(doc(docstring))
                .build();
    }

    @Test
    void testFunctionPage() {
        FunctionPageInfo page = FunctionPageInfo.builder()
                .fullName("tf.add")
                .aliases(List.of("tf.math.add"))
                .signature("(x, y)")
                .definedIn(SourceLocation.builder().path("ops/math.py").url("https://example.com/ops/math.py").build())
                .doc(DocstringSections.builder()
                        .brief("Adds.")
                        .docstring("Adds.\n\n")
                        .detail(FunctionDetail.builder()
                                .keyword("Args")
                                .itemIndent("  ")
                                .item(new DetailItem("x", " First.\n"))
                                .item(new DetailItem("y", " Second.\n"))
                                .build())
                        .detail(FunctionDetail.builder()
                                .keyword("Returns")
                                .header("  The sum.\n")
                                .build())
                        .compatibilityNote("numpy", "Same as np.add.\n")
                        .build())
                .build();

        String expected = "# tf.add(x, y)\n\n"
                + "### `tf.math.add(x, y)`\n"
                + "\n"
                + "\n\n"
                + "Defined in [`ops/math.py`](https://example.com/ops/math.py).\n\n"
                + "Adds.\n\n"
                + "#### Args:\n\n"
                + "* **x**: First.\n"
                + "* **y**: Second.\n"
                + "\n"
                + "#### Returns:\n\n"
                + "  The sum.\n"
                + "\n\n#### numpy compatibility\nSame as np.add.\n\n";

        assertThat(renderer.render(page)).isEqualTo(expected);
    }

    @Test
    void testFunctionPageWithoutExtras() {
        FunctionPageInfo page = FunctionPageInfo.builder()
                .fullName("tf.noop")
                .guides("See the guide: [Basics](../guides/basics.md)\n\n")
                .doc(doc("Does nothing."))
                .build();

        assertThat(renderer.render(page))
                .isEqualTo("# tf.noop\n\nSee the guide: [Basics](../guides/basics.md)\n\nDoes nothing.");
    }

    @Test
    void testClassPageSortsMembers() {
        ClassPageInfo page = ClassPageInfo.builder()
                .fullName("tf.Thing")
                .aliases(List.of("tf.compat.Thing"))
                .doc(doc("A thing.\n"))
                .method(member("zeta", SymbolKind.FUNCTION, "Last.\n").toBuilder().signature("()").build())
                .method(member("alpha", SymbolKind.FUNCTION, "First.\n").toBuilder().signature("(x)").build())
                .property(member("size", SymbolKind.PROPERTY, "The size.\n"))
                .childClass(member("Part", SymbolKind.CLASS, "").toBuilder().url("../tf/Thing/Part.md").build())
                .childClass(member("Child", SymbolKind.CLASS, "").toBuilder().url("../tf/Thing/Child.md").build())
                .otherMember(member("MAX", SymbolKind.OTHER, ""))
                .build();

        String expected = "# tf.Thing\n\n"
                + "### `class tf.compat.Thing`\n"
                + "\n"
                + "A thing.\n"
                + "\n\n"
                + "## Child Classes\n"
                + "[`class Child`](../tf/Thing/Child.md)\n\n"
                + "[`class Part`](../tf/Thing/Part.md)\n\n"
                + "## Properties\n\n"
                + "<h3 id=\"size\"><code>size</code></h3>\n\n"
                + "The size.\n"
                + "\n\n"
                + "\n\n"
                + "## Methods\n\n"
                + "<h3 id=\"alpha\"><code>alpha(x)</code></h3>\n\n"
                + "First.\n"
                + "\n\n"
                + "<h3 id=\"zeta\"><code>zeta()</code></h3>\n\n"
                + "Last.\n"
                + "\n\n"
                + "\n\n"
                + "## Class Members\n\n"
                + "<h3 id=\"MAX\"><code>MAX</code></h3>\n\n";

        assertThat(renderer.render(page)).isEqualTo(expected);
    }

    @Test
    void testPropertyCompatibilityNotesAreRendered() {
        MemberInfo property = member("dtype", SymbolKind.PROPERTY, "").toBuilder()
                .doc(DocstringSections.builder()
                        .brief("The type.")
                        .docstring("The type.\n")
                        .compatibilityNote("numpy", "Same as ndarray.dtype.\n")
                        .build())
                .build();
        ClassPageInfo page = ClassPageInfo.builder().fullName("tf.Tensor").doc(doc("A tensor.")).property(property).build();

        assertThat(renderer.render(page)).endsWith("## Properties\n\n"
                + "<h3 id=\"dtype\"><code>dtype</code></h3>\n\n"
                + "The type.\n"
                + "\n\n#### numpy compatibility\nSame as ndarray.dtype.\n"
                + "\n\n"
                + "\n\n");
    }

    @Test
    void testClassPageWithoutMembersOmitsSections() {
        ClassPageInfo page = ClassPageInfo.builder().fullName("tf.Empty").doc(doc("Empty.")).build();

        assertThat(renderer.render(page)).isEqualTo("# tf.Empty\n\nEmpty.\n\n");
    }

    @Test
    void testModulePageKeepsMemberOrder() {
        ModulePageInfo page = ModulePageInfo.builder()
                .fullName("tf.nn")
                .aliases(List.of("tf.compat.nn"))
                .doc(doc("Neural network ops."))
                .member(member("relu", SymbolKind.FUNCTION, "Computes relu.").toBuilder().url("../tf/nn/relu.md").build())
                .member(member("RNNCell", SymbolKind.CLASS, "").toBuilder().url("../tf/nn/RNNCell.md").build())
                .member(member("rnn", SymbolKind.MODULE, "RNN ops.").toBuilder().url("../tf/nn/rnn.md").build())
                .member(member("EPSILON", SymbolKind.OTHER, ""))
                .build();

        String expected = "# Module: tf.nn\n\n"
                + "### Module `tf.compat.nn`\n"
                + "\n"
                + "Neural network ops."
                + "\n\n"
                + "## Members\n\n"
                + "[`relu(...)`](../tf/nn/relu.md): Computes relu.\n\n"
                + "[`class RNNCell`](../tf/nn/RNNCell.md)\n\n"
                + "[`rnn`](../tf/nn/rnn.md) module: RNN ops.\n\n"
                + "Constant EPSILON";

        assertThat(renderer.render(page)).isEqualTo(expected);
    }

    @Test
    void testDefinedInVariants() {
        assertThat(MarkdownRenderer.definedIn(SourceLocation.of("a/b.py"))).isEqualTo("Defined in `a/b.py`.\n\n");
        assertThat(MarkdownRenderer.definedIn(SourceLocation.builder()
                .path("gen_ops.py").kind(SourceKind.GENERATED).build()))
                .isEqualTo("Defined in generated file: `gen_ops.py`.\n\n");
        assertThat(MarkdownRenderer.definedIn(SourceLocation.builder().kind(SourceKind.BUILTIN).build()))
                .isEqualTo("Built-in.\n\n");
    }

    @Test
    void testCompatibilityNotesAreSorted() {
        String rendered = MarkdownRenderer.compatibility(Map.of("theano", "T.\n", "numpy", "N.\n"));

        assertThat(rendered).isEqualTo("\n\n#### numpy compatibility\nN.\n\n\n\n#### theano compatibility\nT.\n\n");
    }

    @Test
    void testNullPageIsRejected() {
        assertThatNullPointerException().isThrownBy(() -> renderer.render(null));
    }
}
