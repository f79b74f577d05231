package io.flakeedit.core.syntax;

import static org.assertj.core.api.Assertions.assertThat;

import io.flakeedit.core.testkit.Fixtures;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

class ParserTest {

    static List<String> manifests() {
        return Fixtures.MANIFESTS;
    }

    private static List<SyntaxKind> childKinds(SyntaxNode node) {
        return node.children().stream().map(SyntaxNode::kind).collect(Collectors.toList());
    }

    private static SyntaxNode expression(String text) {
        return Parser.parse(text).syntax().firstChild().orElseThrow();
    }

    @Nested
    @DisplayName("lossless round trip")
    class RoundTrip {

        @ParameterizedTest
        @MethodSource("io.flakeedit.core.syntax.ParserTest#manifests")
        void fixturesParseCleanly(String fixture) {
            String text = Fixtures.read(fixture);
            Parse parse = Parser.parse(text);

            assertThat(parse.errors()).isEmpty();
            assertThat(parse.syntax().text()).isEqualTo(text);
            assertThat(parse.syntax().textRange()).isEqualTo(new TextRange(0, text.length()));
        }

        @ParameterizedTest
        @ValueSource(strings = {"{ a = ; }", "{ a = 1 }", "{ a.b = \"x; }", "[ 1 2", "}{", "{ a = 1; } ;"})
        void invalidInputStillCoversEveryCharacter(String text) {
            Parse parse = Parser.parse(text);

            assertThat(parse.hasErrors()).isTrue();
            assertThat(parse.syntax().text()).isEqualTo(text);
        }

        @Test
        void setFollowedByIdentifierIsAnApplication() {
            String text = "{ a = 1; } extra";
            Parse parse = Parser.parse(text);

            assertThat(parse.errors()).isEmpty();
            assertThat(parse.syntax().text()).isEqualTo(text);
            assertThat(childKinds(parse.syntax())).containsExactly(SyntaxKind.NODE_APPLY);
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        void emptyInputIsAnError() {
            Parse parse = Parser.parse("");

            assertThat(parse.errors()).hasSize(1);
            assertThat(parse.syntax().kind()).isEqualTo(SyntaxKind.NODE_ROOT);
            assertThat(parse.syntax().firstChild()).isEmpty();
        }

        @Test
        void missingValueIsReportedAtTheSemicolon() {
            Parse parse = Parser.parse("{ a = ; }");

            assertThat(parse.errors()).hasSize(1);
            ParseError error = parse.errors().get(0);
            assertThat(error.message()).contains("expected expression");
            assertThat(error.range().start()).isEqualTo(6);
        }
    }

    @Nested
    @DisplayName("tree shapes")
    class Shapes {

        @Test
        void dottedBinding() {
            SyntaxNode set = expression("{ inputs.nixpkgs.url = \"github:nixos/nixpkgs\"; }");

            assertThat(set.kind()).isEqualTo(SyntaxKind.NODE_ATTR_SET);
            SyntaxNode binding = set.firstChild(SyntaxKind.NODE_ATTRPATH_VALUE).orElseThrow();
            assertThat(childKinds(binding)).containsExactly(SyntaxKind.NODE_ATTRPATH, SyntaxKind.NODE_STRING);
            SyntaxNode path = binding.firstChild(SyntaxKind.NODE_ATTRPATH).orElseThrow();
            assertThat(path.text()).isEqualTo("inputs.nixpkgs.url");
            assertThat(childKinds(path))
                    .containsExactly(SyntaxKind.NODE_IDENT, SyntaxKind.NODE_IDENT, SyntaxKind.NODE_IDENT);
        }

        @Test
        void leadingWhitespaceBelongsToTheEnclosingSet() {
            SyntaxNode set = expression("{\n  a = 1;\n}");
            SyntaxNode binding = set.firstChild(SyntaxKind.NODE_ATTRPATH_VALUE).orElseThrow();

            assertThat(binding.text()).isEqualTo("a = 1;");
            assertThat(binding.prevSiblingOrToken().map(SyntaxElement::kind)).contains(SyntaxKind.TOKEN_WHITESPACE);
        }

        @Test
        void lambdaWithPattern() {
            SyntaxNode lambda = expression("{ self, nixpkgs, ... }@inputs: { }");

            assertThat(lambda.kind()).isEqualTo(SyntaxKind.NODE_LAMBDA);
            SyntaxNode pattern = lambda.firstChild(SyntaxKind.NODE_PATTERN).orElseThrow();
            assertThat(childKinds(pattern))
                    .containsExactly(SyntaxKind.NODE_PAT_ENTRY, SyntaxKind.NODE_PAT_ENTRY, SyntaxKind.NODE_PAT_BIND);
            assertThat(pattern.firstToken(SyntaxKind.TOKEN_ELLIPSIS)).isPresent();
        }

        @Test
        void attributeSetIsNotMistakenForPattern() {
            assertThat(expression("{ a = 1; }").kind()).isEqualTo(SyntaxKind.NODE_ATTR_SET);
            assertThat(expression("{ }").kind()).isEqualTo(SyntaxKind.NODE_ATTR_SET);
            assertThat(expression("{ }: 1").kind()).isEqualTo(SyntaxKind.NODE_LAMBDA);
        }

        @Test
        void operatorPrecedence() {
            SyntaxNode sum = expression("1 + 2 * 3");

            assertThat(sum.kind()).isEqualTo(SyntaxKind.NODE_BIN_OP);
            assertThat(childKinds(sum)).containsExactly(SyntaxKind.NODE_LITERAL, SyntaxKind.NODE_BIN_OP);
        }

        @Test
        void selectWithInterpolatedAttribute() {
            SyntaxNode select = expression("pkgs.${system}.hello");

            assertThat(select.kind()).isEqualTo(SyntaxKind.NODE_SELECT);
            SyntaxNode path = select.firstChild(SyntaxKind.NODE_ATTRPATH).orElseThrow();
            assertThat(childKinds(path)).containsExactly(SyntaxKind.NODE_DYNAMIC, SyntaxKind.NODE_IDENT);
        }

        @Test
        void letIn() {
            SyntaxNode let = expression("let x = 1; in x");

            assertThat(let.kind()).isEqualTo(SyntaxKind.NODE_LET_IN);
            assertThat(childKinds(let)).containsExactly(SyntaxKind.NODE_ATTRPATH_VALUE, SyntaxKind.NODE_IDENT);
        }

        @Test
        void applicationOfBareUri() {
            SyntaxNode apply = expression("f github:owner/repo");

            assertThat(apply.kind()).isEqualTo(SyntaxKind.NODE_APPLY);
            assertThat(childKinds(apply)).containsExactly(SyntaxKind.NODE_IDENT, SyntaxKind.NODE_LITERAL);
        }
    }
}
