package dev.chordshield.core;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.StringLength;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationPropertiesTest {

    private final ChordProValidator validator = new ChordProValidator(ValidationConfig.strict());

    @Provide
    Arbitrary<String> chordProLike() {
        Arbitrary<String> fragment = Arbitraries.of(
                "[", "]", "{", "}", "[C]", "[Am7]", "[H]", "[]", "{title: X}", "{titel}", "{}", ":",
                "<script>", "</script>", "<iframe", ">", "javascript:", "onload=", "on", "\n", " ", "la",
                "$", "%", "#", "/", "Do", "é");
        return fragment.list().ofMaxSize(60).map(parts -> String.join("", parts));
    }

    @Property(tries = 300)
    void neverThrowsAndValidityMatchesErrors(@ForAll("chordProLike") String content) {
        ValidationResult result = validator.validateContent(content);

        assertThat(result.isValid()).isEqualTo(result.errors().isEmpty());
        assertThat(result.errors()).allMatch(ValidationError::isError);
        assertThat(result.warnings()).noneMatch(ValidationError::isError);
    }

    @Property(tries = 300)
    void positionsStayInsideContent(@ForAll("chordProLike") String content) {
        ValidationResult result = validator.validateContent(content);

        assertThat(result.allFindings()).allSatisfy(finding -> {
            Position position = finding.position();
            assertThat(position.start()).isBetween(0, content.length());
            assertThat(position.end()).isBetween(position.start(), content.length());
            assertThat(position.line()).isPositive();
            assertThat(position.column()).isPositive();
        });
    }

    @Property(tries = 200)
    void arbitraryTextIsDeterministic(@ForAll @StringLength(max = 400) String content) {
        assertThat(validator.validateContent(content)).isEqualTo(validator.validateContent(content));
    }
}
