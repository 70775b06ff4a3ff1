package io.github.yok.fermi.core.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class LineClassifierTest {

    private final LineClassifier<String> classifier = new LineClassifier<>(List.of(
            line -> line.startsWith("END") ? Optional.of(ParsedLine.boundary()) : Optional.empty(),
            line -> line.startsWith("E") ? Optional.of(ParsedLine.record("e:" + line))
                    : Optional.empty(),
            line -> line.isBlank() ? Optional.of(ParsedLine.skip()) : Optional.empty()));

    @Test
    void firstMatchingMatcherWins() {
        assertTrue(classifier.classify("END").isBoundary());

        ParsedLine<String> record = classifier.classify("EX");
        assertTrue(record.isRecord());
        assertEquals("e:EX", record.getValue());
    }

    @Test
    void unrecognisedAndNullLinesAreSkipped() {
        ParsedLine<String> unknown = classifier.classify("something else");
        assertEquals(ParsedLine.Kind.SKIP, unknown.getKind());
        assertFalse(unknown.isRecord());
        assertEquals(ParsedLine.Kind.SKIP, classifier.classify(null).getKind());
    }

    @Test
    void recordRejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> ParsedLine.record(null));
    }
}
