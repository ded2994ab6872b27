/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.stepwise.gherkin;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeatureParserTest {

    private static Feature parse(String text) {
        return FeatureParser.parse("test.feature", text);
    }

    @Test
    void testBasicFeature() {
        Feature feature = parse("""
                @billing
                Feature: Cart totals
                  Totals are computed in cents.

                  @smoke @fast
                  Scenario: one item
                    Given I add 4 items
                    When I check out
                    Then the total is 400
                """);
        assertEquals("test.feature", feature.getUri());
        assertEquals(2, feature.getLine());
        assertEquals("Cart totals", feature.getName());
        assertEquals("Totals are computed in cents.", feature.getDescription());
        assertEquals(List.of(new Tag(1, "@billing")), feature.getTags());
        assertFalse(feature.isBackgroundPresent());
        Scenario scenario = feature.getScenarios().get(0);
        assertEquals("one item", scenario.getName());
        assertEquals(6, scenario.getLine());
        assertEquals("[1:6]", scenario.getRefId());
        assertEquals("test.feature:6", scenario.getDebugInfo());
        assertFalse(scenario.isOutline());
        assertEquals(3, scenario.getSteps().size());
        Step first = scenario.getSteps().get(0);
        assertEquals("Given", first.getKeyword());
        assertEquals("I add 4 items", first.getText());
        assertEquals(7, first.getLine());
        assertEquals("Given I add 4 items", first.getPrefixedText());
        assertEquals(List.of("@billing", "@smoke", "@fast"),
                scenario.getTagsEffective().stream().map(Tag::getName).toList());
    }

    @Test
    void testBackground() {
        Feature feature = parse("""
                Feature:
                  Background:
                    * a fresh cart
                  Scenario: first
                    * step one
                  Scenario: second
                    * step two
                """);
        assertTrue(feature.isBackgroundPresent());
        assertEquals(1, feature.getBackground().getSteps().size());
        for (Scenario scenario : feature.getScenarios()) {
            assertEquals(1, scenario.getBackgroundSteps().size());
            assertEquals(2, scenario.getStepsIncludingBackground().size());
            assertEquals("a fresh cart", scenario.getStepsIncludingBackground().get(0).getText());
        }
        assertEquals(1, feature.getScenarios().get(1).getIndex());
        assertEquals("*", feature.getScenarios().get(0).getSteps().get(0).getKeyword());
    }

    @Test
    void testOutline() {
        Feature feature = parse("""
                Feature:
                  Scenario Outline: eating
                    Given there are <start> cucumbers
                    When I eat <eat> cucumbers

                    Examples: small
                      | start | eat |
                      | 12    | 5   |
                      | 20    | 5   |

                    @large
                    Examples: large
                      | start | eat |
                      | 100   | 50  |
                """);
        Scenario scenario = feature.getScenarios().get(0);
        assertTrue(scenario.isOutline());
        List<ExamplesTable> examples = scenario.getExamples();
        assertEquals(2, examples.size());
        assertEquals("small", examples.get(0).getName());
        assertEquals(List.of("start", "eat"), examples.get(0).getHeader());
        assertEquals(2, examples.get(0).getRowCount());
        assertEquals(Map.of("start", "20", "eat", "5"), examples.get(0).getExampleData(1));
        assertEquals(List.of(new Tag(11, "@large")), examples.get(1).getTags());
        assertEquals(List.of(List.of("100", "50")), examples.get(1).getBody());
    }

    @Test
    void testDocStringAndTable() {
        Feature feature = parse("""
                Feature:
                  Scenario:
                    Given the payload
                      ```
                      {"id": <id>}
                      ```
                    And the users
                      | name  | role  |
                      | alice | admin |
                      | bob   | <role> |
                """);
        List<Step> steps = feature.getScenarios().get(0).getSteps();
        Step doc = steps.get(0);
        assertEquals("{\"id\": <id>}", doc.getDocString());
        assertNull(doc.getTable());
        Table table = steps.get(1).getTable();
        assertEquals(3, table.getRowCount());
        assertEquals(List.of("name", "role"), table.getHeader());
        assertEquals("admin", table.getValue(1, 1));
        assertEquals(List.of(Map.of("name", "alice", "role", "admin"), Map.of("name", "bob", "role", "<role>")),
                table.getRowsAsMaps());

        Step replaced = doc.replace("<id>", "7");
        assertEquals("{\"id\": 7}", replaced.getDocString());
        assertEquals("{\"id\": <id>}", doc.getDocString());
        Table replacedTable = steps.get(1).replace("<role>", "guest").getTable();
        assertEquals("guest", replacedTable.getValue(2, 1));
    }

    @Test
    void testRules() {
        Feature feature = parse("""
                @api
                Feature: rules
                  Background:
                    * feature background

                  @checkout
                  Rule: paying
                    Background:
                      * rule background

                    @card
                    Scenario: by card
                      * pay by card

                  Rule: browsing
                    Scenario: list
                      * list products
                """);
        List<Scenario> scenarios = feature.getScenarios();
        assertEquals(2, scenarios.size());
        Scenario card = scenarios.get(0);
        assertEquals("paying", card.getRuleName());
        assertEquals(List.of("@api", "@checkout", "@card"),
                card.getTagsEffective().stream().map(Tag::getName).toList());
        assertEquals(List.of("feature background", "rule background", "pay by card"),
                card.getStepsIncludingBackground().stream().map(Step::getText).toList());
        Scenario list = scenarios.get(1);
        assertEquals("browsing", list.getRuleName());
        assertEquals(List.of("@api"), list.getTagsEffective().stream().map(Tag::getName).toList());
        assertEquals(List.of("feature background", "list products"),
                list.getStepsIncludingBackground().stream().map(Step::getText).toList());
        assertEquals(1, list.getIndex());
    }

    @Test
    void testParseError() {
        FeatureParseException e = assertThrows(FeatureParseException.class,
                () -> parse("this is not gherkin"));
        assertEquals("test.feature", e.getUri());
        assertEquals(1, e.getLine());
    }

    @Test
    void testNoFeature() {
        FeatureParseException e = assertThrows(FeatureParseException.class, () -> parse("# only a comment\n"));
        assertTrue(e.getMessage().contains("no feature found"));
    }

    @Test
    void testMissingFile(@TempDir Path dir) {
        FeatureParseException e = assertThrows(FeatureParseException.class,
                () -> FeatureParser.parse(dir.resolve("missing.feature")));
        assertEquals(-1, e.getLine());
        assertNotNull(e.getCause());
    }

    @Test
    void testStepKeywordDefaults() {
        Step step = new Step(3, null, "hello");
        assertEquals("*", step.getKeyword());
        assertEquals("* hello", step.toString());
        assertTrue(Tag.contains(List.of(new Tag(1, "@a")), "@a"));
        assertFalse(Tag.contains(List.of(new Tag(1, "@a")), "@b"));
    }

}
