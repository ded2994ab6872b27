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

import io.cucumber.gherkin.GherkinParser;
import io.cucumber.messages.types.DataTable;
import io.cucumber.messages.types.DocString;
import io.cucumber.messages.types.Envelope;
import io.cucumber.messages.types.Examples;
import io.cucumber.messages.types.FeatureChild;
import io.cucumber.messages.types.GherkinDocument;
import io.cucumber.messages.types.Location;
import io.cucumber.messages.types.ParseError;
import io.cucumber.messages.types.Rule;
import io.cucumber.messages.types.RuleChild;
import io.cucumber.messages.types.Source;
import io.cucumber.messages.types.SourceMediaType;
import io.cucumber.messages.types.TableCell;
import io.cucumber.messages.types.TableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Builds the immutable {@link Feature} tree from the Cucumber Gherkin AST.
 * Only the gherkin document is requested from the parser, pickles are not used.
 */
public class FeatureParser {

    private static final Logger logger = LoggerFactory.getLogger(FeatureParser.class);

    private FeatureParser() {
        // only static methods
    }

    public static Feature parse(Path path) {
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FeatureParseException(path.toString(), "read failed", e);
        }
        return parse(path.toString(), text);
    }

    public static Feature parse(String uri, String text) {
        GherkinParser parser = GherkinParser.builder()
                .includeSource(false)
                .includePickles(false)
                .includeGherkinDocument(true)
                .build();
        Source source = new Source(uri, text, SourceMediaType.TEXT_X_CUCUMBER_GHERKIN_PLAIN);
        List<Envelope> envelopes = parser.parse(Envelope.of(source)).toList();
        GherkinDocument document = null;
        for (Envelope envelope : envelopes) {
            Optional<ParseError> error = envelope.getParseError();
            if (error.isPresent()) {
                ParseError pe = error.get();
                int line = pe.getSource().getLocation().map(FeatureParser::line).orElse(-1);
                throw new FeatureParseException(uri, line, pe.getMessage());
            }
            if (envelope.getGherkinDocument().isPresent()) {
                document = envelope.getGherkinDocument().get();
            }
        }
        if (document == null || document.getFeature().isEmpty()) {
            throw new FeatureParseException(uri, 1, "no feature found");
        }
        Feature feature = toFeature(uri, document.getFeature().get());
        logger.debug("parsed {} with {} scenario(s)", uri, feature.getScenarios().size());
        return feature;
    }

    private static Feature toFeature(String uri, io.cucumber.messages.types.Feature gf) {
        List<Tag> featureTags = toTags(gf.getTags());
        Background background = null;
        List<Scenario> scenarios = new ArrayList<>();
        for (FeatureChild child : gf.getChildren()) {
            if (child.getBackground().isPresent()) {
                background = toBackground(child.getBackground().get());
            } else if (child.getScenario().isPresent()) {
                List<Step> bg = background == null ? Collections.emptyList() : background.getSteps();
                scenarios.add(toScenario(uri, scenarios.size(), child.getScenario().get(), featureTags, bg, null));
            } else if (child.getRule().isPresent()) {
                Rule rule = child.getRule().get();
                List<Tag> inherited = new ArrayList<>(featureTags);
                inherited.addAll(toTags(rule.getTags()));
                List<Step> bg = new ArrayList<>();
                if (background != null) {
                    bg.addAll(background.getSteps());
                }
                for (RuleChild rc : rule.getChildren()) {
                    if (rc.getBackground().isPresent()) {
                        bg.addAll(toBackground(rc.getBackground().get()).getSteps());
                    } else if (rc.getScenario().isPresent()) {
                        scenarios.add(toScenario(uri, scenarios.size(), rc.getScenario().get(), inherited, bg, rule.getName()));
                    }
                }
            }
        }
        return new Feature(uri, line(gf.getLocation()), gf.getName(), trimToNull(gf.getDescription()),
                featureTags, background, scenarios);
    }

    private static Background toBackground(io.cucumber.messages.types.Background gb) {
        return new Background(line(gb.getLocation()), gb.getName(), toSteps(gb.getSteps()));
    }

    private static Scenario toScenario(String uri, int index, io.cucumber.messages.types.Scenario gs,
                                       List<Tag> inherited, List<Step> background, String ruleName) {
        Scenario.Builder builder = Scenario.builder()
                .featureUri(uri)
                .index(index)
                .line(line(gs.getLocation()))
                .keyword(gs.getKeyword())
                .name(gs.getName())
                .description(trimToNull(gs.getDescription()))
                .tags(toTags(gs.getTags()))
                .inheritedTags(inherited)
                .backgroundSteps(background)
                .steps(toSteps(gs.getSteps()))
                .ruleName(ruleName);
        for (Examples ge : gs.getExamples()) {
            List<List<String>> rows = new ArrayList<>();
            ge.getTableHeader().ifPresent(header -> rows.add(toCells(header)));
            for (TableRow row : ge.getTableBody()) {
                rows.add(toCells(row));
            }
            if (rows.isEmpty()) {
                continue;
            }
            Table table = new Table(line(ge.getLocation()), rows);
            builder.examples(new ExamplesTable(line(ge.getLocation()), ge.getName(), toTags(ge.getTags()), table));
        }
        return builder.build();
    }

    private static List<Step> toSteps(List<io.cucumber.messages.types.Step> list) {
        List<Step> steps = new ArrayList<>(list.size());
        for (io.cucumber.messages.types.Step gs : list) {
            String docString = gs.getDocString().map(DocString::getContent).orElse(null);
            Table table = null;
            if (gs.getDataTable().isPresent()) {
                DataTable dt = gs.getDataTable().get();
                List<List<String>> rows = new ArrayList<>(dt.getRows().size());
                for (TableRow row : dt.getRows()) {
                    rows.add(toCells(row));
                }
                table = new Table(line(dt.getLocation()), rows);
            }
            steps.add(new Step(line(gs.getLocation()), gs.getKeyword(), gs.getText(), docString, table));
        }
        return steps;
    }

    private static List<String> toCells(TableRow row) {
        List<String> cells = new ArrayList<>(row.getCells().size());
        for (TableCell cell : row.getCells()) {
            cells.add(cell.getValue());
        }
        return cells;
    }

    private static List<Tag> toTags(List<io.cucumber.messages.types.Tag> list) {
        List<Tag> tags = new ArrayList<>(list.size());
        for (io.cucumber.messages.types.Tag gt : list) {
            tags.add(new Tag(line(gt.getLocation()), gt.getName()));
        }
        return tags;
    }

    private static int line(Location location) {
        return location.getLine().intValue();
    }

    private static String trimToNull(String s) {
        if (s == null) {
            return null;
        }
        String trimmed = s.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

}
