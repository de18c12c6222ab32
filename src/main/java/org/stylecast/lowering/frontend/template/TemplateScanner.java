package org.stylecast.lowering.frontend.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stylecast.lowering.api.SourceLocation;
import org.stylecast.lowering.diagnostics.WarningCategory;
import org.stylecast.lowering.diagnostics.WarningCollector;
import org.stylecast.lowering.frontend.js.JsNode;
import org.stylecast.lowering.frontend.js.JsParser;
import org.stylecast.lowering.frontend.js.TemplateLiterals;
import org.stylecast.lowering.ir.Placeholders;
import org.stylecast.lowering.ir.Slot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Replaces the interpolations of a template body with placeholders and parses
 * each interpolation into a {@link Slot}.
 */
public class TemplateScanner {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateScanner.class);

    private final Placeholders placeholders;

    public TemplateScanner(Placeholders placeholders) {
        this.placeholders = placeholders;
    }

    /**
     * Scans a template body.
     *
     * @param body     The text between the backticks.
     * @param origin   Location of the first body character in the file.
     * @param warnings Receives a {@code parse-error} warning per interpolation that does not parse.
     * @return The scanned template.
     * @throws IllegalArgumentException if an interpolation is not closed.
     */
    public StyledTemplate scan(String body, SourceLocation origin, WarningCollector warnings) {
        TemplateLiterals.Parts parts = TemplateLiterals.split(body);
        StringBuilder css = new StringBuilder(parts.quasis().get(0));
        List<Slot> slots = new ArrayList<>();
        for (int i = 0; i < parts.expressions().size(); i++) {
            String source = parts.expressions().get(i).trim();
            SourceLocation location = SourceLines.locate(body, parts.expressionOffsets().get(i), origin);
            JsNode expression = JsParser.tryParse(source).orElse(null);
            if (expression == null) {
                LOG.debug("Interpolation at {} does not parse: {}", location, source);
                warnings.report(WarningCategory.PARSE_ERROR,
                        "Interpolation could not be parsed: " + source, location, Map.of("source", source));
            }
            Slot slot = new Slot(i, placeholders.placeholder(i), expression, source, location);
            slots.add(slot);
            css.append(slot.placeholder()).append(parts.quasis().get(i + 1));
        }
        return new StyledTemplate(css.toString(), slots);
    }
}
