package org.stylecast.lowering.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.stylecast.lowering.api.LoweredFile;
import org.stylecast.lowering.diagnostics.Warning;
import org.stylecast.lowering.lower.CompoundVariant;
import org.stylecast.lowering.lower.LoweredComponent;
import org.stylecast.lowering.lower.StyleFnSpec;
import org.stylecast.lowering.lower.VariantApplication;
import org.stylecast.lowering.style.ImportSpec;
import org.stylecast.lowering.style.StyleValue;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Renders lowered files as JSON for the code generator.
 * <p>
 * Style values map as follows: strings to JSON strings, numbers to JSON numbers,
 * expressions to {@code {"expr": source, "imports": [...]}}, null to JSON null and nested
 * values to objects.
 */
public class LoweredResultWriter {

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @param file The lowered file.
     * @return The JSON tree.
     */
    public JsonNode toJson(LoweredFile file) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("file", file.fileName());
        ArrayNode components = root.putArray("components");
        file.components().forEach(c -> components.add(component(c)));
        root.set("warnings", warnings(file.warnings()));
        return root;
    }

    /**
     * @param file The lowered file.
     * @return Pretty-printed JSON.
     */
    public String write(LoweredFile file) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(file));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize lowered file " + file.fileName(), e);
        }
    }

    /**
     * @param component A lowered component.
     * @return The component as JSON.
     */
    public ObjectNode component(LoweredComponent component) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("name", component.name());
        if (component.target() != null) {
            node.put("target", component.target());
        }
        node.put("styleKey", component.styleKey());
        node.put("bailed", component.bailed());
        node.set("styleObj", styleMap(component.styleObj()));

        ObjectNode buckets = node.putObject("variantBuckets");
        component.variantBuckets().forEach((when, bucket) -> buckets.set(when, styleMap(bucket)));
        ObjectNode keys = node.putObject("variantStyleKeys");
        component.variantStyleKeys().forEach(keys::put);

        ArrayNode applications = node.putArray("variantApplications");
        for (VariantApplication application : component.variantApplications()) {
            ObjectNode entry = applications.addObject();
            if (application instanceof VariantApplication.Guarded guarded) {
                entry.put("kind", "guarded");
                entry.put("when", guarded.when());
                entry.put("styleKey", guarded.styleKey());
            } else if (application instanceof VariantApplication.Ternary ternary) {
                entry.put("kind", "ternary");
                entry.put("when", ternary.when());
                entry.put("trueKey", ternary.trueKey());
                entry.put("falseKey", ternary.falseKey());
            }
        }

        ArrayNode compounds = node.putArray("compoundVariants");
        for (CompoundVariant compound : component.compoundVariants()) {
            ObjectNode entry = compounds.addObject();
            entry.put("outerProp", compound.outerProp());
            entry.put("innerProp", compound.innerProp());
            entry.put("outerKey", compound.outerKey());
            entry.put("innerTrueKey", compound.innerTrueKey());
            entry.put("innerFalseKey", compound.innerFalseKey());
        }

        ArrayNode functions = node.putArray("styleFnSpecs");
        for (StyleFnSpec spec : component.styleFnSpecs()) {
            ObjectNode entry = functions.addObject();
            entry.put("styleKey", spec.styleKey());
            entry.put("paramName", spec.paramName());
            entry.put("originalPropName", spec.originalPropName());
            ArrayNode properties = entry.putArray("properties");
            spec.properties().forEach(properties::add);
            ArrayNode scope = entry.putArray("scope");
            spec.scope().forEach(scope::add);
            if (spec.fallback() != null) {
                entry.set("fallback", value(spec.fallback()));
            }
            if (spec.important()) {
                entry.put("important", true);
            }
        }

        ArrayNode mixins = node.putArray("mixins");
        component.mixins().forEach(m -> mixins.add(value(m)));
        ObjectNode comments = node.putObject("comments");
        component.comments().forEach(comments::put);
        node.set("imports", imports(component.imports()));
        return node;
    }

    private ObjectNode styleMap(Map<String, StyleValue> style) {
        ObjectNode node = objectMapper.createObjectNode();
        style.forEach((key, value) -> node.set(key, value(value)));
        return node;
    }

    /**
     * @param value A style value.
     * @return Its JSON form.
     */
    public JsonNode value(StyleValue value) {
        if (value instanceof StyleValue.Str s) {
            return objectMapper.getNodeFactory().textNode(s.value());
        }
        if (value instanceof StyleValue.Num n) {
            return objectMapper.getNodeFactory().numberNode(new BigDecimal(n.raw()));
        }
        if (value instanceof StyleValue.Expr e) {
            ObjectNode node = objectMapper.createObjectNode();
            node.put("expr", e.source());
            if (!e.imports().isEmpty()) {
                node.set("imports", imports(e.imports()));
            }
            return node;
        }
        if (value instanceof StyleValue.Nested nested) {
            return styleMap(nested.entries());
        }
        return objectMapper.getNodeFactory().nullNode();
    }

    private ArrayNode imports(List<ImportSpec> imports) {
        ArrayNode array = objectMapper.createArrayNode();
        for (ImportSpec spec : imports) {
            ObjectNode entry = array.addObject();
            entry.put("source", spec.source());
            entry.put("name", spec.name());
        }
        return array;
    }

    private ArrayNode warnings(List<Warning> warnings) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Warning warning : warnings) {
            ObjectNode entry = array.addObject();
            entry.put("severity", warning.severity().id());
            entry.put("category", warning.category().id());
            entry.put("message", warning.message());
            entry.put("line", warning.location().line());
            entry.put("column", warning.location().column());
            ObjectNode context = entry.putObject("context");
            warning.context().forEach(context::put);
        }
        return array;
    }
}
