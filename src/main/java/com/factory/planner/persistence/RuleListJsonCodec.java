package com.factory.planner.persistence;

import com.factory.planner.domain.Catalog;
import com.factory.planner.domain.Constraint;
import com.factory.planner.domain.Rule;
import com.factory.planner.domain.RuleList;
import com.factory.planner.domain.VariableId;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads and writes rule-list documents. Rules refer to resources and recipes by name:
 * <pre>
 * {"rules": [
 *   {"Resource": {"resource": "Iron Ore", "constraint": {"Greater": -60.0}}},
 *   {"Recipe": {"recipe": "Smelt Iron", "constraint": "Unconstrained"}}]}
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class RuleListJsonCodec {

    private static final String RESOURCE = "Resource";
    private static final String RECIPE = "Recipe";
    private static final String LESS = "Less";
    private static final String EQUAL = "Equal";
    private static final String GREATER = "Greater";
    private static final String UNCONSTRAINED = "Unconstrained";

    private final ObjectMapper objectMapper;

    public RuleList read(Reader reader, Catalog catalog) throws CatalogLoadException {
        JsonNode root;
        try {
            root = objectMapper.readTree(reader);
        } catch (JsonProcessingException e) {
            throw CatalogLoadException.malformed("Rule list document is not valid: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw CatalogLoadException.malformed("Could not read rule list document", e);
        }
        return fromTree(root, catalog);
    }

    public void write(RuleList ruleList, Catalog catalog, Writer writer) throws IOException {
        objectMapper.writeValue(writer, toTree(ruleList, catalog));
    }

    public RuleList fromTree(JsonNode root, Catalog catalog) throws CatalogLoadException {
        RuleList.RuleListBuilder ruleList = RuleList.builder();
        if (root == null || root.isNull() || root.isMissingNode()) {
            return ruleList.build();
        }

        JsonNode rules = root.get("rules");
        if (rules == null || !rules.isArray()) {
            throw CatalogLoadException.malformed("Rule list document needs a 'rules' array", null);
        }

        for (JsonNode entry : rules) {
            Map.Entry<String, JsonNode> tagged = singleField(entry, "rule");
            JsonNode body = tagged.getValue();
            VariableId variable = switch (tagged.getKey()) {
                case RESOURCE -> {
                    String name = text(body, "resource");
                    yield catalog.resourceIdOfName(name)
                            .orElseThrow(() -> CatalogLoadException.unknownResource(null, name))
                            .variableId();
                }
                case RECIPE -> {
                    String name = text(body, "recipe");
                    yield catalog.recipeIdOfName(name)
                            .orElseThrow(() -> CatalogLoadException.unknownRecipe(name))
                            .variableId();
                }
                default -> throw CatalogLoadException.malformed("Unknown rule kind '" + tagged.getKey() + "'", null);
            };
            ruleList.rule(Rule.of(variable, readConstraint(body.get("constraint"))));
        }
        return ruleList.build();
    }

    public JsonNode toTree(RuleList ruleList, Catalog catalog) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode rules = root.putArray("rules");
        for (Rule rule : ruleList.getRules()) {
            VariableId variable = rule.getVariable();
            ObjectNode body = objectMapper.createObjectNode();
            String tag = switch (variable.getKind()) {
                case RESOURCE -> {
                    body.put("resource", catalog.nameOfResource(variable.asResource()));
                    yield RESOURCE;
                }
                case RECIPE -> {
                    body.put("recipe", catalog.nameOfRecipe(variable.asRecipe()));
                    yield RECIPE;
                }
            };
            body.set("constraint", writeConstraint(rule.getConstraint()));
            rules.addObject().set(tag, body);
        }
        return root;
    }

    /**
     * {@code "Unconstrained"} or a single-field object such as {@code {"Less": 5.0}}.
     */
    public Constraint readConstraint(JsonNode node) throws CatalogLoadException {
        if (node == null) {
            throw CatalogLoadException.malformed("Rule is missing its 'constraint'", null);
        }
        if (node.isTextual()) {
            if (UNCONSTRAINED.equals(node.asText())) {
                return Constraint.unconstrained();
            }
            throw CatalogLoadException.malformed("Unknown constraint '" + node.asText() + "'", null);
        }

        Map.Entry<String, JsonNode> tagged = singleField(node, "constraint");
        if (!tagged.getValue().isNumber()) {
            throw CatalogLoadException.malformed("Constraint '" + tagged.getKey() + "' needs a numeric value", null);
        }
        double threshold = tagged.getValue().asDouble();
        return switch (tagged.getKey()) {
            case LESS -> Constraint.less(threshold);
            case EQUAL -> Constraint.equal(threshold);
            case GREATER -> Constraint.greater(threshold);
            default -> throw CatalogLoadException.malformed("Unknown constraint '" + tagged.getKey() + "'", null);
        };
    }

    public JsonNode writeConstraint(Constraint constraint) {
        return switch (constraint.getType()) {
            case LESS -> objectMapper.createObjectNode().put(LESS, constraint.getThreshold());
            case EQUAL -> objectMapper.createObjectNode().put(EQUAL, constraint.getThreshold());
            case GREATER -> objectMapper.createObjectNode().put(GREATER, constraint.getThreshold());
            case UNCONSTRAINED -> objectMapper.getNodeFactory().textNode(UNCONSTRAINED);
        };
    }

    private static Map.Entry<String, JsonNode> singleField(JsonNode node, String what) throws CatalogLoadException {
        if (node == null || !node.isObject() || node.size() != 1) {
            throw CatalogLoadException.malformed("Expected a single-key object for " + what, null);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        return fields.next();
    }

    private static String text(JsonNode body, String field) throws CatalogLoadException {
        JsonNode value = body == null ? null : body.get(field);
        if (value == null || !value.isTextual()) {
            throw CatalogLoadException.malformed("Rule is missing its '" + field + "' name", null);
        }
        return value.asText();
    }
}
