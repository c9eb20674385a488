package com.datapatch.jackson;

import com.datapatch.diagnostics.HostRejectionException;
import com.datapatch.host.AssetCreator;
import com.datapatch.host.Selectable;
import com.datapatch.host.SelectableRegistry;
import com.datapatch.value.DataKind;
import com.datapatch.value.DataValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * A generic element tree stored as JSON.
 *
 * <p>The document is an array of elements, or a single element. Each element is an object:</p>
 * <pre>{@code
 * {"type": "Engine", "name": "E1", "classes": ["fuel"], "value": {...}, "children": [...]}
 * }</pre>
 *
 * <p>Only {@code type} is required. Elements are wrapped with the factory registered for their
 * type, falling back to {@link JsonSelectable}. New-asset blocks append a root element; the
 * first constructor argument is its type and the optional second one its name.</p>
 *
 * <p>Not thread-safe.</p>
 */
public class JsonDocument implements AssetCreator {

    private static final Logger log = Logger.getLogger(JsonDocument.class);

    public static final String TYPE = "type";
    public static final String NAME = "name";
    public static final String CLASSES = "classes";
    public static final String VALUE = "value";
    public static final String CHILDREN = "children";

    private final ObjectMapper mapper;
    private final ArrayNode elements;
    private final boolean singleRoot;
    private final SelectableRegistry<JsonElement> registry;
    private int modifiedElements;

    private JsonDocument(ObjectMapper mapper, ArrayNode elements, boolean singleRoot,
                         SelectableRegistry<JsonElement> registry) {
        this.mapper = mapper;
        this.elements = elements;
        this.singleRoot = singleRoot;
        this.registry = registry;
    }

    public static JsonDocument parse(String json) {
        return parse(json, new SelectableRegistry<>());
    }

    /**
     * @throws IllegalArgumentException if the JSON is neither an element nor an array of elements
     */
    public static JsonDocument parse(String json, SelectableRegistry<JsonElement> registry) {
        ObjectMapper mapper = DatapatchJackson.createObjectMapper();
        JsonNode tree;
        try {
            tree = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Document is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (tree instanceof ArrayNode array) {
            return new JsonDocument(mapper, array, false, registry);
        }
        if (tree instanceof ObjectNode object) {
            ArrayNode array = mapper.createArrayNode();
            array.add(object);
            return new JsonDocument(mapper, array, true, registry);
        }
        throw new IllegalArgumentException("Document must be an element object or an array of elements");
    }

    public List<Selectable> roots() {
        return wrapAll(elements);
    }

    /**
     * @return how many element modifications made at least one edit
     */
    public int modifiedElements() {
        return modifiedElements;
    }

    @Override
    public Selectable create(List<DataValue> arguments) {
        if (arguments.isEmpty() || arguments.get(0).kind() != DataKind.STRING) {
            throw new HostRejectionException("A new asset needs its element type as first argument");
        }
        String type = ((DataValue.StringValue) arguments.get(0)).value();
        String name = null;
        if (arguments.size() > 1) {
            if (arguments.get(1).kind() != DataKind.STRING) {
                throw new HostRejectionException("The name of a new asset must be a string");
            }
            name = ((DataValue.StringValue) arguments.get(1)).value();
        }
        log.debug("Creating new asset of type '" + type + "'");
        return append(elements, type, name);
    }

    public JsonNode toJsonNode() {
        return singleRoot && elements.size() == 1 ? elements.get(0) : elements;
    }

    public String toJson() {
        return toJsonNode().toString();
    }

    public String toPrettyJson() {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJsonNode());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot write document", e);
        }
    }

    List<Selectable> wrapAll(ArrayNode container) {
        List<Selectable> wrapped = new ArrayList<>(container.size());
        for (JsonNode node : container) {
            if (node instanceof ObjectNode object) {
                wrapped.add(wrap(object, container));
            } else if (log.isDebugEnabled()) {
                log.debug("Skipping non-object element " + node);
            }
        }
        return wrapped;
    }

    Selectable append(ArrayNode container, String elementType, String name) {
        ObjectNode node = container.addObject();
        node.put(TYPE, elementType);
        if (name != null) {
            node.put(NAME, name);
        }
        node.putObject(VALUE);
        node.putArray(CHILDREN);
        return wrap(node, container);
    }

    void remove(JsonElement element) {
        ArrayNode container = element.container();
        for (int i = 0; i < container.size(); i++) {
            if (container.get(i) == element.node()) {
                container.remove(i);
                return;
            }
        }
        throw new HostRejectionException("Element of type '" + element.elementType() + "' is no longer in the document");
    }

    void recordModification(JsonElement element) {
        modifiedElements++;
        if (log.isDebugEnabled()) {
            log.debug("Modified '" + element.elementType() + "' element");
        }
    }

    private Selectable wrap(ObjectNode node, ArrayNode container) {
        JsonElement element = new JsonElement(this, node, container);
        return registry.wrap(element.elementType(), element, JsonSelectable::new);
    }
}
