package software.amazon.dfa;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import it.unimi.dsi.fastutil.objects.Object2IntMap;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Renders a Dfa's state table as JSON, for debugging and for inspecting what a pattern compiled to. For the pattern
 * "ABABAC" the output starts:
 * <pre>
 *   {"initialState":0,"finalState":6,"currentState":0,"states":[
 *     [{"element":"A","next":1}],
 *     [{"element":"A","next":1},{"element":"B","next":2}],
 *     ...
 * </pre>
 * Within a state, transitions are sorted by target state and then by the element's string form. Numbers, booleans
 * and JSON values are written as JSON; any other element is written as its toString().
 */
@ThreadSafe
public final class DfaDescriber {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final Comparator<Object2IntMap.Entry<?>> BY_TARGET_THEN_ELEMENT =
            Comparator.<Object2IntMap.Entry<?>>comparingInt(Object2IntMap.Entry::getIntValue)
                    .thenComparing(entry -> String.valueOf(entry.getKey()));

    private DfaDescriber() { }

    public static String describe(final Dfa<?> dfa) {
        try {
            return OBJECT_MAPPER.writeValueAsString(toJsonNode(dfa));
        } catch (JsonProcessingException e) {
            // a tree built from nodes we created ourselves always serializes
            throw new IllegalStateException("Cannot serialize state table", e);
        }
    }

    static ObjectNode toJsonNode(final Dfa<?> dfa) {
        final ObjectNode root = OBJECT_MAPPER.createObjectNode();
        root.put("initialState", dfa.initialState());
        root.put("finalState", dfa.finalState());
        root.put("currentState", dfa.currentState());
        final ArrayNode states = root.putArray("states");
        for (StateNode<?> state : dfa.states()) {
            states.add(describeState(state));
        }
        return root;
    }

    private static ArrayNode describeState(final StateNode<?> state) {
        final List<Object2IntMap.Entry<?>> transitions = new ArrayList<>(state.transitions());
        transitions.sort(BY_TARGET_THEN_ELEMENT);

        final ArrayNode node = OBJECT_MAPPER.createArrayNode();
        for (Object2IntMap.Entry<?> transition : transitions) {
            final ObjectNode entry = node.addObject();
            entry.set("element", elementToJson(transition.getKey()));
            entry.put("next", transition.getIntValue());
        }
        return node;
    }

    private static JsonNode elementToJson(final Object element) {
        if (element == null) {
            return NullNode.getInstance();
        }
        if (element instanceof JsonNode) {
            return (JsonNode) element;
        }
        if (element instanceof Number || element instanceof Boolean) {
            return OBJECT_MAPPER.valueToTree(element);
        }
        return TextNode.valueOf(String.valueOf(element));
    }
}
