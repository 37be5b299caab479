package works.stratum.drivers;

import java.util.List;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.ObjectNode;

/**
 * Operations on a JSON document addressed by a list of object member names.
 * <p>
 * The methods that modify a document may modify it in place;
 * callers that need the original should pass a copy.
 * A null document means "no document".
 */
public final class JsonTree {
	private JsonTree() {}

	/**
	 * @return the node at the given path, or null if there is none
	 */
	public static @Nullable JsonNode find(@Nullable JsonNode document, List<String> path) {
		JsonNode current = document;
		for (String segment: path) {
			if (current == null || !current.isObject()) {
				return null;
			}
			current = current.get(segment);
		}
		if (current == null || current.isMissingNode()) {
			return null;
		}
		return current;
	}

	/**
	 * Stores {@code value} at the given path, creating any missing objects along the way.
	 * Any non-object found where an object is needed is replaced.
	 *
	 * @return the new document
	 */
	public static JsonNode put(@Nullable JsonNode document, List<String> path, JsonNode value) {
		if (path.isEmpty()) {
			return value;
		}
		ObjectNode root = (document instanceof ObjectNode o)? o : JsonNodeFactory.instance.objectNode();
		ObjectNode parent = root;
		for (String segment: path.subList(0, path.size() - 1)) {
			JsonNode child = parent.get(segment);
			if (child instanceof ObjectNode o) {
				parent = o;
			} else {
				ObjectNode newChild = JsonNodeFactory.instance.objectNode();
				parent.set(segment, newChild);
				parent = newChild;
			}
		}
		parent.set(path.get(path.size() - 1), value);
		return root;
	}

	/**
	 * Deletes the node at the given path, if any,
	 * along with any objects left empty as a result.
	 *
	 * @return the new document, or null if nothing remains
	 */
	public static @Nullable JsonNode remove(@Nullable JsonNode document, List<String> path) {
		if (document == null || path.isEmpty()) {
			return null;
		}
		if (!(document instanceof ObjectNode root)) {
			// The path leads through a non-object, so there's nothing there to remove
			return document;
		}
		if (!removeFrom(root, path, 0)) {
			return root;
		}
		return root.isEmpty()? null : root;
	}

	/**
	 * @return whether anything was removed. Emptied objects are pruned only in that case.
	 */
	private static boolean removeFrom(ObjectNode node, List<String> path, int index) {
		String segment = path.get(index);
		if (index == path.size() - 1) {
			return node.remove(segment) != null;
		}
		if (node.get(segment) instanceof ObjectNode child && removeFrom(child, path, index + 1)) {
			if (child.isEmpty()) {
				node.remove(segment);
			}
			return true;
		}
		return false;
	}
}
