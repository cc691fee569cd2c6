package works.jotter.codec;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The grammatical context an entry of the writer's node stack represents.
 */
public enum NodeKind {
	/**
	 * The bottom of the stack, present for the writer's whole life.
	 * Accepts exactly one value.
	 */
	ROOT,
	OBJECT,
	ARRAY,

	/**
	 * A member name has been written, and its value has not.
	 */
	KEY,

	/**
	 * Any scalar. Used only when checking rules; never pushed.
	 */
	VALUE,
	;

	private static final EnumMap<NodeKind, Set<NodeKind>> ALLOWED_CHILDREN = new EnumMap<>(Map.of(
		ROOT,   EnumSet.of(OBJECT, ARRAY, VALUE),
		OBJECT, EnumSet.of(KEY),
		ARRAY,  EnumSet.of(OBJECT, ARRAY, VALUE),
		KEY,    EnumSet.of(OBJECT, ARRAY, VALUE),
		VALUE,  EnumSet.noneOf(NodeKind.class)
	));

	/**
	 * Doesn't account for {@link #ROOT}'s limit of one child; the caller must check that.
	 */
	public boolean allowsChild(NodeKind child) {
		return ALLOWED_CHILDREN.get(this).contains(child);
	}
}
