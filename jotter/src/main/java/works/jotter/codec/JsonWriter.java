package works.jotter.codec;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.jotter.exceptions.JsonStructureException;
import works.jotter.exceptions.NonFiniteNumberException;
import works.jotter.exceptions.NullKeyException;
import works.jotter.io.JsonSink;
import works.jotter.io.OutputStreamSink;

import static java.util.Objects.checkFromIndexSize;
import static java.util.Objects.requireNonNull;
import static works.jotter.codec.NodeKind.ARRAY;
import static works.jotter.codec.NodeKind.KEY;
import static works.jotter.codec.NodeKind.OBJECT;
import static works.jotter.codec.NodeKind.ROOT;
import static works.jotter.codec.NodeKind.VALUE;

/**
 * A forward-only JSON writer that refuses to produce invalid JSON.
 * <p>
 * Each call is checked against a stack of {@link NodeKind nodes} describing
 * what is currently open; a call that would break the grammar throws
 * {@link JsonStructureException} before writing anything.
 * Separators are inserted automatically. Whitespace never is:
 * use {@link #writeNewline()} and {@link #writeWhitespace(int)} to lay out the text.
 * <p>
 * Once any method has thrown, the writer and the text written so far are in an unspecified state,
 * and the output should be discarded.
 * Bytes already handed to the sink are not retracted.
 * <p>
 * Not thread-safe. Use one writer per output stream.
 */
public final class JsonWriter implements Closeable {
	private final RawJsonWriter raw;
	private final Settings settings;

	// The node stack, as parallel arrays so that pushing allocates nothing.
	// Entry zero is always ROOT.
	private NodeKind[] kinds;
	private boolean[] hasChildren;
	private int depth;

	private boolean closed = false;

	/**
	 * @param closeSink whether {@link #close()} closes the sink, or merely flushes it
	 * @param requireComplete whether {@link #close()} throws if the document is {@link #isComplete() incomplete}
	 * @param initialDepth capacity of the node stack before it needs to grow
	 */
	public record Settings(
		boolean closeSink,
		boolean requireComplete,
		int initialDepth
	) {
		public static final Settings DEFAULT = new Settings(true, false, 16);

		public Settings {
			if (initialDepth < 1) {
				throw new IllegalArgumentException("initialDepth must be positive: " + initialDepth);
			}
		}

		public Settings withCloseSink(boolean closeSink) {
			return new Settings(closeSink, requireComplete, initialDepth);
		}

		public Settings withRequireComplete(boolean requireComplete) {
			return new Settings(closeSink, requireComplete, initialDepth);
		}

		public Settings withInitialDepth(int initialDepth) {
			return new Settings(closeSink, requireComplete, initialDepth);
		}
	}

	public JsonWriter(JsonSink sink, Settings settings) {
		this.raw = new RawJsonWriter(sink);
		this.settings = requireNonNull(settings);
		this.kinds = new NodeKind[settings.initialDepth()];
		this.hasChildren = new boolean[settings.initialDepth()];
		kinds[0] = ROOT;
		depth = 1;
		LOGGER.debug("Created JsonWriter on {} with {}", sink.getClass().getSimpleName(), settings);
	}

	public static JsonWriter create(JsonSink sink) {
		return new JsonWriter(sink, Settings.DEFAULT);
	}

	/**
	 * @return a writer on the given stream.
	 * The stream will be closed when the writer is closed.
	 */
	public static JsonWriter create(OutputStream stream) {
		return new JsonWriter(new OutputStreamSink(stream), Settings.DEFAULT);
	}

	/**
	 * The kind of the innermost open node.
	 * For example, after {@link #startObject()}, this returns {@link NodeKind#OBJECT OBJECT}
	 * until the matching {@link #endObject()} or until something is nested inside.
	 */
	public NodeKind parentNode() {
		return kinds[depth - 1];
	}

	/**
	 * @return the number of open nodes, counting the root; never less than 1
	 */
	public int depth() {
		return depth;
	}

	/**
	 * @return true if the root value has been written in full,
	 * so that the output so far is a complete JSON document
	 */
	public boolean isComplete() {
		return depth == 1 && hasChildren[0];
	}

	public long outpos() {
		return raw.sink().outpos();
	}

	//
	// Containers
	//

	public void startObject() throws IOException {
		checkChild(OBJECT, "start object");
		writeSeparator();
		raw.writeStartObject();
		push(OBJECT);
	}

	public void startArray() throws IOException {
		checkChild(ARRAY, "start array");
		writeSeparator();
		raw.writeStartArray();
		push(ARRAY);
	}

	public void endObject() throws IOException {
		checkEnd(OBJECT, "end object");
		raw.writeEndObject();
		pop();
		completeChild();
	}

	public void endArray() throws IOException {
		checkEnd(ARRAY, "end array");
		raw.writeEndArray();
		pop();
		completeChild();
	}

	//
	// Keys
	//

	/**
	 * Writes a member name. The next call must write its value,
	 * either a scalar or a container.
	 */
	public void writeKey(CharSequence key) throws IOException {
		beginKey(key == null, "write key");
		raw.writeString(key);
		push(KEY);
	}

	/**
	 * Writes a member name that is already UTF-8 encoded.
	 */
	public void writeKey(byte[] utf8Key, int offset, int length) throws IOException {
		if (utf8Key != null) {
			checkFromIndexSize(offset, length, utf8Key.length);
		}
		beginKey(utf8Key == null, "write key");
		raw.writeString(utf8Key, offset, length);
		push(KEY);
	}

	//
	// Values. Each category of scalar has its own overload.
	//

	public void writeValue(int value) throws IOException {
		beginValue("write value");
		raw.writeInt(value);
		completeChild();
	}

	public void writeValue(long value) throws IOException {
		beginValue("write value");
		raw.writeLong(value);
		completeChild();
	}

	/**
	 * @param value interpreted as unsigned
	 */
	public void writeUnsignedValue(long value) throws IOException {
		beginValue("write value");
		raw.writeUnsignedLong(value);
		completeChild();
	}

	public void writeValue(float value) throws IOException {
		requireFinite(value);
		beginValue("write value");
		raw.writeFloat(value);
		completeChild();
	}

	public void writeValue(double value) throws IOException {
		requireFinite(value);
		beginValue("write value");
		raw.writeDouble(value);
		completeChild();
	}

	/**
	 * @param value if null, writes {@code null}
	 */
	public void writeValue(JsonNumber value) throws IOException {
		requireFinite(value);
		beginValue("write value");
		raw.write(value);
		completeChild();
	}

	public void writeValue(boolean value) throws IOException {
		beginValue("write value");
		raw.writeBoolean(value);
		completeChild();
	}

	/**
	 * @param value if null, writes {@code null}
	 */
	public void writeValue(CharSequence value) throws IOException {
		beginValue("write value");
		raw.writeString(value);
		completeChild();
	}

	public void writeNullValue() throws IOException {
		beginValue("write value");
		raw.writeNull();
		completeChild();
	}

	//
	// Object members written in one call
	//

	public void writeKeyValue(CharSequence key, int value) throws IOException {
		beginMember(key);
		raw.writeInt(value);
		completeChild();
	}

	public void writeKeyValue(CharSequence key, long value) throws IOException {
		beginMember(key);
		raw.writeLong(value);
		completeChild();
	}

	/**
	 * @param value interpreted as unsigned
	 */
	public void writeKeyUnsignedValue(CharSequence key, long value) throws IOException {
		beginMember(key);
		raw.writeUnsignedLong(value);
		completeChild();
	}

	public void writeKeyValue(CharSequence key, float value) throws IOException {
		checkKey(key == null, "write key-value pair");
		requireFinite(value);
		writeMember(key);
		raw.writeFloat(value);
		completeChild();
	}

	public void writeKeyValue(CharSequence key, double value) throws IOException {
		checkKey(key == null, "write key-value pair");
		requireFinite(value);
		writeMember(key);
		raw.writeDouble(value);
		completeChild();
	}

	public void writeKeyValue(CharSequence key, JsonNumber value) throws IOException {
		checkKey(key == null, "write key-value pair");
		requireFinite(value);
		writeMember(key);
		raw.write(value);
		completeChild();
	}

	public void writeKeyValue(CharSequence key, boolean value) throws IOException {
		beginMember(key);
		raw.writeBoolean(value);
		completeChild();
	}

	public void writeKeyValue(CharSequence key, CharSequence value) throws IOException {
		beginMember(key);
		raw.writeString(value);
		completeChild();
	}

	public void writeKeyNullValue(CharSequence key) throws IOException {
		beginMember(key);
		raw.writeNull();
		completeChild();
	}

	//
	// Layout
	//

	public void writeNewline() throws IOException {
		raw.writeNewline();
	}

	public void writeWhitespace(int numSpaces) throws IOException {
		raw.writeWhitespace(numSpaces);
	}

	public void flush() throws IOException {
		raw.flush();
	}

	/**
	 * Flushes the output and, if {@link Settings#closeSink()} is set, closes the sink.
	 * A failure to flush is thrown to the caller.
	 * <p>
	 * If the document is incomplete and {@link Settings#requireComplete()} is set,
	 * throws {@link JsonStructureException} after the sink has been dealt with.
	 * Calling this more than once has no further effect.
	 */
	@Override
	public void close() throws IOException {
		if (closed) {
			return;
		}
		closed = true;
		LOGGER.debug("Closing JsonWriter at offset {} with {} open node(s)", outpos(), depth);
		if (settings.closeSink()) {
			raw.close();
		} else {
			raw.flush();
		}
		if (!isComplete()) {
			if (settings.requireComplete()) {
				throw new JsonStructureException("Document incomplete at close: " + describeStack());
			} else {
				LOGGER.warn("JsonWriter closed with incomplete document: {}", describeStack());
			}
		}
	}

	//
	// The state machine
	//

	private void checkChild(NodeKind child, String operation) {
		NodeKind parent = kinds[depth - 1];
		if (!parent.allowsChild(child)) {
			throw new JsonStructureException("Cannot " + operation + " when parent node is " + parent + " at offset " + outpos());
		}
		if (parent == ROOT && hasChildren[0]) {
			throw new JsonStructureException("Cannot " + operation + ": multiple root values");
		}
	}

	private void checkEnd(NodeKind kind, String operation) {
		NodeKind top = kinds[depth - 1];
		if (top != kind) {
			throw new JsonStructureException("Cannot " + operation + " when parent node is " + top + " at offset " + outpos());
		}
	}

	private void checkKey(boolean isNull, String operation) {
		if (isNull) {
			throw new NullKeyException("Key is null");
		}
		checkChild(KEY, operation);
	}

	private void beginKey(boolean isNull, String operation) throws IOException {
		checkKey(isNull, operation);
		if (hasChildren[depth - 1]) {
			raw.writeItemSeparator();
		}
	}

	private void beginValue(String operation) throws IOException {
		checkChild(VALUE, operation);
		writeSeparator();
	}

	private void beginMember(CharSequence key) throws IOException {
		checkKey(key == null, "write key-value pair");
		writeMember(key);
	}

	/**
	 * Assumes {@link #checkKey} has passed.
	 */
	private void writeMember(CharSequence key) throws IOException {
		if (hasChildren[depth - 1]) {
			raw.writeItemSeparator();
		}
		raw.writeString(key);
		raw.writeKeySeparator();
	}

	/**
	 * Assumes {@link #checkChild} has passed, so the top is never a {@link NodeKind#ROOT ROOT} with children.
	 */
	private void writeSeparator() throws IOException {
		int top = depth - 1;
		if (hasChildren[top]) {
			raw.writeItemSeparator();
		} else if (kinds[top] == KEY) {
			// A key is popped before it can have children
			raw.writeKeySeparator();
		}
	}

	/**
	 * Called when a value has been written in full.
	 * A key whose value this was is finished too.
	 */
	private void completeChild() {
		if (kinds[depth - 1] == KEY) {
			pop();
		}
		hasChildren[depth - 1] = true;
	}

	private void push(NodeKind kind) {
		if (depth == kinds.length) {
			kinds = Arrays.copyOf(kinds, depth * 2);
			hasChildren = Arrays.copyOf(hasChildren, depth * 2);
		}
		kinds[depth] = kind;
		hasChildren[depth] = false;
		depth++;
		LOGGER.trace("Push {} to depth {}", kind, depth);
	}

	private void pop() {
		assert depth > 1: "Root node must never be popped";
		depth--;
		LOGGER.trace("Pop {} to depth {}", kinds[depth], depth);
		kinds[depth] = null;
	}

	private String describeStack() {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < depth; i++) {
			if (i > 0) {
				sb.append(" > ");
			}
			sb.append(kinds[i]);
		}
		if (depth == 1 && !hasChildren[0]) {
			sb.append(" (empty)");
		}
		return sb.toString();
	}

	private static void requireFinite(double value) {
		if (!Double.isFinite(value)) {
			throw NonFiniteNumberException.of(value);
		}
	}

	private static void requireFinite(JsonNumber value) {
		if (value == null) {
			return;
		}
		switch (value.type()) {
			case FLOAT -> requireFinite(value.floatValue());
			case DOUBLE -> requireFinite(value.doubleValue());
			default -> {}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonWriter.class);
}
