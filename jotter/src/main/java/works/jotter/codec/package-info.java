/**
 * Writing JSON text.
 * <p>
 * Most callers want {@link works.jotter.codec.JsonWriter}, which checks every call against the JSON grammar
 * and inserts separators. {@link works.jotter.codec.RawJsonWriter} is the layer underneath,
 * for callers that assemble tokens themselves and take responsibility for the result.
 */
package works.jotter.codec;
