/**
 * Producers of the variable-length tokens: numbers and escaped strings.
 * These write straight to a {@link works.jotter.io.JsonSink} and know nothing of JSON structure.
 */
package works.jotter.codec.text;
