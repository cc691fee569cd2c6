/**
 * The byte-level plumbing underneath the writer.
 * The main abstraction is {@link works.jotter.io.JsonSink},
 * the minimal contract the writer needs from its destination,
 * with bridges to {@link java.io.OutputStream} and to memory.
 * {@link works.jotter.io.ByteInput} is the one-pass source
 * the string escaper drains.
 */
package works.jotter.io;
