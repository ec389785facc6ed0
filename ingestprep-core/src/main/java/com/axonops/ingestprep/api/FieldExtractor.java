/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.ingestprep.api;

import com.axonops.ingestprep.buffer.TextArena;
import com.axonops.ingestprep.config.IngestConfig;
import com.axonops.ingestprep.metrics.IngestMetricsRegistry;
import com.axonops.ingestprep.metrics.MetricNames;
import com.axonops.ingestprep.pool.ResourcePool;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Flattens a JSON log line into a list of {@link Field}s.
 *
 * <p>Nested objects are flattened with dotted names, so {@code {"foo":{"bar":"baz"}}} becomes
 * {@code foo.bar=baz}. Strings are decoded, arrays, numbers and booleans keep their compact JSON
 * text ({@code [1,2]}, {@code 123}, {@code true}) and nulls are dropped. Numbers are copied as
 * written, so {@code 1e5} and {@code -0} come out unchanged. Field names are not
 * deduplicated: {@code {"a.b":1,"a":{"b":2}}} yields two fields named {@code a.b}.
 *
 * <p>NOT Thread-Safe: an extractor is owned by one caller between {@link #acquire()} and
 * {@link #close()}. Extractors are pooled so their buffers are reused across log lines.
 *
 * <p>Field names and values are views into a backing buffer owned by the extractor. They stay
 * readable until the next {@link #parse(String, String)} or until the extractor is released;
 * {@link #parseNoResetBuffer(String, String)} keeps earlier views readable as well.
 *
 * <p>Example:
 * <pre>{@code
 * try (FieldExtractor extractor = FieldExtractor.acquire()) {
 *     extractor.parse(line, "");
 *     extractor.renameField("message", "_msg");
 *     for (Field f : extractor.fields()) {
 *         row.add(f.name(), f.value());
 *     }
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class FieldExtractor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(FieldExtractor.class);

    /** Name of the pool extractors live in, used for pool metric names. */
    public static final String POOL_NAME = "extractors";

    // Streaming parser: keys are visited as written and scalar text is copied unchanged
    private static final JsonFactory JSON = JsonFactory.builder().build();

    // Global extractor pool (replaceable for testing only)
    private static volatile ResourcePool<FieldExtractor> globalPool = newPool(IngestConfig.DEFAULT);

    private final ResourcePool<FieldExtractor> owner;
    private final IngestMetricsRegistry metrics;

    private final List<Field> fields = new ArrayList<>();
    private final List<Field> fieldsView = Collections.unmodifiableList(fields);
    private final TextArena arena = new TextArena();
    private final StringBuilder prefix = new StringBuilder();
    private final AtomicBoolean released = new AtomicBoolean(false);

    FieldExtractor(ResourcePool<FieldExtractor> owner, IngestMetricsRegistry metrics) {
        this.owner = Objects.requireNonNull(owner);
        this.metrics = Objects.requireNonNull(metrics);
    }

    // ========== Pool Access ==========

    /**
     * Obtains an extractor from the global pool.
     *
     * @return an extractor owned by the caller until {@link #close()}
     */
    public static FieldExtractor acquire() {
        return globalPool.acquire();
    }

    /**
     * Returns the extractor to its pool. Same as {@link #close()}.
     *
     * @param extractor extractor to release; must not be used afterwards
     */
    public static void release(FieldExtractor extractor) {
        extractor.close();
    }

    /**
     * Runs {@code action} with an extractor from the global pool and releases it on every exit path.
     *
     * <p>The action must copy out any field it needs: views are dead once this method returns.
     *
     * @param action work to do with the extractor
     * @param <R> result type
     * @return the action's result
     */
    public static <R> R withExtractor(Function<? super FieldExtractor, ? extends R> action) {
        try (FieldExtractor extractor = acquire()) {
            return action.apply(extractor);
        }
    }

    /**
     * Creates a new extractor pool.
     *
     * @param config supplies the idle bound and metrics registry
     * @return a pool whose extractors release themselves back into it on {@link #close()}
     */
    public static ResourcePool<FieldExtractor> newPool(IngestConfig config) {
        IngestMetricsRegistry metrics = config.metricsRegistry();
        return new ResourcePool<>(
            POOL_NAME,
            pool -> new FieldExtractor(pool, metrics),
            FieldExtractor::activate,
            FieldExtractor::passivate,
            config.maxIdleExtractors(),
            metrics);
    }

    /**
     * Gets the global extractor pool (for monitoring and testing).
     */
    public static ResourcePool<FieldExtractor> getGlobalPool() {
        return globalPool;
    }

    /**
     * Sets a new global pool (for testing only).
     *
     * <p>Extractors leased from the previous pool keep returning to it.
     *
     * @param newPool the pool to use globally
     */
    public static void setGlobalPool(ResourcePool<FieldExtractor> newPool) {
        globalPool = Objects.requireNonNull(newPool, "newPool cannot be null");
    }

    // ========== Parsing ==========

    /**
     * Parses a JSON log line, resetting the backing buffer first.
     *
     * @param msg UTF-8 encoded JSON object
     * @param prefix prepended verbatim to every field name (e.g., "" or "kubernetes.")
     * @throws MalformedInputException if msg is not a single JSON value
     * @throws UnexpectedRootTypeException if the value is not an object
     */
    public void parse(byte[] msg, String prefix) {
        checkNotReleased();
        Objects.requireNonNull(msg, "msg cannot be null");
        long start = System.nanoTime();
        metrics.incrementCounter(MetricNames.EXTRACTOR_PARSE_TOTAL);

        try (JsonParser parser = JSON.createParser(msg)) {
            flattenRoot(parser, prefix, true, start);
        } catch (IOException e) {
            throw malformed(e);
        }
    }

    /**
     * Parses a JSON log line, resetting the backing buffer first.
     *
     * <p>Fields from the previous call become unreadable.
     *
     * @param msg JSON object text
     * @param prefix prepended verbatim to every field name
     * @throws MalformedInputException if msg is not a single JSON value
     * @throws UnexpectedRootTypeException if the value is not an object
     */
    public void parse(String msg, String prefix) {
        parse(msg, prefix, true);
    }

    /**
     * Parses a JSON log line without resetting the backing buffer.
     *
     * <p>The field list is cleared but fields read from earlier calls stay readable until the next
     * resetting parse or release. The buffer grows with every call, so use this only for short
     * bursts of lines that must be read together.
     *
     * @param msg JSON object text
     * @param prefix prepended verbatim to every field name
     * @throws MalformedInputException if msg is not a single JSON value
     * @throws UnexpectedRootTypeException if the value is not an object
     */
    public void parseNoResetBuffer(String msg, String prefix) {
        parse(msg, prefix, false);
    }

    /**
     * Parses a JSON log line into {@link #fields()}.
     *
     * @param msg JSON object text
     * @param prefix prepended verbatim to every field name
     * @param resetBuffer true to clear the backing buffer first, invalidating earlier fields
     * @throws MalformedInputException if msg is not a single JSON value
     * @throws UnexpectedRootTypeException if the value is not an object
     */
    public void parse(String msg, String prefix, boolean resetBuffer) {
        checkNotReleased();
        Objects.requireNonNull(msg, "msg cannot be null");
        long start = System.nanoTime();
        metrics.incrementCounter(MetricNames.EXTRACTOR_PARSE_TOTAL);

        try (JsonParser parser = JSON.createParser(msg)) {
            flattenRoot(parser, prefix, resetBuffer, start);
        } catch (IOException e) {
            throw malformed(e);
        }
    }

    /**
     * Renames the first field named {@code oldName} to {@code newName}.
     *
     * <p>No-op if {@code oldName} is empty or not present. Later fields with the same name keep it.
     */
    public void renameField(String oldName, String newName) {
        checkNotReleased();
        if (oldName == null || oldName.isEmpty()) {
            return;
        }
        for (Field f : fields) {
            if (f.hasName(oldName)) {
                f.rename(Objects.requireNonNull(newName, "newName cannot be null"));
                return;
            }
        }
    }

    /**
     * Fields produced by the last parse, in visiting order.
     *
     * @return unmodifiable live view, valid until the next parse or release
     */
    public List<Field> fields() {
        checkNotReleased();
        return fieldsView;
    }

    /** Length of the prefix scratch buffer; equals the seed prefix length between calls. */
    int prefixLength() {
        return prefix.length();
    }

    /** Current backing buffer capacity in chars (retained across resets). */
    public int bufferCapacity() {
        return arena.capacity();
    }

    /** Returns this extractor to the pool it came from. Idempotent. */
    @Override
    public void close() {
        // The pool ignores the call unless passivate() flips the extractor from leased to released
        owner.release(this);
    }

    public boolean isReleased() {
        return released.get();
    }

    // ========== Internals ==========

    private void flattenRoot(JsonParser parser, String prefix, boolean resetBuffer, long start)
            throws IOException {
        if (resetBuffer) {
            reset();
        } else {
            resetNoBuffer();
        }

        JsonToken first = parser.nextToken();
        if (first == null) {
            throw new JsonParseException(parser, "empty input");
        }
        JsonValueType rootType = JsonValueType.of(first);
        if (rootType != JsonValueType.OBJECT) {
            // A broken document is malformed even when it starts with a non-object value
            parser.skipChildren();
            ensureEndOfInput(parser);
            metrics.incrementCounter(MetricNames.EXTRACTOR_PARSE_UNEXPECTED_ROOT);
            throw new UnexpectedRootTypeException(rootType);
        }

        if (prefix != null) {
            this.prefix.append(prefix);
        }
        appendFields(parser);
        ensureEndOfInput(parser);

        metrics.incrementCounter(MetricNames.EXTRACTOR_FIELDS, fields.size());
        metrics.recordTimer(MetricNames.EXTRACTOR_PARSE_LATENCY, System.nanoTime() - start);
        logger.trace("ingestprep: parsed {} fields, buffer length {}", fields.size(), arena.length());
    }

    /** Flattens the object whose START_OBJECT is the current token, consuming its END_OBJECT. */
    private void appendFields(JsonParser parser) throws IOException {
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            // Repeated keys are visited one by one, so {"a":1,"a":2} gives two fields
            String key = parser.currentName();
            JsonValueType type = JsonValueType.of(parser.nextToken());

            switch (type) {
                case NULL:
                    // Skip nulls
                    break;
                case OBJECT: {
                    // {"foo":{"bar":"baz"}} -> foo.bar=baz
                    int prefixLen = prefix.length();
                    prefix.append(key).append('.');
                    appendFields(parser);
                    prefix.setLength(prefixLen);
                    break;
                }
                case ARRAY: {
                    int valueStart = arena.length();
                    appendJsonText(parser, type);
                    appendField(key, valueStart);
                    break;
                }
                case NUMBER:
                case BOOLEAN:
                case STRING: {
                    // Numbers keep their source text: 1e5 stays 1e5, -0 stays -0
                    int valueStart = arena.length();
                    appendTokenText(parser);
                    appendField(key, valueStart);
                    break;
                }
                default:
                    throw new AssertionError("BUG: unexpected JSON type: " + type);
            }
        }
    }

    /** Writes the current value as compact JSON, keeping number text as it appears in the input. */
    private void appendJsonText(JsonParser parser, JsonValueType type) throws IOException {
        switch (type) {
            case ARRAY: {
                arena.append('[');
                boolean first = true;
                JsonToken t;
                while ((t = parser.nextToken()) != JsonToken.END_ARRAY) {
                    if (!first) {
                        arena.append(',');
                    }
                    first = false;
                    appendJsonText(parser, JsonValueType.of(t));
                }
                arena.append(']');
                break;
            }
            case OBJECT: {
                arena.append('{');
                boolean first = true;
                while (parser.nextToken() == JsonToken.FIELD_NAME) {
                    if (!first) {
                        arena.append(',');
                    }
                    first = false;
                    appendQuoted(parser.currentName());
                    arena.append(':');
                    appendJsonText(parser, JsonValueType.of(parser.nextToken()));
                }
                arena.append('}');
                break;
            }
            case STRING:
                appendQuoted(parser.getText());
                break;
            default:
                // null, true, false and numbers
                appendTokenText(parser);
        }
    }

    private void appendTokenText(JsonParser parser) throws IOException {
        arena.append(parser.getTextCharacters(), parser.getTextOffset(), parser.getTextLength());
    }

    private void appendQuoted(String text) {
        char[] escaped = JsonStringEncoder.getInstance().quoteAsString(text);
        arena.append('"').append(escaped, 0, escaped.length).append('"');
    }

    private static void ensureEndOfInput(JsonParser parser) throws IOException {
        JsonToken trailing = parser.nextToken();
        if (trailing != null) {
            throw new JsonParseException(parser, "unexpected data after the JSON value: " + trailing);
        }
    }

    private void appendField(String key, int valueStart) {
        int valueEnd = arena.length();
        int nameStart = valueEnd;
        arena.append(prefix).append(key);
        fields.add(new Field(arena.sliceFrom(nameStart), arena.slice(valueStart, valueEnd)));
    }

    private MalformedInputException malformed(IOException e) {
        resetNoBuffer();
        metrics.incrementCounter(MetricNames.EXTRACTOR_PARSE_MALFORMED);
        String detail = e instanceof JsonProcessingException
            ? ((JsonProcessingException) e).getOriginalMessage()
            : e.getMessage();
        return new MalformedInputException(detail, e);
    }

    private void reset() {
        resetNoBuffer();
        arena.reset();
    }

    private void resetNoBuffer() {
        fields.clear();
        prefix.setLength(0);
    }

    void activate() {
        released.set(false);
    }

    boolean passivate() {
        if (!released.compareAndSet(false, true)) {
            return false;
        }
        reset();
        return true;
    }

    private void checkNotReleased() {
        if (released.get()) {
            throw new IllegalStateException("ingestprep: FieldExtractor used after release");
        }
    }
}
