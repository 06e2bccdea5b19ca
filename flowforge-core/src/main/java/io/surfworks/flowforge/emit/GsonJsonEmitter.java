package io.surfworks.flowforge.emit;

import com.google.gson.stream.JsonWriter;

import java.io.Flushable;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;

/**
 * {@link JsonEmitter} backed by Gson's streaming {@link JsonWriter}.
 */
public final class GsonJsonEmitter implements JsonEmitter, Flushable {

    private enum Frame { OBJECT, LIST }

    private final JsonWriter writer;
    private final Deque<Frame> frames = new ArrayDeque<>();

    public GsonJsonEmitter(Writer out) {
        this(out, "");
    }

    /**
     * @param indent indentation per level; empty for compact output
     */
    public GsonJsonEmitter(Writer out, String indent) {
        this.writer = new JsonWriter(out);
        this.writer.setIndent(indent);
        this.writer.setSerializeNulls(true);
        this.writer.setHtmlSafe(false);
    }

    /**
     * Runs {@code body} against a fresh emitter and returns the JSON text.
     */
    public static String render(String indent, Consumer<JsonEmitter> body) {
        StringWriter out = new StringWriter();
        GsonJsonEmitter emitter = new GsonJsonEmitter(out, indent);
        body.accept(emitter);
        emitter.flush();
        return out.toString();
    }

    @Override
    public void startObject() {
        io(writer::beginObject);
        frames.push(Frame.OBJECT);
    }

    @Override
    public void startNamedObject(String name) {
        io(() -> writer.name(name).beginObject());
        frames.push(Frame.OBJECT);
    }

    @Override
    public void endObject() {
        pop(Frame.OBJECT);
        io(writer::endObject);
    }

    @Override
    public void startNamedList(String name) {
        io(() -> writer.name(name).beginArray());
        frames.push(Frame.LIST);
    }

    @Override
    public void endList() {
        pop(Frame.LIST);
        io(writer::endArray);
    }

    @Override
    public void startEntry() {
        // JsonWriter places separators itself
    }

    @Override
    public void printString(String value) {
        io(() -> writer.value(value));
    }

    @Override
    public void printKVPair(String key, String value, boolean stringify) {
        if (value == null) {
            io(() -> writer.name(key).nullValue());
        } else if (stringify) {
            io(() -> writer.name(key).value(value));
        } else {
            io(() -> writer.name(key).jsonValue(value));
        }
    }

    @Override
    public void printKVPair(String key, long value, boolean stringify) {
        if (stringify) {
            io(() -> writer.name(key).value(Long.toString(value)));
        } else {
            io(() -> writer.name(key).value(value));
        }
    }

    @Override
    public void flush() {
        if (!frames.isEmpty()) {
            throw new IllegalStateException("Unbalanced emitter calls: " + frames.size() + " open frame(s)");
        }
        io(writer::flush);
    }

    private void pop(Frame expected) {
        Frame actual = frames.poll();
        if (actual != expected) {
            throw new IllegalStateException("Expected to close " + expected + " but found " + actual);
        }
    }

    @FunctionalInterface
    private interface IoAction {
        void run() throws IOException;
    }

    private static void io(IoAction action) {
        try {
            action.run();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
