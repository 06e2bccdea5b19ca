package io.surfworks.flowforge.sdfg;

import io.surfworks.flowforge.emit.JsonEmitter;

/**
 * A block of code with its language tag.
 */
public record Code(String data, CodeLanguage language) {

    public static final Code EMPTY = new Code("", CodeLanguage.Python);

    public static Code python(String data) {
        return new Code(data, CodeLanguage.Python);
    }

    public void emit(JsonEmitter jemit, String key) {
        jemit.startNamedObject(key);
        jemit.printKVPair("string_data", data);
        jemit.printKVPair("language", language.name());
        jemit.endObject();
    }
}
