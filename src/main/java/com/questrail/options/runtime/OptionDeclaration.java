package com.questrail.options.runtime;

import com.questrail.options.api.OptionCodec;
import com.questrail.options.observability.OptionObservabilitySink;
import com.questrail.options.observability.Slf4jOptionObservabilitySink;

import java.util.Objects;

/**
 * Static description of one option: its name, documentation, codec and
 * default value, plus the sink that observes changes to it.
 */
public record OptionDeclaration<T>(
    String name,
    String docstring,
    OptionCodec<T> codec,
    T defaultValue,
    OptionObservabilitySink sink
) {
    public OptionDeclaration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(docstring, "docstring");
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(defaultValue, "defaultValue");
        Objects.requireNonNull(sink, "sink");

        if (name.isBlank()) {
            throw new IllegalArgumentException("option name must not be blank");
        }
    }

    public static <T> Builder<T> builder(String name, OptionCodec<T> codec) {
        return new Builder<>(name, codec);
    }

    /**
     * Returns the type name of the option, as reported by its codec.
     */
    public String typeName() {
        return codec.typeName();
    }

    public static final class Builder<T> {
        private final String name;
        private final OptionCodec<T> codec;
        private String docstring = "";
        private T defaultValue;
        private OptionObservabilitySink sink = new Slf4jOptionObservabilitySink();

        private Builder(String name, OptionCodec<T> codec) {
            this.name = name;
            this.codec = codec;
        }

        public Builder<T> withDocstring(String docstring) {
            this.docstring = docstring;
            return this;
        }

        public Builder<T> withDefaultValue(T defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        /**
         * Sets the default value from its canonical text form.
         *
         * @throws com.questrail.options.api.InvalidOptionFormatException if the text is malformed
         */
        public Builder<T> withDefaultText(String text) {
            Objects.requireNonNull(codec, "codec");
            this.defaultValue = codec.fromText(text);
            return this;
        }

        public Builder<T> withSink(OptionObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        public OptionDeclaration<T> build() {
            if (defaultValue == null) {
                throw new IllegalStateException("option " + name + " needs a default value");
            }
            return new OptionDeclaration<>(name, docstring, codec, defaultValue, sink);
        }
    }
}
