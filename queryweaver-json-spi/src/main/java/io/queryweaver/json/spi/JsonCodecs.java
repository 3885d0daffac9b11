package io.queryweaver.json.spi;

import java.util.ServiceLoader;

/**
 * Locates a {@link JsonCodec} through {@link ServiceLoader}.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    /**
     * @return the codec of the first provider on the classpath
     * @throws IllegalStateException if no provider is registered
     */
    public static JsonCodec load() {
        return load(JsonCodecs.class.getClassLoader());
    }

    public static JsonCodec load(ClassLoader classLoader) {
        for (JsonCodecProvider provider : ServiceLoader.load(JsonCodecProvider.class, classLoader)) {
            return provider.codec();
        }
        throw new IllegalStateException(
                "No " + JsonCodecProvider.class.getName() + " registered; add queryweaver-json-jackson to the classpath");
    }
}
