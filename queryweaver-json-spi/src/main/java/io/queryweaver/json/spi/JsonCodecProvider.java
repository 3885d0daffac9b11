package io.queryweaver.json.spi;

/**
 * {@link java.util.ServiceLoader} entry point for JSON codec implementations.
 */
public interface JsonCodecProvider {

    JsonCodec codec();
}
