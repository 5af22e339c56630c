package com.libragraph.vcl.formats.registry;

import com.libragraph.vcl.formats.api.CompressionCodec;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Optional;
import java.util.stream.StreamSupport;

/**
 * Resolves {@link CompressionCodec} beans by their persisted name.
 * All codecs are discovered via CDI.
 */
@ApplicationScoped
public class CodecRegistry {

    @Inject
    Instance<CompressionCodec> codecs;

    public Optional<CompressionCodec> find(String name) {
        return StreamSupport.stream(codecs.spliterator(), false)
                .filter(c -> c.name().equals(name))
                .findFirst();
    }

    /**
     * @throws IllegalArgumentException if no codec is registered under {@code name}
     */
    public CompressionCodec require(String name) {
        return find(name).orElseThrow(() ->
                new IllegalArgumentException("Unknown codec: " + name + " (known: " + names() + ")"));
    }

    public List<String> names() {
        return StreamSupport.stream(codecs.spliterator(), false)
                .map(CompressionCodec::name)
                .sorted()
                .toList();
    }
}
