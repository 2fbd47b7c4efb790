package com.intteq.fluent.broker.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Collects the publications a transport configurator declares inside one
 * {@code usePublications(...)} call.
 *
 * @param <P> the transport's publication type
 * @param <B> the transport's publication builder type
 */
public final class PublicationCollector<P extends Publication, B extends Publication.Builder<P, B>> {

    private final Supplier<B> builders;
    private final List<P> publications = new ArrayList<>();

    public PublicationCollector(Supplier<B> builders) {
        this.builders = Objects.requireNonNull(builders, "builders must not be null");
    }

    public PublicationCollector<P, B> addPublication(P publication) {
        publications.add(Objects.requireNonNull(publication, "publication must not be null"));
        return this;
    }

    public PublicationCollector<P, B> addPublication(Consumer<B> configure) {
        B builder = builders.get();
        configure.accept(builder);
        return addPublication(builder.build());
    }

    public PublicationCollector<P, B> addPublication(Class<?> dataType, Consumer<B> configure) {
        return addPublication(builder -> {
            configure.accept(builder);
            builder.setDataType(dataType);
        });
    }

    public List<P> getPublications() {
        return Collections.unmodifiableList(publications);
    }
}
