package io.lighting.renamer.context;

import java.util.Objects;
import java.util.function.Supplier;

final class Memoized<T> implements Supplier<T> {
    private final Supplier<T> loader;
    private volatile T value;

    Memoized(Supplier<T> loader) {
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    @Override
    public T get() {
        T result = value;
        if (result == null) {
            synchronized (this) {
                result = value;
                if (result == null) {
                    result = Objects.requireNonNull(loader.get(), "loaded value");
                    value = result;
                }
            }
        }
        return result;
    }

    boolean isLoaded() {
        return value != null;
    }
}
