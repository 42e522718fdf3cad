package com.seqflow.core.target;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps remote URI schemes ({@code s3}, {@code gs}, ...) to the store serving them.
 */
public class ObjectStoreRegistry {

    private final Map<String, ObjectStore> stores = new ConcurrentHashMap<>();

    public ObjectStoreRegistry register(String scheme, ObjectStore store) {
        stores.put(scheme.toLowerCase(Locale.ROOT), store);
        return this;
    }

    public Optional<ObjectStore> lookup(String scheme) {
        return Optional.ofNullable(stores.get(scheme.toLowerCase(Locale.ROOT)));
    }

    public Set<String> schemes() {
        return new TreeSet<>(stores.keySet());
    }
}
