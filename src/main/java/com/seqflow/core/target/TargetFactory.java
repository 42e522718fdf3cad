package com.seqflow.core.target;

import java.nio.file.Path;

/**
 * Creates targets from location strings. Remote schemes must have a store
 * registered; otherwise the location is rejected as a configuration error.
 */
public class TargetFactory {

    private final ObjectStoreRegistry registry;

    public TargetFactory(ObjectStoreRegistry registry) {
        this.registry = registry;
    }

    public Target of(String location) {
        return of(TargetUri.parse(location));
    }

    public Target of(TargetUri uri) {
        if (uri.isLocal()) {
            return new LocalTarget(uri.localPath());
        }
        ObjectStore store = registry.lookup(uri.scheme())
                .orElseThrow(() -> new InvalidTargetException("No object store registered for scheme '"
                        + uri.scheme() + "' (registered: " + registry.schemes() + "): " + uri));
        return new RemoteTarget(uri, store);
    }

    public Target local(Path path) {
        return new LocalTarget(path);
    }
}
