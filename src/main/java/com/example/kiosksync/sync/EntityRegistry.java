package com.example.kiosksync.sync;

import com.example.kiosksync.error.NotFoundException;

import java.util.*;

/**
 * Looks up the {@link EntityModule} of a type name such as {@code avatar}.
 */
public class EntityRegistry {

    private final Map<String, EntityModule<?>> modules = new LinkedHashMap<>();

    public EntityRegistry(Collection<EntityModule<?>> modules) {
        for (EntityModule<?> module : modules) {
            this.modules.put(module.getKind().getName(), module);
        }
    }

    public EntityModule<?> module(String type) {
        EntityModule<?> module = type == null ? null : modules.get(type.toLowerCase(Locale.ROOT));
        if (module == null) {
            throw new NotFoundException("entity type", String.valueOf(type));
        }
        return module;
    }

    public Collection<EntityModule<?>> all() {
        return Collections.unmodifiableCollection(modules.values());
    }

    public Set<String> types() {
        return Collections.unmodifiableSet(modules.keySet());
    }
}
