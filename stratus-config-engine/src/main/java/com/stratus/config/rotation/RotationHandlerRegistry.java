package com.stratus.config.rotation;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Maps rotation type keys to handlers. Keys are validated when a handler registers, so an
 * unknown type at rotation time always means nothing was registered for it.
 */
@Slf4j
public class RotationHandlerRegistry {

    private static final Pattern TYPE_PATTERN = Pattern.compile("^[a-z][a-z0-9_]*$");

    private final Map<String, RotationHandler> handlers = new ConcurrentHashMap<>();

    public RotationHandlerRegistry() {
    }

    public RotationHandlerRegistry(List<RotationHandler> initial) {
        initial.forEach(this::register);
    }

    /**
     * @throws IllegalArgumentException if the type key is blank or malformed
     * @throws IllegalStateException    if a handler is already registered for the type
     */
    public void register(RotationHandler handler) {
        String type = handler.getType();
        if (type == null || !TYPE_PATTERN.matcher(type).matches()) {
            throw new IllegalArgumentException("Invalid rotation type key: " + type);
        }
        RotationHandler existing = handlers.putIfAbsent(type, handler);
        if (existing != null) {
            throw new IllegalStateException("Rotation handler already registered for type " + type);
        }
        log.debug("Registered rotation handler {} for type {}", handler.getClass().getSimpleName(), type);
    }

    public boolean unregister(String type) {
        return handlers.remove(type) != null;
    }

    public Optional<RotationHandler> find(String type) {
        return type == null ? Optional.empty() : Optional.ofNullable(handlers.get(type));
    }

    public List<String> getTypes() {
        return List.copyOf(new TreeSet<>(handlers.keySet()));
    }
}
