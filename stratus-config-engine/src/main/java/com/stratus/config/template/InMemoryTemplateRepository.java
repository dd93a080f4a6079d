package com.stratus.config.template;

import com.stratus.config.error.ConflictException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Basic in-memory repository used until a durable store is wired up.
 */
public class InMemoryTemplateRepository implements TemplateRepository {

    private final Map<String, ConfigurationTemplate> store = new ConcurrentHashMap<>();
    private final Map<String, String> nameIndex = new ConcurrentHashMap<>();

    @Override
    public synchronized ConfigurationTemplate save(ConfigurationTemplate template) {
        String owner = nameIndex.get(template.getName());
        if (owner != null && !owner.equals(template.getId())) {
            throw new ConflictException("Template with name " + template.getName() + " already exists");
        }
        ConfigurationTemplate previous = store.put(template.getId(), template.toBuilder().build());
        if (previous != null && !previous.getName().equals(template.getName())) {
            nameIndex.remove(previous.getName());
        }
        nameIndex.put(template.getName(), template.getId());
        return template;
    }

    @Override
    public Optional<ConfigurationTemplate> findById(String id) {
        return Optional.ofNullable(store.get(id)).map(template -> template.toBuilder().build());
    }

    @Override
    public Optional<ConfigurationTemplate> findByName(String name) {
        String id = nameIndex.get(name);
        return id != null ? findById(id) : Optional.empty();
    }

    @Override
    public List<ConfigurationTemplate> findAll() {
        List<ConfigurationTemplate> templates = new ArrayList<>(store.values());
        templates.sort(Comparator.comparing(ConfigurationTemplate::getName));
        return templates;
    }

    @Override
    public synchronized void delete(String id) {
        ConfigurationTemplate removed = store.remove(id);
        if (removed != null) {
            nameIndex.remove(removed.getName());
        }
    }
}
