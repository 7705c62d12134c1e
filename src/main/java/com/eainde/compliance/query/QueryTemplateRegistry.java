package com.eainde.compliance.query;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name → {@link QueryTemplate} registry, loaded at startup and open to further registration.
 *
 * Iteration order is registration order; the retriever uses it to break ranking ties.
 */
@Slf4j
public class QueryTemplateRegistry {

    private final Map<String, QueryTemplate> templates = new LinkedHashMap<>();

    public QueryTemplateRegistry() {
    }

    public QueryTemplateRegistry(Collection<QueryTemplate> initial) {
        registerAll(initial);
    }

    public synchronized void register(QueryTemplate template) {
        QueryTemplate previous = templates.put(template.getName(), template);
        if (previous != null) {
            log.info("Replaced query template: {}", template.getName());
        } else {
            log.debug("Registered query template: {}", template);
        }
    }

    public void registerAll(Collection<QueryTemplate> toRegister) {
        toRegister.forEach(this::register);
    }

    public synchronized Optional<QueryTemplate> find(String name) {
        return Optional.ofNullable(templates.get(name));
    }

    /**
     * @throws UnknownTemplateException if no template has this name
     */
    public synchronized QueryTemplate get(String name) {
        QueryTemplate template = templates.get(name);
        if (template == null) {
            throw new UnknownTemplateException(name, templates.keySet());
        }
        return template;
    }

    public synchronized List<QueryTemplate> all() {
        return new ArrayList<>(templates.values());
    }

    public synchronized List<String> names() {
        return new ArrayList<>(templates.keySet());
    }

    public synchronized int size() {
        return templates.size();
    }
}
