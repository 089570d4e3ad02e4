package com.whereq.easel.topic;

import java.util.Collection;
import java.util.Optional;

/**
 * Lookup of loaded topics by alias
 */
public interface TopicRegistry {

    Optional<TopicConfig> find(String alias);

    Collection<TopicConfig> all();

    /**
     * Rescan the topic source
     *
     * @return number of topics loaded
     */
    int reload();
}
