package com.whereq.easel.topic;

import com.whereq.easel.config.EaselProperties;
import com.whereq.easel.exception.TopicConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Topics loaded from the sub-directories of {@code easel.topics.dir}.
 *
 * A topic that fails to load is logged and left out; the others still load.
 */
@Slf4j
@Service
public class DirectoryTopicRegistry implements TopicRegistry {

    private final Path topicsDir;
    private final TopicConfigLoader loader;

    private volatile Map<String, TopicConfig> topics = Map.of();

    public DirectoryTopicRegistry(EaselProperties properties, TopicConfigLoader loader) {
        this.topicsDir = Paths.get(properties.getTopics().getDir());
        this.loader = loader;
    }

    @PostConstruct
    public void initialize() {
        int loaded = reload();
        log.info("Topic registry initialized: dir={}, topics={}", topicsDir.toAbsolutePath(), loaded);
    }

    @Override
    public Optional<TopicConfig> find(String alias) {
        if (alias == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(topics.get(alias));
    }

    @Override
    public Collection<TopicConfig> all() {
        return topics.values();
    }

    @Override
    public synchronized int reload() {
        if (!Files.isDirectory(topicsDir)) {
            log.warn("Topics directory {} does not exist, no topics loaded", topicsDir.toAbsolutePath());
            topics = Map.of();
            return 0;
        }

        Map<String, TopicConfig> loaded = new LinkedHashMap<>();
        for (Path dir : listTopicDirs()) {
            try {
                TopicConfig topic = loader.load(dir);
                loaded.put(topic.getAlias(), topic);
                log.info("Loaded topic {} ({}): rules={}", topic.getAlias(), topic.getTitle(), topic.getRules().size());
            } catch (TopicConfigurationException e) {
                log.error("Skipping topic {}: {}", dir.getFileName(), e.getMessage());
            }
        }
        topics = Collections.unmodifiableMap(loaded);
        return loaded.size();
    }

    private List<Path> listTopicDirs() {
        try (Stream<Path> entries = Files.list(topicsDir)) {
            return entries
                .filter(Files::isDirectory)
                .filter(dir -> !dir.getFileName().toString().startsWith("."))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list topics directory " + topicsDir, e);
        }
    }
}
