package com.mysteryhub.gameservice.games.mystery.infrastructure.story;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mysteryhub.gameservice.games.mystery.domain.constants.GameMessages;
import com.mysteryhub.gameservice.games.mystery.domain.exception.GameError;
import com.mysteryhub.gameservice.games.mystery.domain.exception.GameException;
import com.mysteryhub.gameservice.games.mystery.domain.repository.StoryRepository;
import com.mysteryhub.gameservice.games.mystery.domain.story.Story;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 基于类路径 JSON 文件的剧本目录
 * ----------------------------------------
 * 启动时加载 stories/*.json（位置可配置），之后只读。
 * 单个文件解析失败只记日志并跳过，不影响其他剧本。
 */
@Slf4j
@Component
public class ClasspathStoryRepository implements StoryRepository {

    private final ObjectMapper objectMapper;
    private final String location;
    private final PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();

    /** storyId -> Story；reload 时整体替换 */
    private volatile Map<String, Story> stories = Collections.emptyMap();

    public ClasspathStoryRepository(ObjectMapper objectMapper,
                                    @Value("${mysteryhub.stories.location:classpath*:stories/*.json}") String location) {
        this.objectMapper = objectMapper;
        this.location = location;
    }

    @PostConstruct
    public void init() {
        reload();
    }

    @Override
    public synchronized int reload() {
        Resource[] resources;
        try {
            resources = resolver.getResources(location);
        } catch (IOException e) {
            throw new IllegalStateException("无法扫描剧本目录: " + location, e);
        }
        Map<String, Story> loaded = new TreeMap<>();
        for (Resource resource : resources) {
            Story story = parse(resource);
            if (story == null) {
                continue;
            }
            if (loaded.putIfAbsent(story.getId(), story) != null) {
                log.warn("剧本ID重复，忽略后加载的文件: id={}, file={}", story.getId(), resource.getDescription());
            }
        }
        this.stories = Collections.unmodifiableMap(loaded);
        log.info("剧本加载完成: location={}, count={}, ids={}", location, loaded.size(), loaded.keySet());
        return loaded.size();
    }

    private Story parse(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            Story story = objectMapper.readValue(in, Story.class);
            if (StringUtils.isBlank(story.getId())) {
                log.warn("剧本缺少 id，已跳过: file={}", resource.getDescription());
                return null;
            }
            return story;
        } catch (IOException e) {
            log.error("剧本解析失败，已跳过: file={}", resource.getDescription(), e);
            return null;
        }
    }

    @Override
    public Optional<Story> findById(String storyId) {
        return storyId == null ? Optional.empty() : Optional.ofNullable(stories.get(storyId));
    }

    @Override
    public Story require(String storyId) {
        return findById(storyId).orElseThrow(() -> GameException.of(GameError.STORY_NOT_FOUND,
                GameMessages.format(GameMessages.STORY_NOT_FOUND, storyId)));
    }

    @Override
    public List<Story> findAll() {
        return new ArrayList<>(stories.values());
    }
}
