package org.smileyface.campuscrawler.persist;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.campuscrawler.crawler.CrawlerProperties;
import org.smileyface.campuscrawler.model.FrontierState;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.io.IOException;
import java.util.Objects;

/**
 * Redis-backed checkpoint store. The JSON document lives under a single key ("{ns}:checkpoint") and is
 * replaced with one SET, which Redis applies atomically.
 */
public class RedisStatePersister implements StatePersister {

    private static final Logger log = LoggerFactory.getLogger(RedisStatePersister.class);

    private final StringRedisTemplate redis;
    private final ObjectMapper mapper;
    private final String checkpointKey;

    public RedisStatePersister(StringRedisTemplate redisTemplate, ObjectMapper mapper, String namespace) {
        this.redis = Objects.requireNonNull(redisTemplate, "redisTemplate");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        String ns = namespace == null || namespace.isBlank() ? CrawlerProperties.DEFAULT_CHECKPOINT_NAMESPACE : namespace.trim();
        this.checkpointKey = ns + ":checkpoint";
    }

    public String getCheckpointKey() {
        return checkpointKey;
    }

    @Override
    public void save(FrontierState state) throws IOException {
        FrontierState toWrite = state == null ? FrontierState.empty() : state;
        String json = mapper.writeValueAsString(toWrite);
        try {
            redis.opsForValue().set(checkpointKey, json);
        } catch (DataAccessException e) {
            throw new IOException("Failed to write checkpoint " + checkpointKey + " to Redis", e);
        }
    }

    @Override
    public FrontierState load() {
        String json;
        try {
            json = redis.opsForValue().get(checkpointKey);
        } catch (DataAccessException e) {
            log.warn("Checkpoint {} could not be read from Redis, starting fresh: {}", checkpointKey, e.getMessage());
            return FrontierState.empty();
        }
        if (json == null || json.isBlank()) {
            log.info("No checkpoint under {}, starting fresh", checkpointKey);
            return FrontierState.empty();
        }
        try {
            FrontierState state = mapper.readValue(json, FrontierState.class);
            return state == null ? FrontierState.empty() : state;
        } catch (JsonProcessingException e) {
            log.warn("Checkpoint {} could not be parsed, starting fresh: {}", checkpointKey, e.getMessage());
            return FrontierState.empty();
        }
    }
}
