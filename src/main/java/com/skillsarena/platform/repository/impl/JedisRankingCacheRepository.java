package com.skillsarena.platform.repository.impl;

import com.skillsarena.platform.repository.RankingCacheRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Repository
public class JedisRankingCacheRepository implements RankingCacheRepository {

    private static final Logger logger = LoggerFactory.getLogger(JedisRankingCacheRepository.class);

    private static final String RANKING_KEY_PREFIX = "ranking:";
    private static final int ZADD_CHUNK_SIZE = 1000;

    private JedisPool jedisPool;
    private volatile boolean available = false;

    @Value("${redis.host:localhost}")
    private String redisHost;

    @Value("${redis.port:6379}")
    private int redisPort;

    @Value("${redis.password:}")
    private String redisPassword;

    @Value("${redis.ssl:false}")
    private boolean redisSsl;

    @Value("${redis.timeout:2000}")
    private int timeout;

    @Value("${redis.enabled:true}")
    private boolean enabled;

    @PostConstruct
    public void init() {
        if (!enabled) {
            logger.info("Redis ranking cache disabled; feeds are served from the database");
            return;
        }
        try {
            JedisPoolConfig poolConfig = new JedisPoolConfig();
            poolConfig.setMaxTotal(64);
            poolConfig.setMaxIdle(16);
            poolConfig.setMinIdle(4);
            poolConfig.setTestOnBorrow(true);

            DefaultJedisClientConfig.Builder clientConfigBuilder = DefaultJedisClientConfig.builder()
                .connectionTimeoutMillis(timeout)
                .socketTimeoutMillis(timeout);
            if (redisSsl) {
                clientConfigBuilder.ssl(true);
            }
            if (redisPassword != null && !redisPassword.isEmpty()) {
                clientConfigBuilder.password(redisPassword);
            }

            jedisPool = new JedisPool(poolConfig, new HostAndPort(redisHost, redisPort), clientConfigBuilder.build());

            try (Jedis jedis = jedisPool.getResource()) {
                jedis.ping();
                available = true;
                logger.info("Connected to Redis at {}:{}{}", redisHost, redisPort, redisSsl ? " (SSL enabled)" : "");
            }
        } catch (Exception e) {
            logger.warn("Redis unavailable at {}:{}, rankings will be read from the database: {}",
                redisHost, redisPort, e.getMessage());
            available = false;
        }
    }

    @PreDestroy
    public void destroy() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
        }
    }

    @Override
    public boolean isAvailable() {
        if (!available || jedisPool == null) {
            return false;
        }

        try (Jedis jedis = jedisPool.getResource()) {
            jedis.ping();
            return true;
        } catch (Exception e) {
            logger.warn("Redis ping failed, marking ranking cache unavailable: {}", e.getMessage());
            available = false;
            return false;
        }
    }

    @Override
    public void replaceRanking(String rankingId, Map<String, Double> scores) {
        if (rankingId == null || rankingId.trim().isEmpty()) {
            throw new IllegalArgumentException("RankingId cannot be null or empty");
        }
        if (!isAvailable()) {
            throw new IllegalStateException("Redis is not available");
        }

        String key = RANKING_KEY_PREFIX + rankingId;
        String stagingKey = key + ":staging";
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.del(stagingKey);
            if (scores.isEmpty()) {
                jedis.del(key);
                return;
            }

            Map<String, Double> chunk = new HashMap<>();
            for (Map.Entry<String, Double> entry : scores.entrySet()) {
                chunk.put(entry.getKey(), entry.getValue());
                if (chunk.size() == ZADD_CHUNK_SIZE) {
                    jedis.zadd(stagingKey, chunk);
                    chunk.clear();
                }
            }
            if (!chunk.isEmpty()) {
                jedis.zadd(stagingKey, chunk);
            }
            // RENAME swaps the finished set in so readers never see a partial ranking
            jedis.rename(stagingKey, key);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to replace ranking " + rankingId + " in Redis", e);
        }
    }

    @Override
    public List<String> getRange(String rankingId, int offset, int limit) {
        if (rankingId == null || rankingId.trim().isEmpty() || limit <= 0 || offset < 0) {
            return new ArrayList<>();
        }
        if (!isAvailable()) {
            return new ArrayList<>();
        }

        String key = RANKING_KEY_PREFIX + rankingId;
        try (Jedis jedis = jedisPool.getResource()) {
            return new ArrayList<>(jedis.zrevrange(key, offset, (long) offset + limit - 1));
        } catch (Exception e) {
            logger.warn("Failed to read ranking {} from Redis: {}", rankingId, e.getMessage());
            return new ArrayList<>();
        }
    }

    @Override
    public Long getTotal(String rankingId) {
        if (rankingId == null || rankingId.trim().isEmpty()) {
            return null;
        }
        if (!isAvailable()) {
            return null;
        }

        String key = RANKING_KEY_PREFIX + rankingId;
        try (Jedis jedis = jedisPool.getResource()) {
            if (!jedis.exists(key)) {
                return null;
            }
            return jedis.zcard(key);
        } catch (Exception e) {
            logger.warn("Failed to read ranking size {} from Redis: {}", rankingId, e.getMessage());
            return null;
        }
    }
}
