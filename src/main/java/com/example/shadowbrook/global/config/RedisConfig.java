package com.example.shadowbrook.global.config;

import com.example.shadowbrook.chat.domain.ChatMessage;
import com.example.shadowbrook.game.domain.Game;
import com.example.shadowbrook.game.domain.GamePlayer;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

@Configuration
@ConditionalOnProperty(name = "mafia.store", havingValue = "redis")
public class RedisConfig {

    @Bean
    public RedisTemplate<String, Game> gameRedisTemplate(RedisConnectionFactory connectionFactory,
            ObjectMapper objectMapper) {
        return typedTemplate(connectionFactory, objectMapper, Game.class);
    }

    @Bean
    public RedisTemplate<String, GamePlayer> playerRedisTemplate(RedisConnectionFactory connectionFactory,
            ObjectMapper objectMapper) {
        return typedTemplate(connectionFactory, objectMapper, GamePlayer.class);
    }

    @Bean
    public RedisTemplate<String, ChatMessage> chatRedisTemplate(RedisConnectionFactory connectionFactory,
            ObjectMapper objectMapper) {
        return typedTemplate(connectionFactory, objectMapper, ChatMessage.class);
    }

    // Instant 등 java.time 직렬화를 위해 Spring 의 ObjectMapper 를 재사용
    private <T> RedisTemplate<String, T> typedTemplate(RedisConnectionFactory connectionFactory,
            ObjectMapper objectMapper, Class<T> type) {
        RedisTemplate<String, T> redisTemplate = new RedisTemplate<>();
        redisTemplate.setConnectionFactory(connectionFactory);
        redisTemplate.setKeySerializer(new StringRedisSerializer());

        Jackson2JsonRedisSerializer<T> jsonSerializer = new Jackson2JsonRedisSerializer<>(objectMapper, type);
        redisTemplate.setValueSerializer(jsonSerializer);
        redisTemplate.setHashKeySerializer(new StringRedisSerializer());
        redisTemplate.setHashValueSerializer(jsonSerializer);
        return redisTemplate;
    }
}
