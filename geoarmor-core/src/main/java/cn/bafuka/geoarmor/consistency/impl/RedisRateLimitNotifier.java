package cn.bafuka.geoarmor.consistency.impl;

import cn.bafuka.geoarmor.consistency.RateLimitMessage;
import cn.bafuka.geoarmor.consistency.RateLimitNotifier;
import cn.bafuka.geoarmor.dataplane.RateLimiter;
import com.alibaba.fastjson.JSON;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

/**
 * 限流通知器实现
 * 基于 Redis Pub/Sub，一个节点遇到限流后其他节点同步暂停派发
 */
@Slf4j
public class RedisRateLimitNotifier implements RateLimitNotifier {

    /**
     * Redis 模板
     */
    private final StringRedisTemplate redisTemplate;

    /**
     * Redis 消息监听容器
     */
    private final RedisMessageListenerContainer listenerContainer;

    /**
     * 广播频道
     */
    private final String channel;

    /**
     * 本节点标识
     */
    private final String nodeId = UUID.randomUUID().toString();

    /**
     * 内部消息监听器
     */
    private InternalMessageListener internalListener;

    public RedisRateLimitNotifier(StringRedisTemplate redisTemplate,
                                  RedisMessageListenerContainer listenerContainer,
                                  String channel) {
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
        this.channel = channel;
    }

    @Override
    public void publish(Instant resumeAt) {
        try {
            long millis = resumeAt != null ? resumeAt.toEpochMilli() : 0;
            redisTemplate.convertAndSend(channel, JSON.toJSONString(new RateLimitMessage(millis, nodeId)));
            log.info("已发送限流广播: resumeAt={}, channel={}", resumeAt, channel);
        } catch (Exception e) {
            log.error("发送限流广播失败: resumeAt={}", resumeAt, e);
        }
    }

    @Override
    public synchronized void subscribe(RateLimiter limiter) {
        if (limiter == null) {
            log.warn("RateLimiter 为空，跳过订阅");
            return;
        }

        if (internalListener != null) {
            listenerContainer.removeMessageListener(internalListener);
        }
        internalListener = new InternalMessageListener(limiter, nodeId);
        listenerContainer.addMessageListener(internalListener, new ChannelTopic(channel));

        log.info("已订阅限流广播频道: {}", channel);
    }

    @Override
    public synchronized void unsubscribe() {
        if (internalListener != null) {
            listenerContainer.removeMessageListener(internalListener);
            internalListener = null;
            log.info("已取消订阅限流广播频道: {}", channel);
        }
    }

    /**
     * 内部消息监听器
     */
    static class InternalMessageListener implements MessageListener {

        private final RateLimiter limiter;
        private final String nodeId;

        InternalMessageListener(RateLimiter limiter, String nodeId) {
            this.limiter = limiter;
            this.nodeId = nodeId;
        }

        @Override
        public void onMessage(Message message, byte[] pattern) {
            try {
                String body = new String(message.getBody(), StandardCharsets.UTF_8);
                RateLimitMessage msg = JSON.parseObject(body, RateLimitMessage.class);
                if (msg == null) {
                    log.warn("接收到非法的限流广播: {}", body);
                    return;
                }
                // 自己发出的广播本地已经生效
                if (nodeId.equals(msg.getSource())) {
                    return;
                }

                Instant resumeAt = msg.getResumeAt() > 0 ? Instant.ofEpochMilli(msg.getResumeAt()) : null;
                log.debug("接收到限流广播: resumeAt={}, source={}", resumeAt, msg.getSource());
                limiter.setResumeAt(resumeAt);

            } catch (Exception e) {
                log.error("处理限流广播失败", e);
            }
        }
    }
}
