package com.whereq.augur.store;

import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.scripting.support.ResourceScriptSource;

/**
 * Lua scripts backing the atomic store and queue operations
 */
public final class RedisScripts {

    public static final RedisScript<Long> JOB_CREATE = load("job-create");
    public static final RedisScript<Long> JOB_TRANSITION = load("job-transition");
    public static final RedisScript<Long> JOB_CANCEL = load("job-cancel");
    public static final RedisScript<Long> QUEUE_ACK = load("queue-ack");
    public static final RedisScript<Long> QUEUE_REQUEUE_EXPIRED = load("queue-requeue-expired");

    private RedisScripts() {
    }

    private static RedisScript<Long> load(String name) {
        DefaultRedisScript<Long> script = new DefaultRedisScript<>();
        script.setScriptSource(new ResourceScriptSource(new ClassPathResource("scripts/" + name + ".lua")));
        script.setResultType(Long.class);
        return script;
    }
}
