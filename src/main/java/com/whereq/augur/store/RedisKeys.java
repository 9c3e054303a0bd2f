package com.whereq.augur.store;

import com.whereq.augur.config.AugurProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Key layout of job records and queue structures in Redis
 */
@Component
public class RedisKeys {

    private final String prefix;

    @Autowired
    public RedisKeys(AugurProperties properties) {
        this(properties.getQueue().getKeyPrefix());
    }

    public RedisKeys(String prefix) {
        this.prefix = prefix;
    }

    public String job(String jobId) {
        return prefix + ":job:" + jobId;
    }

    public String pending() {
        return prefix + ":jobs:pending";
    }

    public String pending(String tenantId) {
        return prefix + ":jobs:pending:" + tenantId;
    }

    public String queue() {
        return prefix + ":queue";
    }

    public String processing() {
        return prefix + ":queue:processing";
    }

    public String inFlight() {
        return prefix + ":queue:inflight";
    }
}
