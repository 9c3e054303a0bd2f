package com.whereq.augur.plugin;

import com.whereq.augur.config.AugurProperties;
import com.whereq.augur.exception.AugurException;
import com.whereq.augur.exception.PluginContractException;
import com.whereq.augur.exception.PluginExecutionException;
import com.whereq.augur.exception.PluginTimeoutException;
import com.whereq.augur.model.DataPoint;
import com.whereq.augur.model.Forecast;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs plugins on a dedicated bounded executor with a time bound and checks the returned forecast.
 * A plugin that ignores interruption keeps its thread after a timeout. Once every thread is held
 * that way, later invocations wait in a short queue and time out instead of growing the pool.
 */
@Slf4j
@Component
public class PluginInvoker {

    private final ThreadPoolExecutor executor;

    @Autowired
    public PluginInvoker(AugurProperties properties) {
        this(properties.getWorker().getCount() * properties.getWorker().getPluginThreadsPerWorker());
    }

    public PluginInvoker(int maxThreads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "augur-plugin-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        this.executor = new ThreadPoolExecutor(maxThreads, maxThreads, 60L, TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(maxThreads), threadFactory, new ThreadPoolExecutor.AbortPolicy());
        this.executor.allowCoreThreadTimeOut(true);
        log.info("Plugin executor bounded to {} thread(s)", maxThreads);
    }

    /**
     * Execute a plugin
     *
     * @param plugin the plugin
     * @param samples historical samples
     * @param horizon requested number of points
     * @param timeout execution bound; the plugin thread is interrupted when it passes
     * @return a forecast of exactly {@code horizon} points
     * @throws PluginTimeoutException if the bound passes
     * @throws PluginContractException if the forecast has the wrong shape
     * @throws PluginExecutionException if the plugin throws
     */
    public Forecast invoke(ForecastPlugin plugin, List<DataPoint> samples, int horizon, Duration timeout) {
        List<DataPoint> input = List.copyOf(samples);
        Future<Forecast> future;
        try {
            future = executor.submit(() -> plugin.execute(input, horizon));
        } catch (RejectedExecutionException e) {
            log.warn("Plugin executor saturated, rejecting {}", plugin.name());
            throw new PluginExecutionException("No plugin thread available for " + plugin.name(), e);
        }

        Forecast forecast;
        try {
            forecast = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            executor.purge();
            throw new PluginTimeoutException(plugin.name(), timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new PluginExecutionException("Interrupted while waiting for plugin " + plugin.name(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AugurException augurException) {
                throw augurException;
            }
            throw new PluginExecutionException("Plugin " + plugin.name() + " failed: " + cause.getMessage(), cause);
        }

        validate(plugin, forecast, horizon);
        return forecast;
    }

    private void validate(ForecastPlugin plugin, Forecast forecast, int horizon) {
        if (forecast == null || forecast.getPoints() == null) {
            throw new PluginContractException("Plugin " + plugin.name() + " returned no forecast");
        }
        int size = forecast.getPoints().size();
        if (size != horizon) {
            throw new PluginContractException("Plugin " + plugin.name() + " returned " + size
                + " points for horizon " + horizon);
        }
        for (DataPoint point : forecast.getPoints()) {
            if (point == null || point.getTimestamp() == null || !Double.isFinite(point.getValue())) {
                throw new PluginContractException("Plugin " + plugin.name()
                    + " returned a point without timestamp or with a non-finite value");
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
