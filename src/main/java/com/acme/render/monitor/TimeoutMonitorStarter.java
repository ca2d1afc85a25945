package com.acme.render.monitor;

import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;

@Singleton
@Requires(property = "timeout.monitor-enabled", value = "true", defaultValue = "true")
public class TimeoutMonitorStarter implements ApplicationEventListener<StartupEvent> {

    private final TimeoutMonitor monitor;

    public TimeoutMonitorStarter(TimeoutMonitor monitor) {
        this.monitor = monitor;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        monitor.startMonitoring();
    }
}
