package com.habitrack.backend.modules.permission.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class PermissionRefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(PermissionRefreshScheduler.class);

    private final PermissionCache permissionCache;

    public PermissionRefreshScheduler(PermissionCache permissionCache) {
        this.permissionCache = permissionCache;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        refreshQuietly();
    }

    @Scheduled(fixedDelayString = "${habitrack.permissions.refresh-interval:PT5M}",
            initialDelayString = "${habitrack.permissions.refresh-interval:PT5M}")
    public void refreshPeriodically() {
        refreshQuietly();
    }

    private void refreshQuietly() {
        try {
            permissionCache.refresh();
        } catch (DataAccessException ex) {
            log.warn("Permission refresh failed; keeping previous rules", ex);
        }
    }
}
