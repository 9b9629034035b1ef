package com.habitrack.backend.modules.permission.application;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

@ExtendWith(MockitoExtension.class)
class PermissionRefreshSchedulerTest {

    @Mock
    private PermissionCache permissionCache;

    @InjectMocks
    private PermissionRefreshScheduler scheduler;

    @Test
    void storageFailureIsLoggedNotThrown() {
        when(permissionCache.refresh()).thenThrow(new QueryTimeoutException("slow"));

        assertThatCode(scheduler::refreshPeriodically).doesNotThrowAnyException();
        assertThatCode(scheduler::loadOnStartup).doesNotThrowAnyException();
        verify(permissionCache, times(2)).refresh();
    }
}
