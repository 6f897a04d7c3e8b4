package com.yizhaoqi.filevault.consumer;

import com.yizhaoqi.filevault.exception.FatalJobException;
import com.yizhaoqi.filevault.exception.JobException;
import com.yizhaoqi.filevault.model.ThumbnailTask;
import com.yizhaoqi.filevault.model.WelcomeTask;
import com.yizhaoqi.filevault.service.ThumbnailService;
import com.yizhaoqi.filevault.service.WelcomeService;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;


class ThumbnailConsumerTest {

    @Test
    void testProcessTask_DelegatesToService() {
        ThumbnailService thumbnailService = mock(ThumbnailService.class);
        ThumbnailTask task = new ThumbnailTask(2L, 1L);

        new ThumbnailConsumer(thumbnailService).processTask(task);

        verify(thumbnailService).generate(task);
    }

    @Test
    void testProcessTask_FailuresReachTheErrorHandler() {
        ThumbnailService thumbnailService = mock(ThumbnailService.class);
        ThumbnailTask task = new ThumbnailTask(2L, 1L);
        doThrow(new JobException("disk full")).when(thumbnailService).generate(task);

        assertThrows(JobException.class, () -> new ThumbnailConsumer(thumbnailService).processTask(task));
    }

    @Test
    void testWelcomeConsumer_FatalFailuresAreRethrown() {
        WelcomeService welcomeService = mock(WelcomeService.class);
        WelcomeTask task = new WelcomeTask(9L);
        doThrow(new FatalJobException("User not found")).when(welcomeService).sendWelcome(task);

        assertThrows(FatalJobException.class, () -> new WelcomeEmailConsumer(welcomeService).processTask(task));
    }
}
