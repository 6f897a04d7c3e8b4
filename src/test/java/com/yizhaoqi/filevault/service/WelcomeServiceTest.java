package com.yizhaoqi.filevault.service;

import com.yizhaoqi.filevault.exception.FatalJobException;
import com.yizhaoqi.filevault.exception.JobException;
import com.yizhaoqi.filevault.model.User;
import com.yizhaoqi.filevault.model.WelcomeTask;
import com.yizhaoqi.filevault.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;


class WelcomeServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private NotificationSink notificationSink;

    private WelcomeService welcomeService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        welcomeService = new WelcomeService(userRepository, notificationSink);
    }

    private User user() {
        User user = new User();
        user.setId(5L);
        user.setEmail("bob@dylan.com");
        return user;
    }

    @Test
    void testSendWelcome_DeliversToUserEmail() {
        when(userRepository.findById(5L)).thenReturn(Optional.of(user()));

        welcomeService.sendWelcome(new WelcomeTask(5L));

        verify(notificationSink).send(eq("bob@dylan.com"), eq("Welcome to FileVault"), contains("bob@dylan.com"));
    }

    @Test
    void testSendWelcome_MalformedTasksAreFatal() {
        FatalJobException noUserId = assertThrows(FatalJobException.class,
                () -> welcomeService.sendWelcome(new WelcomeTask(null)));
        assertEquals("Missing userId", noUserId.getMessage());

        when(userRepository.findById(9L)).thenReturn(Optional.empty());
        FatalJobException unknown = assertThrows(FatalJobException.class,
                () -> welcomeService.sendWelcome(new WelcomeTask(9L)));
        assertEquals("User not found", unknown.getMessage());
        verifyNoInteractions(notificationSink);
    }

    @Test
    void testSendWelcome_DeliveryFailureIsRetryable() {
        when(userRepository.findById(5L)).thenReturn(Optional.of(user()));
        doThrow(new IllegalStateException("smtp down"))
                .when(notificationSink).send(anyString(), anyString(), anyString());

        JobException exception = assertThrows(JobException.class,
                () -> welcomeService.sendWelcome(new WelcomeTask(5L)));
        assertFalse(exception instanceof FatalJobException);
    }
}
