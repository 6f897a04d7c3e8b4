package com.yizhaoqi.filevault.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yizhaoqi.filevault.config.LoggingInterceptor;
import com.yizhaoqi.filevault.config.SecurityConfig;
import com.yizhaoqi.filevault.config.SessionAuthenticationFilter;
import com.yizhaoqi.filevault.config.WebConfig;
import com.yizhaoqi.filevault.exception.CustomException;
import com.yizhaoqi.filevault.model.FileDocument;
import com.yizhaoqi.filevault.model.FileType;
import com.yizhaoqi.filevault.model.User;
import com.yizhaoqi.filevault.service.FileService;
import com.yizhaoqi.filevault.service.SessionService;
import com.yizhaoqi.filevault.service.UserService;
import org.apache.commons.codec.binary.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;


@WebMvcTest(controllers = {AuthController.class, UserController.class, FilesController.class})
@Import({SecurityConfig.class, SessionAuthenticationFilter.class, WebConfig.class, LoggingInterceptor.class})
class AuthControllerTest {

    private static final String FILE_ID = "000000000000000000000002";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private SessionService sessionService;

    @MockBean
    private UserService userService;

    @MockBean
    private FileService fileService;

    // token -> user id, standing in for the Redis keys
    private final Map<String, Long> sessions = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() {
        User user = new User();
        user.setId(5L);
        user.setEmail("bob@dylan.com");

        when(userService.authenticateUser("bob@dylan.com", "toto1234!")).thenReturn(user);
        when(userService.authenticateUser("bob@dylan.com", "wrong")).thenThrow(CustomException.unauthorized());
        when(userService.findById(5L)).thenReturn(Optional.of(user));

        when(sessionService.createSession(anyLong())).thenAnswer(invocation -> {
            String token = UUID.randomUUID().toString();
            sessions.put(token, invocation.getArgument(0));
            return token;
        });
        when(sessionService.resolve(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(sessions.get((String) invocation.getArgument(0))));
        doAnswer(invocation -> sessions.remove((String) invocation.getArgument(0)))
                .when(sessionService).revoke(anyString());

        FileDocument file = new FileDocument();
        file.setId(2L);
        file.setUserId(5L);
        file.setName("notes.txt");
        file.setType(FileType.FILE);
        file.setPublic(false);
        when(fileService.findById(2L)).thenReturn(Optional.of(file));
    }

    private static String basic(String credentials) {
        return "Basic " + Base64.encodeBase64String(credentials.getBytes(StandardCharsets.UTF_8));
    }

    private String connect() throws Exception {
        String body = mockMvc.perform(get("/connect")
                        .header(HttpHeaders.AUTHORIZATION, basic("bob@dylan.com:toto1234!")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token").isString())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body).get("token").asText();
    }

    @Test
    void testConnectThenReadOwnFile() throws Exception {
        String token = connect();

        mockMvc.perform(get("/files/" + FILE_ID).header(SessionAuthenticationFilter.TOKEN_HEADER, token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value("000000000000000000000005"))
                .andExpect(jsonPath("$.name").value("notes.txt"));

        mockMvc.perform(get("/users/me").header(SessionAuthenticationFilter.TOKEN_HEADER, token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("000000000000000000000005"))
                .andExpect(jsonPath("$.email").value("bob@dylan.com"));
    }

    @Test
    void testDisconnectRevokesToken() throws Exception {
        String token = connect();

        mockMvc.perform(get("/disconnect").header(SessionAuthenticationFilter.TOKEN_HEADER, token))
                .andExpect(status().isNoContent());
        verify(sessionService).revoke(token);
        assertFalse(sessions.containsKey(token));

        mockMvc.perform(get("/files/" + FILE_ID).header(SessionAuthenticationFilter.TOKEN_HEADER, token))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Unauthorized"));

        mockMvc.perform(get("/disconnect").header(SessionAuthenticationFilter.TOKEN_HEADER, token))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void testProtectedRoutesWithoutValidToken() throws Exception {
        mockMvc.perform(get("/files/" + FILE_ID))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Unauthorized"));

        mockMvc.perform(get("/users/me").header(SessionAuthenticationFilter.TOKEN_HEADER, "not-a-session"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Unauthorized"));

        mockMvc.perform(get("/files").header(SessionAuthenticationFilter.TOKEN_HEADER, " "))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(fileService);
    }

    @Test
    void testConnectRejectsBadCredentials() throws Exception {
        mockMvc.perform(get("/connect"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Unauthorized"));

        mockMvc.perform(get("/connect").header(HttpHeaders.AUTHORIZATION, "Bearer abc"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/connect").header(HttpHeaders.AUTHORIZATION, basic("bob@dylan.com")))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/connect").header(HttpHeaders.AUTHORIZATION, "Basic %%%"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/connect").header(HttpHeaders.AUTHORIZATION, basic("bob@dylan.com:wrong")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Unauthorized"));

        verify(sessionService, never()).createSession(anyLong());
    }
}
