package com.yizhaoqi.filevault.config;

import com.yizhaoqi.filevault.model.User;
import com.yizhaoqi.filevault.service.SessionService;
import com.yizhaoqi.filevault.service.UserService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the {@code X-Token} header to a user. On success the user id is
 * exposed as the {@code userId} request attribute and the security context
 * is populated; otherwise the request continues anonymously.
 */
@Component
public class SessionAuthenticationFilter extends OncePerRequestFilter {

    public static final String TOKEN_HEADER = "X-Token";
    public static final String USER_ID_ATTRIBUTE = "userId";
    public static final String TOKEN_ATTRIBUTE = "token";

    @Autowired
    private SessionService sessionService;

    @Autowired
    private UserService userService;


    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String token = request.getHeader(TOKEN_HEADER);
        if (token != null && !token.isBlank()) {
            Optional<User> user = sessionService.resolve(token).flatMap(userService::findById);
            if (user.isPresent()) {
                Long userId = user.get().getId();
                request.setAttribute(USER_ID_ATTRIBUTE, userId);
                request.setAttribute(TOKEN_ATTRIBUTE, token);

                UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                        user.get().getEmail(), null, List.of(new SimpleGrantedAuthority("ROLE_USER")));
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } else {
                logger.debug("Rejected unknown or expired session token");
            }
        }
        filterChain.doFilter(request, response);
    }
}
