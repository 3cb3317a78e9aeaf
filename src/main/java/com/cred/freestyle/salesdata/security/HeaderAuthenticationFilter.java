package com.cred.freestyle.salesdata.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Authenticates admin API callers from headers set by the gateway in front of the service.
 *
 * - X-User-Id: caller identifier; requests without it stay anonymous
 * - X-User-Role: caller role, defaults to USER; only ADMIN may call the generator
 *
 * @author Sales Data Team
 */
public class HeaderAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(HeaderAuthenticationFilter.class);

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    private static final String DEFAULT_ROLE = "USER";
    private static final String ROLE_PREFIX = "ROLE_";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String userId = request.getHeader(USER_ID_HEADER);

        if (userId != null && !userId.isBlank()) {
            String authority = toAuthority(request.getHeader(USER_ROLE_HEADER));

            UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                    userId.trim(), null, List.of(new SimpleGrantedAuthority(authority)));
            SecurityContextHolder.getContext().setAuthentication(authentication);

            logger.debug("Authenticated caller {} as {}", userId, authority);
        } else {
            logger.debug("No {} header on {}, request stays anonymous", USER_ID_HEADER, request.getRequestURI());
        }

        filterChain.doFilter(request, response);
    }

    static String toAuthority(String role) {
        String normalized = role == null || role.isBlank() ? DEFAULT_ROLE : role.trim().toUpperCase(Locale.ROOT);
        return normalized.startsWith(ROLE_PREFIX) ? normalized : ROLE_PREFIX + normalized;
    }
}
