package com.explify.sidecar.filter;

import com.explify.sidecar.config.ModeConfig;
import com.explify.sidecar.exception.NotAvailableException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Hides the compliance surface in local mode. Admin, consent and account routes answer 404 before
 * identity resolution runs. Usage reporting lives under {@code /admin} but is posted by every
 * client, so it stays reachable and is acknowledged without being stored.
 */
@Component
public class NetworkedRouteFilter extends OncePerRequestFilter {
    static final List<String> NETWORKED_ONLY_PREFIXES = List.of("/admin", "/baa", "/account");
    static final List<String> ALWAYS_AVAILABLE = List.of("/admin/usage/log");

    private final ModeConfig modeConfig;

    public NetworkedRouteFilter(ModeConfig modeConfig) {
        this.modeConfig = modeConfig;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return this.modeConfig.isNetworked();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain) throws ServletException, IOException {
        if (isNetworkedOnly(request.getRequestURI())) {
            JsonErrorResponses.write(response, HttpServletResponse.SC_NOT_FOUND, NotAvailableException.DEFAULT_MESSAGE);
            return;
        }
        chain.doFilter(request, response);
    }

    static boolean isNetworkedOnly(String path) {
        if (path == null || ALWAYS_AVAILABLE.contains(path)) {
            return false;
        }
        for (String prefix : NETWORKED_ONLY_PREFIXES) {
            if (path.equals(prefix) || path.startsWith(prefix + "/")) {
                return true;
            }
        }
        return false;
    }
}
