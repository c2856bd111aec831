package cn.bafuka.timecache.example.web;

import cn.bafuka.timecache.core.CacheSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.util.UUID;

/**
 * 为每个请求打开一个缓存会话，请求结束时关闭（写回延迟修改）
 */
@Slf4j
@Component
public class CacheSessionInterceptor implements HandlerInterceptor {

    public static final String USER_HEADER = "X-User-Id";

    private static final String SESSION_ATTRIBUTE = CacheSession.class.getName();

    public static CacheSession currentSession(HttpServletRequest request) {
        CacheSession session = (CacheSession) request.getAttribute(SESSION_ATTRIBUTE);
        if (session == null) {
            throw new IllegalStateException("No cache session bound to request " + request.getRequestURI());
        }
        return session;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        CacheSession session = CacheSession.builder()
                .sessionId(UUID.randomUUID().toString())
                .userId(request.getHeader(USER_HEADER))
                .build();
        request.setAttribute(SESSION_ATTRIBUTE, session);
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        CacheSession session = (CacheSession) request.getAttribute(SESSION_ATTRIBUTE);
        if (session != null) {
            session.close();
            request.removeAttribute(SESSION_ATTRIBUTE);
        }
    }
}
