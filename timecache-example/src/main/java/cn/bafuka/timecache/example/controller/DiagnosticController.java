package cn.bafuka.timecache.example.controller;

import cn.bafuka.timecache.config.TimeCacheProperties;
import cn.bafuka.timecache.core.CacheStats;
import cn.bafuka.timecache.example.entity.Post;
import cn.bafuka.timecache.tier.TierCacheManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * 诊断控制器
 * 用于查看 TimeCache 的运行状态和配置
 */
@Slf4j
@RestController
@RequestMapping("/api/diagnostic")
public class DiagnosticController {

    @Autowired
    private TierCacheManager<Post> postCacheManager;

    @Autowired
    private TimeCacheProperties properties;

    /**
     * 查看缓存统计
     */
    @GetMapping("/stats")
    public Map<String, Object> getStats() {
        CacheStats stats = postCacheManager.getStats();

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("stats", stats);
        result.put("hitRate", stats.hitRate());
        return result;
    }

    /**
     * 查看当前配置
     */
    @GetMapping("/config")
    public Map<String, Object> getConfig() {
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("deploymentVersion", properties.getDeploymentVersion());
        result.put("distributed", properties.getDistributed());
        result.put("limiter", properties.getLimiter());
        result.put("ledger", properties.getLedger());
        return result;
    }
}
