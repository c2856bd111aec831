package cn.bafuka.timecache.example;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * TimeCache 示例应用启动类
 */
@SpringBootApplication
@MapperScan("cn.bafuka.timecache.example.mapper")
public class TimeCacheExampleApplication {

    public static void main(String[] args) {
        SpringApplication.run(TimeCacheExampleApplication.class, args);
        System.out.println("\n========================================");
        System.out.println("  TimeCache Example Application Started!");
        System.out.println("  Top posts: http://localhost:8080/api/posts/top?halfLife=day");
        System.out.println("========================================\n");
    }
}
