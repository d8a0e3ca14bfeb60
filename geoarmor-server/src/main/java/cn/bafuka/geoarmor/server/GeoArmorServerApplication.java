package cn.bafuka.geoarmor.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 共享位置缓存服务启动类
 */
@SpringBootApplication
public class GeoArmorServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeoArmorServerApplication.class, args);
        System.out.println("\n========================================");
        System.out.println("  GeoArmor Location Server Started!");
        System.out.println("  Health check: http://localhost:8000/healthcheck");
        System.out.println("========================================\n");
    }
}
