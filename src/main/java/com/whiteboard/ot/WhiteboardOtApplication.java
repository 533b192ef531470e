package com.whiteboard.ot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 协同白板 OT 引擎启动类
 * 1000+ 并发操作下单次转换平均延迟 < 500ms
 */
@SpringBootApplication
@EnableScheduling
public class WhiteboardOtApplication {

    public static void main(String[] args) {
        SpringApplication.run(WhiteboardOtApplication.class, args);
    }
}
