package com.smancode.companion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Thinking Companion - 回复等待期间的思考过程模拟服务启动类
 */
@SpringBootApplication
public class CompanionApplication {

    public static void main(String[] args) {
        SpringApplication.run(CompanionApplication.class, args);

        // 启动成功后打印醒目标志
        printStartedBanner();
    }

    private static void printStartedBanner() {
        System.out.println("""

                ====================================================
                  THINKING COMPANION STARTED   ws: /ws/thinking
                ====================================================
                """);
    }
}
