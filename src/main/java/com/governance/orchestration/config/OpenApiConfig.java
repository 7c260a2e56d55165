package com.governance.orchestration.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI 3.0 文档配置
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("扫描规则编排服务 API")
                .version("1.0.0")
                .description("""
                    数据治理扫描规则编排服务 API 文档

                    ## 核心能力
                    - 复杂度评估 + 策略选择 + 资源分配，生成可审计的执行计划
                    - 依赖感知的工作流执行，按步骤超时、重试与取消
                    - 四种执行模式：AUTONOMOUS / SUPERVISED / HYBRID / MANUAL

                    ## 运行期治理
                    - 阈值告警，同类告警原地更新不重复创建
                    - 规则参数自适应，每次变更附带回滚计划
                    - 基于历史执行的性能预测
                    """)
                .contact(new Contact()
                    .name("Data Governance Team")
                    .email("governance-team@example.com"))
                .license(new License()
                    .name("Apache 2.0")
                    .url("https://www.apache.org/licenses/LICENSE-2.0")))
            .servers(List.of(
                new Server().url("http://localhost:8080").description("本地开发环境")
            ));
    }
}
