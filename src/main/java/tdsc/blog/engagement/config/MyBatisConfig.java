package tdsc.blog.engagement.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;

/**
 * MyBatis configuration class
 * Mapper XML locations and type handler package are set in application.yml
 */
@Configuration
@MapperScan("tdsc.blog.engagement.mapper")
public class MyBatisConfig {
}
