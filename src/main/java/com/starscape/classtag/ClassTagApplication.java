package com.starscape.classtag;

import com.starscape.classtag.common.config.ClientIpProperties;
import com.starscape.classtag.common.config.RateLimitProperties;
import com.starscape.classtag.common.config.TaggingProperties;
import com.starscape.classtag.common.config.TokenProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
    TokenProperties.class,
    TaggingProperties.class,
    RateLimitProperties.class,
    ClientIpProperties.class
})
public class ClassTagApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClassTagApplication.class, args);
    }
}
