package com.phillippitts.callbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        com.phillippitts.callbridge.config.properties.WebhookProperties.class,
        com.phillippitts.callbridge.config.properties.RealtimeProperties.class,
        com.phillippitts.callbridge.config.properties.CallAcceptProperties.class,
        com.phillippitts.callbridge.config.properties.GreetingProperties.class,
        com.phillippitts.callbridge.config.properties.FunctionStreamProperties.class,
        com.phillippitts.callbridge.config.properties.ConfigDataProperties.class
})
@EnableScheduling
public class CallBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(CallBridgeApplication.class, args);
    }

}
