package world.willfrog.stream.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import world.willfrog.agentstream.common.wire.WirePayloadCodec;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(RunStreamProperties.class)
public class RunStreamConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService runExecutor(RunStreamProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getExecution().getMaxConcurrency()));
    }

    @Bean
    public WirePayloadCodec wirePayloadCodec(ObjectMapper objectMapper) {
        return new WirePayloadCodec(objectMapper);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
