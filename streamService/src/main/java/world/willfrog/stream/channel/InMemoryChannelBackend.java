package world.willfrog.stream.channel;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import world.willfrog.stream.config.RunStreamProperties;

import java.time.Clock;

@Component
@RequiredArgsConstructor
public class InMemoryChannelBackend implements ChannelBackend {

    private final RunStreamProperties properties;
    private final Clock clock;

    @Override
    public String name() {
        return InMemoryRunChannel.BACKEND_NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public RunChannel create(String runId) {
        return new InMemoryRunChannel(runId, properties.getChannel().getInMemoryPollTimeout(), clock);
    }
}
