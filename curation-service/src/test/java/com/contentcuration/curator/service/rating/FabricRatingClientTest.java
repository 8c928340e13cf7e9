package com.contentcuration.curator.service.rating;

import com.contentcuration.curator.config.CuratorProperties;
import com.contentcuration.curator.exception.CollaboratorException;
import com.contentcuration.curator.service.process.ExternalCommandRunner;
import com.contentcuration.curator.service.process.ExternalCommandRunner.CommandResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FabricRatingClientTest {

    @Mock
    private ExternalCommandRunner commandRunner;

    @Test
    @DisplayName("Composed input is piped to the pattern, with the model when configured")
    void pipesInputToPattern() {
        // given
        CuratorProperties properties = new CuratorProperties();
        properties.getRating().setModel("gpt-4o");
        FabricRatingClient client = new FabricRatingClient(commandRunner, properties);
        when(commandRunner.run("fabric", List.of("fabric", "--pattern", "rate_content", "--model", "gpt-4o"),
                "Title: x", null, Duration.ofSeconds(60)))
                .thenReturn(new CommandResult(0, "S Tier:", ""));

        // when
        String output = client.rate("Title: x");

        // then
        assertThat(output).isEqualTo("S Tier:");
    }

    @Test
    @DisplayName("A non-zero exit is a transport failure, distinct from a parse error")
    void nonZeroExitFails() {
        // given
        FabricRatingClient client = new FabricRatingClient(commandRunner, new CuratorProperties());
        when(commandRunner.run(eq("fabric"), anyList(), eq("in"), isNull(), any()))
                .thenReturn(new CommandResult(2, "", "no API key"));

        // when / then
        assertThatThrownBy(() -> client.rate("in"))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("no API key");
    }
}
