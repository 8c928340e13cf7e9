package com.contentcuration.curator.service.rating;

import com.contentcuration.curator.config.CuratorProperties;
import com.contentcuration.curator.exception.CollaboratorException;
import com.contentcuration.curator.service.process.ExternalCommandRunner;
import com.contentcuration.curator.service.process.ExternalCommandRunner.CommandResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rates content by piping it into the Fabric CLI with the configured pattern.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FabricRatingClient implements RatingClient {

    private static final String COLLABORATOR = "fabric";

    private final ExternalCommandRunner commandRunner;
    private final CuratorProperties properties;

    @Override
    public String rate(String composedInput) {
        CuratorProperties.Rating settings = properties.getRating();

        List<String> command = new ArrayList<>();
        command.add(settings.getCommand());
        command.add("--pattern");
        command.add(settings.getPattern());
        if (settings.getModel() != null && !settings.getModel().isBlank()) {
            command.add("--model");
            command.add(settings.getModel());
        }

        CommandResult result = commandRunner.run(COLLABORATOR, command, composedInput, null, settings.getTimeout());
        if (!result.succeeded()) {
            throw CollaboratorException.exitCode(COLLABORATOR, result.exitCode(), result.stderr());
        }
        log.debug("Fabric returned {} chars", result.stdout().length());
        return result.stdout();
    }
}
