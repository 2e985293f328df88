package com.testfleet.dispatch.cli;

import com.testfleet.core.config.TestfleetProperties;
import com.testfleet.core.identity.BuildIdentityResolver;
import com.testfleet.core.identity.IdentityException;
import com.testfleet.core.model.BuildNumberSource;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: testfleet identity
 * <p>
 * Resolves and prints the build identity the next run would report.
 */
@Command(name = "identity", mixinStandardHelpOptions = true,
        description = "Show the build identity of the working tree")
@Component
public class IdentityCommand implements Callable<Integer> {

    private final BuildIdentityResolver resolver;
    private final TestfleetProperties properties;

    public IdentityCommand(BuildIdentityResolver resolver, TestfleetProperties properties) {
        this.resolver = resolver;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        try {
            var identity = resolver.resolve();
            var source = BuildNumberSource.parse(properties.getIdentity().getBuildNumberSource());
            System.out.println("Commit count:  " + identity.commitCount());
            System.out.println("Revision:      " + identity.shortRevision());
            System.out.println("Build number:  " + identity.buildNumber(source) + " (" + source + ")");
            return 0;
        } catch (IdentityException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
