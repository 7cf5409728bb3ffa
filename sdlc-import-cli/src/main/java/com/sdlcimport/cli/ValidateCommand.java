package com.sdlcimport.cli;

import com.sdlcimport.core.validator.OutputLayoutValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check the artifacts of a previous import run.
 *
 * <p>Re-parses every YAML artifact and checks the required layout. Exits 0 when valid,
 * 1 otherwise.
 */
@Command(
    name = "validate",
    description = "Re-parse the generated artifacts and check the output layout",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Output directory to validate", defaultValue = "sdlc-import")
    private Path outputDirectory;

    @Override
    public Integer call() {
        log.info("Validating output: {}", outputDirectory);
        List<String> problems;
        try {
            problems = new OutputLayoutValidator().validate(outputDirectory);
        } catch (IOException e) {
            log.error("Cannot read {}", outputDirectory, e);
            System.err.println("✗ Cannot read " + outputDirectory + ": " + e.getMessage());
            return 1;
        }

        if (problems.isEmpty()) {
            System.out.println("✓ Output is valid: " + outputDirectory);
            return 0;
        }
        System.err.println("✗ Found " + problems.size() + " problem(s) in " + outputDirectory + ":");
        problems.forEach(problem -> System.err.println("  - " + problem));
        return 1;
    }
}
