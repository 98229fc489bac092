package com.project.graph.digitizer.cli;

import com.project.graph.digitizer.DTOs.DigitizationResult;
import com.project.graph.digitizer.exceptions.DigitizationException;
import com.project.graph.digitizer.service.DigitizationService;
import com.project.graph.digitizer.service.SampleCsvWriter;
import com.project.graph.digitizer.service.TracePlotRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.awt.AWTError;
import java.awt.HeadlessException;
import java.io.IOException;
import java.io.PrintStream;

/**
 * Command-line mode: digitize one image, write the CSV, optionally show the plot.
 * Does nothing when started without a positional argument (web mode).
 */
@Component
public class DigitizerCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(DigitizerCommandLineRunner.class);

    private final DigitizationService digitizationService;
    private final SampleCsvWriter csvWriter;
    private final TracePlotRenderer plotRenderer;
    private final PrintStream out;

    private int exitCode;

    @Autowired
    public DigitizerCommandLineRunner(DigitizationService digitizationService, SampleCsvWriter csvWriter,
                                      TracePlotRenderer plotRenderer) {
        this(digitizationService, csvWriter, plotRenderer, System.out);
    }

    public DigitizerCommandLineRunner(DigitizationService digitizationService, SampleCsvWriter csvWriter,
                                      TracePlotRenderer plotRenderer, PrintStream out) {
        this.digitizationService = digitizationService;
        this.csvWriter = csvWriter;
        this.plotRenderer = plotRenderer;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        String[] raw = args.getSourceArgs();
        if (!CommandLineOptions.hasPositionalArgument(raw)) {
            return;
        }
        exitCode = execute(raw);
    }

    /** @return the process exit code, 0 on success */
    public int execute(String[] args) {
        try {
            CommandLineOptions options = CommandLineOptions.parse(args, digitizationService.getSettings().defaultOutput());
            DigitizationResult result = digitizationService.digitize(options.image(), null);

            csvWriter.write(result.samples(), options.output());
            out.println("Normalized data saved to '" + options.output() + "'");

            if (options.showPlot()) {
                return showPlot(result);
            }
            return 0;
        } catch (DigitizationException | IllegalArgumentException | IllegalStateException e) {
            log.debug("Command failed", e);
            out.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.debug("Writing output failed", e);
            out.println("Error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            out.println("Error: interrupted while showing the plot");
            return 1;
        }
    }

    // the CSV is already written; a missing display only fails the plot
    private int showPlot(DigitizationResult result) throws InterruptedException {
        try {
            plotRenderer.show(result.samples());
            return 0;
        } catch (HeadlessException | AWTError | LinkageError e) {
            log.debug("Plot window failed", e);
            out.println("Error: cannot show the plot: " + e);
            return 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
